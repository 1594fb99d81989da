package com.example.chatty.gateway.lifecycle;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.SmartLifecycle;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Starts the gateway stages in their fixed order and stops them in reverse.
 * <p>
 * Runs in a lifecycle phase below the embedded web server's, so every stage is up
 * before the listener accepts traffic and stays up until the server has drained.
 */
@Slf4j
public class GatewayLifecycleController implements SmartLifecycle, ApplicationListener<WebServerInitializedEvent> {

    public static final int PHASE = SmartLifecycle.DEFAULT_PHASE - 4096;

    private final List<LifecycleStage> stages;
    private final Deque<LifecycleStage> startedStages = new ArrayDeque<>();
    private volatile boolean running;

    public GatewayLifecycleController(List<LifecycleStage> stages) {
        this.stages = List.copyOf(stages);
    }

    @Override
    public synchronized void start() {
        long startNanos = System.nanoTime();
        log.info("[STARTUP] Starting gateway stages {} in process pid={}", getStageNames(), ProcessHandle.current().pid());

        for (LifecycleStage stage : stages) {
            log.info("[STARTUP] Stage '{}' starting...", stage.stageName());
            try {
                stage.start();
            } catch (RuntimeException e) {
                log.error("[STARTUP] Stage '{}' failed: {}", stage.stageName(), e.getMessage());
                stopStartedStages();
                throw new LifecycleStageException(stage.stageName(), e);
            }
            startedStages.push(stage);
            log.info("[STARTUP] Stage '{}' ready", stage.stageName());
        }

        running = true;
        log.info("[STARTUP] All gateway stages ready in {} ms", (System.nanoTime() - startNanos) / 1_000_000);
    }

    @Override
    public synchronized void stop() {
        log.info("[SHUTDOWN] Stopping gateway stages in reverse order...");
        stopStartedStages();
        running = false;
        log.info("[SHUTDOWN] Gateway stages stopped.");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        log.info("[STARTUP] Gateway listening on port {} (pid {})", event.getWebServer().getPort(), ProcessHandle.current().pid());
    }

    public List<String> getStageNames() {
        return stages.stream().map(LifecycleStage::stageName).collect(Collectors.toList());
    }

    private void stopStartedStages() {
        while (!startedStages.isEmpty()) {
            LifecycleStage stage = startedStages.pop();
            try {
                stage.stop();
                log.info("[SHUTDOWN] Stage '{}' stopped", stage.stageName());
            } catch (RuntimeException e) {
                log.error("[SHUTDOWN] Stage '{}' did not stop cleanly: {}", stage.stageName(), e.getMessage(), e);
            }
        }
    }
}
