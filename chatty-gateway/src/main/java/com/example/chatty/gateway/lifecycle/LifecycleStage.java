package com.example.chatty.gateway.lifecycle;

/**
 * One step of gateway startup. Stages are started in a fixed order by
 * {@link GatewayLifecycleController} and stopped in the reverse order.
 */
public interface LifecycleStage {

    String stageName();

    /**
     * Brings the stage up. Returns only once the stage is ready; any exception aborts startup.
     */
    void start();

    void stop();
}
