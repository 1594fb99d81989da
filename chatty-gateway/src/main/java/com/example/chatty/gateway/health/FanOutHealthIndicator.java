package com.example.chatty.gateway.health;

import com.example.chatty.gateway.fanout.FanOutBridge;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Reports the cross-instance fan-out as the {@code fanOut} health component.
 * Local delivery keeps working while the backbone is unreachable, so a degraded
 * bridge is not reported as {@code DOWN}.
 */
@Component
@RequiredArgsConstructor
public class FanOutHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Cross-instance fan-out unavailable, local delivery only");

    private final FanOutBridge fanOutBridge;

    @Override
    public Health health() {
        Map<String, Object> details = fanOutBridge.getHealthDetails();
        switch (fanOutBridge.getState()) {
            case CONNECTED:
                return Health.up().withDetails(details).build();
            case DEGRADED:
                return Health.status(DEGRADED).withDetails(details).build();
            case STOPPED:
            default:
                return Health.down().withDetails(details).build();
        }
    }
}
