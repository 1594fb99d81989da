package com.example.chatty.gateway.config;

import com.example.chatty.gateway.channel.ChannelConnectionManager;
import com.example.chatty.gateway.fanout.FanOutBridge;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MonitoringConfig {

    @Bean
    public MeterBinder gatewayMetrics(ChannelConnectionManager connectionManager, FanOutBridge fanOutBridge) {
        return registry -> {
            Gauge.builder("chatty.channel.connections.active", connectionManager, ChannelConnectionManager::getConnectionCount)
                    .description("Event channel connections attached to this instance")
                    .register(registry);
            Gauge.builder("chatty.fanout.degraded", fanOutBridge, bridge -> bridge.isDegraded() ? 1 : 0)
                    .description("1 while cross-instance fan-out is unavailable")
                    .register(registry);
            Gauge.builder("chatty.fanout.inbox.size", fanOutBridge, FanOutBridge::getInboxSize)
                    .description("Envelopes waiting for local dispatch")
                    .register(registry);
        };
    }
}
