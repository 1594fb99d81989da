package com.example.chatty.gateway.config;

import com.example.chatty.gateway.channel.ChannelConnectionManager;
import com.example.chatty.gateway.fanout.FanOutBridge;
import com.example.chatty.gateway.lifecycle.ConfigurationStage;
import com.example.chatty.gateway.lifecycle.GatewayLifecycleController;
import com.example.chatty.gateway.lifecycle.RequestPipelineStage;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class LifecycleConfig {

    @Bean
    public GatewayLifecycleController gatewayLifecycleController(ConfigurationStage configurationStage,
                                                                 RequestPipelineStage requestPipelineStage,
                                                                 ChannelConnectionManager channelConnectionManager,
                                                                 FanOutBridge fanOutBridge) {
        return new GatewayLifecycleController(List.of(configurationStage, requestPipelineStage, channelConnectionManager, fanOutBridge));
    }
}
