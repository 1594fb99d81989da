package com.example.chatty.gateway.config;

import com.example.chatty.shared.config.GatewayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.embedded.netty.NettyReactiveWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.netty.resources.LoopResources;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class NettyConfig {

    private final GatewayProperties gatewayProperties;

    @Bean
    public WebServerFactoryCustomizer<NettyReactiveWebServerFactory> nettyWebServerCustomizer() {
        return factory -> {
            String threadPrefix = gatewayProperties.getServer().getThreadPrefix() + "-http";
            LoopResources loopResources = LoopResources.create(threadPrefix, LoopResources.DEFAULT_IO_WORKER_COUNT, true);
            factory.addServerCustomizers(server -> server.runOn(loopResources));
            log.info("Customized Netty server with thread prefix '{}'", threadPrefix);
        };
    }
}
