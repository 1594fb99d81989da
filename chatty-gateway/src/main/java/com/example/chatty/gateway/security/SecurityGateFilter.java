package com.example.chatty.gateway.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the ordered list of {@link SecurityPolicy} objects in front of every route and
 * event channel upgrade. The first policy that does not proceed ends the chain.
 */
@Slf4j
public class SecurityGateFilter implements WebFilter, Ordered {

    public static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

    private final List<SecurityPolicy> policies;

    public SecurityGateFilter(List<SecurityPolicy> policies) {
        this.policies = List.copyOf(policies);
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        return Mono.defer(() -> {
            ServerWebExchange current = exchange;
            for (SecurityPolicy policy : policies) {
                PolicyDecision decision = policy.apply(current);
                switch (decision.getAction()) {
                    case PROCEED:
                        current = decision.getExchange();
                        break;
                    case RESPOND:
                        log.debug("Policy '{}' answered {} {} with {}", policy.name(),
                                current.getRequest().getMethod(), current.getRequest().getPath(), decision.getStatus());
                        current.getResponse().setStatusCode(decision.getStatus());
                        return current.getResponse().setComplete();
                    case REJECT:
                        log.info("[GATE_REJECT] Policy '{}' rejected {} {}: {}", policy.name(),
                                current.getRequest().getMethod(), current.getRequest().getPath(),
                                decision.getFailure().getMessage());
                        return Mono.error(decision.getFailure());
                    default:
                        return Mono.error(new IllegalStateException("Unhandled policy action " + decision.getAction()));
                }
            }
            return chain.filter(current);
        });
    }

    public List<String> getPolicyNames() {
        return policies.stream().map(SecurityPolicy::name).collect(Collectors.toList());
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}
