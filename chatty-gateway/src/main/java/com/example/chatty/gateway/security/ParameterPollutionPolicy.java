package com.example.chatty.gateway.security;

import com.example.chatty.shared.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebExchangeDecorator;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.Set;

/**
 * Collapses repeated query and form keys to their last occurrence. Keys on the
 * whitelist keep every value. The discarded values stay available under
 * {@link Constants#QUERY_POLLUTED_ATTRIBUTE}.
 */
@Slf4j
public class ParameterPollutionPolicy implements SecurityPolicy {

    private final Set<String> whitelist;

    public ParameterPollutionPolicy(List<String> whitelist) {
        this.whitelist = Set.copyOf(whitelist);
    }

    @Override
    public String name() {
        return "parameter-pollution";
    }

    @Override
    public PolicyDecision apply(ServerWebExchange exchange) {
        ServerHttpRequest request = exchange.getRequest();
        URI uri = request.getURI();
        ServerWebExchange current = exchange;

        QueryStrings.Collapsed collapsed = QueryStrings.collapse(uri.getRawQuery(), whitelist);
        if (collapsed.isPolluted()) {
            log.debug("Collapsed repeated query keys {} on {}", collapsed.getPolluted().keySet(), request.getPath());
            URI rewritten = UriComponentsBuilder.fromUri(uri)
                    .replaceQuery(collapsed.getRawQuery())
                    .build(true)
                    .toUri();
            current = exchange.mutate().request(request.mutate().uri(rewritten).build()).build();
            current.getAttributes().put(Constants.QUERY_POLLUTED_ATTRIBUTE, collapsed.getPolluted());
        }

        if (MediaType.APPLICATION_FORM_URLENCODED.isCompatibleWith(request.getHeaders().getContentType())) {
            current = new FormCollapsingExchange(current, whitelist);
        }
        return PolicyDecision.proceed(current);
    }

    static MultiValueMap<String, String> collapse(MultiValueMap<String, String> values, Set<String> whitelist) {
        MultiValueMap<String, String> result = new LinkedMultiValueMap<>();
        values.forEach((key, list) -> {
            if (list.size() > 1 && !whitelist.contains(key)) {
                result.add(key, list.get(list.size() - 1));
            } else {
                result.put(key, list);
            }
        });
        return result;
    }

    private static final class FormCollapsingExchange extends ServerWebExchangeDecorator {

        private final Set<String> whitelist;

        private FormCollapsingExchange(ServerWebExchange delegate, Set<String> whitelist) {
            super(delegate);
            this.whitelist = whitelist;
        }

        @Override
        public Mono<MultiValueMap<String, String>> getFormData() {
            return super.getFormData().map(form -> collapse(form, whitelist));
        }
    }
}
