package com.example.chatty.gateway.lifecycle;

import com.example.chatty.gateway.exception.ErrorNormalizer;
import com.example.chatty.gateway.security.SecurityGateFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import org.springframework.stereotype.Component;
import org.springframework.web.server.WebExceptionHandler;
import org.springframework.web.server.WebFilter;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Confirms the security gate and the error normalizer wrap the whole handler chain.
 * Both are global, so routes registered later are covered as well.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RequestPipelineStage implements LifecycleStage {

    private final List<WebFilter> webFilters;
    private final List<WebExceptionHandler> exceptionHandlers;

    @Override
    public String stageName() {
        return "request-pipeline";
    }

    @Override
    public void start() {
        List<WebFilter> filters = new ArrayList<>(webFilters);
        AnnotationAwareOrderComparator.sort(filters);
        SecurityGateFilter gate = filters.stream()
                .filter(SecurityGateFilter.class::isInstance)
                .map(SecurityGateFilter.class::cast)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Security gate filter is not registered"));

        List<WebExceptionHandler> handlers = new ArrayList<>(exceptionHandlers);
        AnnotationAwareOrderComparator.sort(handlers);
        if (handlers.isEmpty() || !(handlers.get(0) instanceof ErrorNormalizer)) {
            throw new IllegalStateException("Error normalizer must be the first exception handler, found " + simpleNames(handlers));
        }

        log.info("Request pipeline: filters {}, security policies {}, exception handlers {}",
                simpleNames(filters), gate.getPolicyNames(), simpleNames(handlers));
    }

    @Override
    public void stop() {
        log.debug("Request pipeline stage has nothing to release");
    }

    private static List<String> simpleNames(List<?> components) {
        return components.stream().map(component -> component.getClass().getSimpleName()).collect(Collectors.toList());
    }
}
