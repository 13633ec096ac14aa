package com.nearbyproducts.filter;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nearbyproducts.config.AppProperties;
import com.nearbyproducts.dto.ApiResponse;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Fixed-window request limit per client address. Only the {@code /api/} endpoints are limited.
 *
 * <p>The key is the servlet remote address. Proxy headers are resolved upstream by
 * {@code server.forward-headers-strategy}, which only trusts configured proxies.
 */
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    private static class Counter {
        long windowStartMs;
        int count;
    }

    private final Map<String, Counter> buckets = new ConcurrentHashMap<>();
    private final long windowMs;
    private final int maxRequests;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RateLimitFilter(AppProperties appProperties, ObjectMapper objectMapper, Clock clock) {
        this.windowMs = appProperties.getRateLimit().getWindowMs();
        this.maxRequests = appProperties.getRateLimit().getMaxRequests();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
        throws ServletException, IOException {

        long now = clock.millis();
        Counter c = buckets.compute(request.getRemoteAddr(), (k, existing) -> {
            if (existing == null || now - existing.windowStartMs > windowMs) {
                Counter fresh = existing != null ? existing : new Counter();
                fresh.windowStartMs = now;
                fresh.count = 1;
                return fresh;
            }
            existing.count += 1;
            return existing;
        });

        if (c.count > maxRequests) {
            long retryAfterSeconds = Math.max(1, (c.windowStartMs + windowMs - now) / 1000);
            response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
            response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getWriter(), ApiResponse.error("Too many requests", null));
            return;
        }

        filterChain.doFilter(request, response);
    }
}
