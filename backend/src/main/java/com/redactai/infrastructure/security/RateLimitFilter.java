package com.redactai.infrastructure.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Per-client token-bucket rate limiting for the API. Detection, which fans out to the model,
 * has a tighter budget than every other endpoint.
 */
@Slf4j
@Component
@Order(1)
public class RateLimitFilter extends OncePerRequestFilter {

    static final String DETECT_PATH = "/api/v1/pii/detect";

    @Value("${rate-limit.enabled:true}")
    private boolean enabled = true;

    @Value("${rate-limit.detect-rpm:20}")
    private int detectRpm = 20;

    @Value("${rate-limit.default-rpm:100}")
    private int defaultRpm = 100;

    private final Cache<String, Bucket> bucketCache = Caffeine.newBuilder()
            .maximumSize(10_000L)
            .expireAfterAccess(1L, TimeUnit.HOURS)
            .build();

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !enabled || !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        boolean detect = DETECT_PATH.equals(request.getRequestURI());
        int allowedRpm = detect ? detectRpm : defaultRpm;
        String key = (detect ? "detect:" : "default:") + resolveClientId(request);

        Bucket bucket = bucketCache.get(key, k -> createBucket(allowedRpm));
        if (bucket.tryConsume(1L)) {
            response.setHeader("X-RateLimit-Limit", String.valueOf(allowedRpm));
            response.setHeader("X-RateLimit-Remaining", String.valueOf(bucket.getAvailableTokens()));
            chain.doFilter(request, response);
            return;
        }

        log.warn("[RateLimit] Limit exceeded for {} on {}", key, request.getRequestURI());
        response.setStatus(429);
        response.setContentType("application/json");
        response.setHeader("Retry-After", "60");
        response.setHeader("X-RateLimit-Limit", String.valueOf(allowedRpm));
        response.setHeader("X-RateLimit-Remaining", "0");
        response.getWriter().write(
                "{\"code\":\"RATE_LIMITED\",\"message\":\"Too many requests. Please try again later.\"}");
    }

    private Bucket createBucket(int requestsPerMinute) {
        long capacity = requestsPerMinute;
        Bandwidth limit = Bandwidth.builder()
                .capacity(capacity)
                .refillGreedy(capacity, Duration.ofMinutes(1L))
                .build();
        return Bucket.builder().addLimit(limit).build();
    }

    /**
     * First X-Forwarded-For hop, then X-Real-IP, then the socket address.
     */
    static String resolveClientId(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        String remote = request.getRemoteAddr();
        return remote != null ? remote : "unknown-client";
    }
}
