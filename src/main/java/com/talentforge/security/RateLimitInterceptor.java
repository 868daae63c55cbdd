package com.talentforge.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.talentforge.exception.RateLimitExceededException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket per (endpoint group, client IP), checked before any
 * signature or ledger work happens.
 *
 * <p>The client IP is {@link HttpServletRequest#getRemoteAddr()}. Behind a
 * proxy, set {@code server.forward-headers-strategy=native} so the container
 * resolves it from forwarding headers sent by trusted proxies only.
 */
@Slf4j
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final String ADMIN_PREFIX = "/api/admin/";

    // An idle bucket is full again after one refill interval
    private static final Duration IDLE_EXPIRY = Duration.ofMinutes(2);

    private final Cache<String, Bucket> buckets;

    private final boolean enabled;
    private final long webhookRequestsPerMinute;
    private final long adminRequestsPerMinute;

    public RateLimitInterceptor(@Value("${webhooks.rate-limit.enabled:true}") boolean enabled,
                                @Value("${webhooks.rate-limit.webhook-requests-per-minute:60}") long webhookRequestsPerMinute,
                                @Value("${webhooks.rate-limit.admin-requests-per-minute:30}") long adminRequestsPerMinute,
                                @Value("${webhooks.rate-limit.max-tracked-clients:10000}") long maxTrackedClients) {
        this.enabled = enabled;
        this.webhookRequestsPerMinute = webhookRequestsPerMinute;
        this.adminRequestsPerMinute = adminRequestsPerMinute;
        this.buckets = Caffeine.newBuilder()
                .maximumSize(maxTrackedClients)
                .expireAfterAccess(IDLE_EXPIRY)
                .build();
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!enabled) {
            return true;
        }

        String group = resolveGroup(request.getRequestURI());
        long limit = ADMIN_PREFIX.equals(group) ? adminRequestsPerMinute : webhookRequestsPerMinute;
        String key = group + ":" + request.getRemoteAddr();

        Bucket bucket = buckets.get(key, k -> newBucket(limit));
        ConsumptionProbe consumption = bucket.tryConsumeAndReturnRemaining(1);

        if (!consumption.isConsumed()) {
            long retryAfter = Math.max(1, TimeUnit.NANOSECONDS.toSeconds(consumption.getNanosToWaitForRefill()));
            log.warn("Rate limit exceeded for {} (retry in {}s)", key, retryAfter);
            throw new RateLimitExceededException(limit, retryAfter);
        }

        response.setHeader("X-RateLimit-Limit", String.valueOf(limit));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(consumption.getRemainingTokens()));
        return true;
    }

    long trackedClients() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }

    /**
     * Endpoint group: {@code /api/admin/} for the admin surface, otherwise the
     * first three path segments (e.g. {@code /api/webhooks/zoom}).
     */
    static String resolveGroup(String uri) {
        if (uri.startsWith(ADMIN_PREFIX)) {
            return ADMIN_PREFIX;
        }
        String[] segments = uri.split("/");
        StringBuilder group = new StringBuilder();
        for (int i = 1; i < segments.length && i <= 3; i++) {
            group.append('/').append(segments[i]);
        }
        return group.toString();
    }

    private Bucket newBucket(long perMinute) {
        Bandwidth limit = Bandwidth.classic(perMinute, Refill.intervally(perMinute, Duration.ofMinutes(1)));
        return Bucket.builder()
                .addLimit(limit)
                .build();
    }
}
