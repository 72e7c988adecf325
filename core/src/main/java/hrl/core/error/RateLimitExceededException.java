package hrl.core.error;

import hrl.core.model.LimitStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raised when one or more limits would be exceeded.
 *
 * <p>Carries the status of every limit that was checked, passed and failed alike,
 * so callers can render a retry-after response or back off. The primary violation
 * is the one with the longest wait; its wait is the exception's retry-after.
 */
public class RateLimitExceededException extends RateLimiterException {

    private final List<LimitStatus> statuses;
    private final List<LimitStatus> violations;
    private final List<LimitStatus> passed;
    private final LimitStatus primaryViolation;

    public RateLimitExceededException(List<LimitStatus> statuses) {
        super(formatMessage(statuses));
        this.statuses = List.copyOf(statuses);
        this.violations = this.statuses.stream().filter(LimitStatus::exceeded).collect(Collectors.toUnmodifiableList());
        this.passed = this.statuses.stream().filter(s -> !s.exceeded()).collect(Collectors.toUnmodifiableList());
        this.primaryViolation = primary(this.statuses);
    }

    public List<LimitStatus> statuses() {
        return statuses;
    }

    public List<LimitStatus> violations() {
        return violations;
    }

    public List<LimitStatus> passed() {
        return passed;
    }

    public LimitStatus primaryViolation() {
        return primaryViolation;
    }

    public double retryAfterSeconds() {
        return primaryViolation.retryAfterSeconds();
    }

    public long retryAfterMillis() {
        return Math.round(retryAfterSeconds() * 1000);
    }

    /** Value for an HTTP Retry-After header: whole seconds, rounded up. */
    public String retryAfterHeader() {
        return Long.toString((long) retryAfterSeconds() + 1);
    }

    /**
     * Body for a 429 response. Keys are stable and never include store details.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "rate_limit_exceeded");
        body.put("message", getMessage());
        body.put("retry_after_seconds", retryAfterSeconds());
        body.put("retry_after_ms", retryAfterMillis());
        List<Map<String, Object>> limits = new ArrayList<>();
        for (LimitStatus s : statuses) {
            Map<String, Object> limit = new LinkedHashMap<>();
            limit.put("entity_id", s.entityId());
            limit.put("resource", s.resource());
            limit.put("limit_name", s.limitName());
            limit.put("capacity", s.limit().capacity());
            limit.put("burst", s.limit().burst());
            limit.put("available", s.available());
            limit.put("requested", s.requested());
            limit.put("exceeded", s.exceeded());
            limit.put("retry_after_seconds", s.retryAfterSeconds());
            limits.add(limit);
        }
        body.put("limits", limits);
        return body;
    }

    private static LimitStatus primary(List<LimitStatus> statuses) {
        return statuses.stream()
            .filter(LimitStatus::exceeded)
            .max(Comparator.comparingDouble(LimitStatus::retryAfterSeconds))
            .orElseThrow(() -> new IllegalArgumentException("RateLimitExceededException requires at least one violation"));
    }

    private static String formatMessage(List<LimitStatus> statuses) {
        LimitStatus v = primary(statuses);
        String names = statuses.stream()
            .filter(LimitStatus::exceeded)
            .map(LimitStatus::limitName)
            .collect(Collectors.joining(", "));
        return String.format(Locale.ROOT, "Rate limit exceeded for %s/%s: [%s]. Retry after %.1fs",
            v.entityId(), v.resource(), names, v.retryAfterSeconds());
    }
}
