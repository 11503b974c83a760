package com.chat.relay.service.dispatch;

import java.util.Locale;

/**
 * Granularity at which the webhook applied a rate limit, as reported by the
 * {@code X-RateLimit-Scope} header.
 */
public enum RateLimitScope {

    /**
     * Global limit across the whole application. Traffic must be reduced.
     */
    GLOBAL,

    /**
     * Shared resource limit, e.g. a channel also used by other bots.
     */
    SHARED,

    /**
     * Per-route limit of this webhook: we are sending too fast.
     */
    USER;

    /**
     * Parses a header value, defaulting to {@link #USER} when absent or unknown.
     */
    public static RateLimitScope fromHeader(String value) {
        if (value == null || value.isBlank()) {
            return USER;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "global" -> GLOBAL;
            case "shared" -> SHARED;
            default -> USER;
        };
    }
}
