package com.chat.relay.service.dispatch;

import java.time.Duration;

/**
 * Sealed interface for the result of one webhook delivery attempt.
 *
 * Closed hierarchy so the dispatch worker handles every variant explicitly.
 */
public sealed interface DispatchOutcome permits
        DispatchOutcome.Success,
        DispatchOutcome.RateLimited,
        DispatchOutcome.PermanentReject,
        DispatchOutcome.TransientFailure {

    static DispatchOutcome success() {
        return Success.INSTANCE;
    }

    /**
     * The webhook accepted the batch.
     */
    record Success() implements DispatchOutcome {
        static final Success INSTANCE = new Success();
    }

    /**
     * The webhook answered 429. Nothing may be sent before {@code retryAfter} elapses.
     */
    record RateLimited(Duration retryAfter, RateLimitScope scope) implements DispatchOutcome {
    }

    /**
     * The request can never succeed as is: the batch is abandoned.
     *
     * @param invalidEndpoint true when the webhook itself is unknown or unauthorized
     */
    record PermanentReject(int statusCode, String reason, boolean invalidEndpoint) implements DispatchOutcome {
    }

    /**
     * Server error, timeout or network failure. Retried after {@code retryAfter}.
     */
    record TransientFailure(Duration retryAfter, String reason) implements DispatchOutcome {
    }
}
