package org.springaicommunity.content.checker;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * A scheduled retry within one {@link RetryExecutor} invocation. Never shared or stored.
 *
 * @param attemptNumber the failed attempt (0 = first try)
 * @param lastError kind of the error that triggered the retry
 * @param nextDelay wait before the next attempt
 */
public record RetryAttempt(int attemptNumber, @Nullable ErrorKind lastError, Duration nextDelay) {
}
