package my.statementfusion.app.importer;

import java.time.Duration;

public record RetryPolicy(
		int maxAttempts,
		Duration initialBackoff,
		Duration maxBackoff,
		Duration attemptTimeout
) {
	public static final int DEFAULT_MAX_ATTEMPTS = 3;
	public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(200);
	public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(2);
	public static final Duration DEFAULT_ATTEMPT_TIMEOUT = Duration.ofSeconds(30);

	public static final RetryPolicy DEFAULT = new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_BACKOFF,
			DEFAULT_MAX_BACKOFF, DEFAULT_ATTEMPT_TIMEOUT);

	public RetryPolicy {
		maxAttempts = Math.max(1, maxAttempts);
		initialBackoff = positiveOr(initialBackoff, DEFAULT_INITIAL_BACKOFF);
		maxBackoff = positiveOr(maxBackoff, DEFAULT_MAX_BACKOFF);
		if (maxBackoff.compareTo(initialBackoff) < 0) {
			maxBackoff = initialBackoff;
		}
		attemptTimeout = positiveOr(attemptTimeout, DEFAULT_ATTEMPT_TIMEOUT);
	}

	/**
	 * Delay before the given retry; attempt 1 is the first retry.
	 */
	public Duration backoffFor(int attempt) {
		int shift = Math.min(Math.max(0, attempt - 1), 20);
		Duration delay = initialBackoff.multipliedBy(1L << shift);
		return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
	}

	private static Duration positiveOr(Duration value, Duration fallback) {
		return value == null || value.isNegative() || value.isZero() ? fallback : value;
	}
}
