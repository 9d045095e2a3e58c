package org.javai.askdata.execution;

import java.time.Duration;

/**
 * Bounds applied to a single query run.
 *
 * @param maxRows rows kept before the result is marked truncated
 * @param timeout longest the store may spend on the query
 */
public record ExecutionLimits(int maxRows, Duration timeout) {

	public static final int DEFAULT_MAX_ROWS = 1000;
	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

	public ExecutionLimits {
		if (maxRows <= 0) {
			throw new IllegalArgumentException("maxRows must be > 0");
		}
		if (timeout == null || timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("timeout must be positive");
		}
	}

	public static ExecutionLimits defaults() {
		return new ExecutionLimits(DEFAULT_MAX_ROWS, DEFAULT_TIMEOUT);
	}

	/**
	 * JDBC query timeouts are whole seconds; partial seconds round up.
	 */
	int timeoutSeconds() {
		long millis = timeout.toMillis();
		return (int) Math.max(1, (millis + 999) / 1000);
	}

	/**
	 * Rows requested from the driver: one past {@link #maxRows()} to detect truncation, or
	 * {@code 0} (no driver limit) when that would overflow.
	 */
	int fetchLimit() {
		return maxRows < Integer.MAX_VALUE ? maxRows + 1 : 0;
	}
}
