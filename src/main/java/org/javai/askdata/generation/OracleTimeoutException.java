package org.javai.askdata.generation;

import java.time.Duration;

/**
 * Thrown when the oracle does not answer within the bounded wait.
 */
public class OracleTimeoutException extends GenerationException {

	private final Duration timeout;

	public OracleTimeoutException(Duration timeout) {
		this(timeout, null);
	}

	public OracleTimeoutException(Duration timeout, GenerationMetrics metrics) {
		super("Oracle did not respond within " + timeout.toMillis() + " ms", null, metrics);
		this.timeout = timeout;
	}

	public Duration timeout() {
		return timeout;
	}
}
