package org.javai.askdata.execution;

import java.time.Duration;

/**
 * Thrown when a query runs past its timeout.
 */
public class ExecutionTimeoutException extends RuntimeException {

	private final Duration timeout;

	public ExecutionTimeoutException(Duration timeout, Throwable cause) {
		super("Query did not complete within " + timeout.toMillis() + " ms", cause);
		this.timeout = timeout;
	}

	public Duration timeout() {
		return timeout;
	}
}
