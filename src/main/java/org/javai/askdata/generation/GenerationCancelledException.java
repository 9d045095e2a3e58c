package org.javai.askdata.generation;

/**
 * Thrown when the thread waiting on the oracle is interrupted. The in-flight call is
 * cancelled and its result discarded.
 */
public class GenerationCancelledException extends GenerationException {

	public GenerationCancelledException(String message, Throwable cause) {
		super(message, cause, null);
	}

	public GenerationCancelledException(String message, Throwable cause, GenerationMetrics metrics) {
		super(message, cause, metrics);
	}
}
