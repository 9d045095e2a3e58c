package org.javai.askdata.generation;

/**
 * Base class for generation failures. Carries the attempts made before the failure so
 * that they can still be reported.
 */
public abstract class GenerationException extends RuntimeException {

	private final GenerationMetrics metrics;

	protected GenerationException(String message, Throwable cause, GenerationMetrics metrics) {
		super(message, cause);
		this.metrics = metrics != null ? metrics : GenerationMetrics.empty();
	}

	public GenerationMetrics metrics() {
		return metrics;
	}
}
