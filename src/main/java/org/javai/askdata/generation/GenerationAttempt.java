package org.javai.askdata.generation;

/**
 * Record of a single oracle call for observability.
 *
 * @param modelId identifier of the model used
 * @param attemptNumber 1-based attempt number
 * @param strict whether the strict retry prompt was used
 * @param outcome result of the attempt
 * @param durationMillis time taken for this attempt in milliseconds
 * @param errorDetails error message if the outcome is a failure, null otherwise
 */
public record GenerationAttempt(
		String modelId,
		int attemptNumber,
		boolean strict,
		AttemptOutcome outcome,
		long durationMillis,
		String errorDetails
) {

	public GenerationAttempt {
		if (attemptNumber < 1) {
			throw new IllegalArgumentException("attemptNumber must be >= 1");
		}
		if (outcome == null) {
			throw new IllegalArgumentException("outcome must not be null");
		}
		if (durationMillis < 0) {
			throw new IllegalArgumentException("durationMillis must be >= 0");
		}
	}

	public boolean isSuccess() {
		return outcome == AttemptOutcome.SUCCESS;
	}
}
