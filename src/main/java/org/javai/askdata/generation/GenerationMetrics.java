package org.javai.askdata.generation;

import java.util.List;

/**
 * Telemetry about how a candidate query was obtained.
 *
 * @param modelId model the attempts were made against
 * @param attempts every oracle call, in order
 */
public record GenerationMetrics(String modelId, List<GenerationAttempt> attempts) {

	public GenerationMetrics {
		attempts = attempts != null ? List.copyOf(attempts) : List.of();
	}

	public static GenerationMetrics empty() {
		return new GenerationMetrics(null, List.of());
	}

	public int totalAttempts() {
		return attempts.size();
	}

	/**
	 * @return the number of calls made after the first one
	 */
	public int retries() {
		return Math.max(0, attempts.size() - 1);
	}

	public boolean succeeded() {
		return attempts.stream().anyMatch(GenerationAttempt::isSuccess);
	}

	public long totalDurationMillis() {
		return attempts.stream().mapToLong(GenerationAttempt::durationMillis).sum();
	}

	/**
	 * @return the last attempt, or null if no attempts were made
	 */
	public GenerationAttempt finalAttempt() {
		return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
	}
}
