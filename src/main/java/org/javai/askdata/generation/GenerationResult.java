package org.javai.askdata.generation;

/**
 * The candidate produced by the generator together with the attempts it took.
 */
public record GenerationResult(CandidateQuery candidate, GenerationMetrics metrics) {

	public GenerationResult {
		if (candidate == null) {
			throw new IllegalArgumentException("candidate must not be null");
		}
		metrics = metrics != null ? metrics : GenerationMetrics.empty();
	}
}
