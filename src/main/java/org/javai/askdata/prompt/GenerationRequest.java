package org.javai.askdata.prompt;

import org.javai.askdata.schema.SchemaDescriptor;

/**
 * A composed request for the oracle, created per question and never persisted.
 *
 * @param question the user's question as asked
 * @param schema the schema the prompt was grounded on
 * @param temperature sampling temperature in [0, 1]
 * @param maxTokens upper bound on generated tokens (&gt; 0)
 * @param prompt the full prompt text sent to the oracle
 * @param strict true for the stricter variant used when retrying an empty generation
 */
public record GenerationRequest(
		String question,
		SchemaDescriptor schema,
		double temperature,
		int maxTokens,
		String prompt,
		boolean strict
) {

	public GenerationRequest {
		if (question == null || question.isBlank()) {
			throw new IllegalArgumentException("question must not be blank");
		}
		if (schema == null) {
			throw new IllegalArgumentException("schema must not be null");
		}
		if (Double.isNaN(temperature) || temperature < 0.0 || temperature > 1.0) {
			throw new IllegalArgumentException("temperature must be within [0, 1]");
		}
		if (maxTokens <= 0) {
			throw new IllegalArgumentException("maxTokens must be > 0");
		}
		if (prompt == null || prompt.isBlank()) {
			throw new IllegalArgumentException("prompt must not be blank");
		}
	}
}
