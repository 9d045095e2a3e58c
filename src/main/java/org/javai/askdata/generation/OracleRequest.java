package org.javai.askdata.generation;

import org.javai.askdata.prompt.GenerationRequest;

/**
 * Wire-level request to the oracle.
 */
public record OracleRequest(String prompt, double temperature, int maxTokens) {

	public OracleRequest {
		if (prompt == null || prompt.isBlank()) {
			throw new IllegalArgumentException("prompt must not be blank");
		}
		if (maxTokens <= 0) {
			throw new IllegalArgumentException("maxTokens must be > 0");
		}
	}

	public static OracleRequest from(GenerationRequest request) {
		return new OracleRequest(request.prompt(), request.temperature(), request.maxTokens());
	}
}
