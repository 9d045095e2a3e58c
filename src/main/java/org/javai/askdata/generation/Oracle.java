package org.javai.askdata.generation;

/**
 * The external text-generation service that turns a prompt into candidate SQL text.
 *
 * <p>Implementations only report transport problems; interpreting the returned text is
 * the generator's job.</p>
 */
public interface Oracle {

	/**
	 * Sends a completion request.
	 *
	 * @param request the prompt and sampling settings
	 * @return the free-form response text
	 * @throws OracleUnavailableException if the service cannot be reached or answers with an error
	 */
	OracleResponse complete(OracleRequest request);

	/**
	 * @return identifier of the model behind this oracle, for observability
	 */
	default String modelId() {
		return "unknown";
	}
}
