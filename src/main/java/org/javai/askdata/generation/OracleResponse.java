package org.javai.askdata.generation;

/**
 * Wire-level response from the oracle. A null body is normalised to an empty string.
 */
public record OracleResponse(String text) {

	public OracleResponse {
		text = text != null ? text : "";
	}
}
