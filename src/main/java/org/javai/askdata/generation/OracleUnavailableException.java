package org.javai.askdata.generation;

/**
 * Thrown when the oracle cannot be reached or the transport reports an error.
 */
public class OracleUnavailableException extends GenerationException {

	public OracleUnavailableException(String message) {
		super(message, null, null);
	}

	public OracleUnavailableException(String message, Throwable cause) {
		super(message, cause, null);
	}

	public OracleUnavailableException(String message, Throwable cause, GenerationMetrics metrics) {
		super(message, cause, metrics);
	}
}
