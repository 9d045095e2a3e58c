package org.javai.askdata.schema;

/**
 * Thrown when the backing store cannot be introspected to build a schema descriptor.
 */
public class SchemaUnavailableException extends RuntimeException {

	public SchemaUnavailableException(String message) {
		super(message);
	}

	public SchemaUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
