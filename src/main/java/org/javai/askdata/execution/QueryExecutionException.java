package org.javai.askdata.execution;

/**
 * Thrown when the store rejects or fails a query. The message is the store's own.
 */
public class QueryExecutionException extends RuntimeException {

	public QueryExecutionException(String message) {
		super(message);
	}

	public QueryExecutionException(String message, Throwable cause) {
		super(message, cause);
	}
}
