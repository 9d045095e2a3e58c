package org.javai.askdata.execution;

/**
 * Thrown when the calling thread is interrupted while a query is running. The statement has
 * been cancelled by the time this is raised.
 */
public class ExecutionCancelledException extends QueryExecutionException {

	public ExecutionCancelledException(InterruptedException cause) {
		super("Query execution was cancelled", cause);
	}
}
