package org.javai.askdata.execution;

import org.javai.askdata.result.QueryResult;
import org.javai.askdata.validation.AdmittedQuery;

/**
 * Runs admitted queries against the store.
 */
public interface QueryExecutor {

	/**
	 * @param query a statement admitted by the validator
	 * @param limits row and time bounds for this run
	 * @return the rows, truncated to {@code limits.maxRows()}
	 * @throws ExecutionTimeoutException if the query exceeds the timeout
	 * @throws ExecutionCancelledException if the calling thread is interrupted while waiting
	 * @throws QueryExecutionException if the store reports an error
	 */
	QueryResult execute(AdmittedQuery query, ExecutionLimits limits);
}
