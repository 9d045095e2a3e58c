package org.javai.askdata.validation;

/**
 * Thrown when an admitted query is demanded from a rejecting verdict.
 */
public class QueryRejectedException extends RuntimeException {

	private final transient ValidationVerdict verdict;

	public QueryRejectedException(ValidationVerdict verdict) {
		super("Query rejected (" + verdict.reasonCode() + "): " + verdict.detail());
		this.verdict = verdict;
	}

	public ValidationVerdict verdict() {
		return verdict;
	}
}
