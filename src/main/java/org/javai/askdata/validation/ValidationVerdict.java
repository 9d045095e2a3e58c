package org.javai.askdata.validation;

/**
 * The validator's classification of one candidate query.
 *
 * @param admitted whether the candidate may be executed
 * @param reasonCode why it was admitted or rejected
 * @param matchedPattern the keyword or construct that caused rejection, null if none
 * @param detail human-readable explanation
 * @param admittedQuery the statement to execute, present only when admitted
 */
public record ValidationVerdict(
		boolean admitted,
		ReasonCode reasonCode,
		String matchedPattern,
		String detail,
		AdmittedQuery admittedQuery
) {

	public ValidationVerdict {
		if (reasonCode == null) {
			throw new IllegalArgumentException("reasonCode must not be null");
		}
		if (admitted != (reasonCode == ReasonCode.ADMITTED)) {
			throw new IllegalArgumentException("admitted must agree with reasonCode " + reasonCode);
		}
		if (admitted && admittedQuery == null) {
			throw new IllegalArgumentException("an admitting verdict must carry the admitted query");
		}
		if (!admitted && admittedQuery != null) {
			throw new IllegalArgumentException("a rejecting verdict must not carry a query");
		}
		detail = detail != null ? detail : "";
	}

	static ValidationVerdict admit(AdmittedQuery query) {
		return new ValidationVerdict(true, ReasonCode.ADMITTED, null, "Statement admitted", query);
	}

	public static ValidationVerdict reject(ReasonCode reasonCode, String matchedPattern, String detail) {
		return new ValidationVerdict(false, reasonCode, matchedPattern, detail, null);
	}

	/**
	 * @return the admitted query
	 * @throws QueryRejectedException if the verdict is a rejection
	 */
	public AdmittedQuery requireAdmitted() {
		if (!admitted) {
			throw new QueryRejectedException(this);
		}
		return admittedQuery;
	}
}
