package org.javai.askdata.validation;

/**
 * Why a candidate query was admitted or rejected.
 */
public enum ReasonCode {
	ADMITTED,
	NO_STATEMENT_FOUND,
	NOT_READ_ONLY,
	DENYLIST_MATCH,
	MULTI_STATEMENT,
	UNPARSEABLE,
	UNKNOWN_TABLE
}
