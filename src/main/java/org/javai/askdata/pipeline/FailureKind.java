package org.javai.askdata.pipeline;

/**
 * Why a question could not be answered.
 */
public enum FailureKind {
	BLANK_QUESTION,
	INTENT_REJECTED,
	SCHEMA_UNAVAILABLE,
	ORACLE_UNAVAILABLE,
	ORACLE_TIMEOUT,
	GENERATION_EMPTY,
	GENERATION_REFUSED,
	VALIDATION_REJECTED,
	EXECUTION_TIMEOUT,
	EXECUTION_ERROR,
	CANCELLED
}
