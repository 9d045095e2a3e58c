package org.javai.askdata.pipeline;

import org.javai.askdata.validation.ReasonCode;

/**
 * A failure reported for one question.
 *
 * @param kind the failure class
 * @param reasonCode the validator's reason, for validation failures; null otherwise
 * @param message explanation for the user; engine errors are passed through verbatim
 */
public record PipelineFailure(FailureKind kind, ReasonCode reasonCode, String message) {

	public PipelineFailure {
		if (kind == null) {
			throw new IllegalArgumentException("kind must not be null");
		}
		message = message != null ? message : "";
	}

	public static PipelineFailure of(FailureKind kind, String message) {
		return new PipelineFailure(kind, null, message);
	}
}
