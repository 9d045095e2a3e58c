package org.javai.askdata.pipeline;

import org.javai.askdata.generation.GenerationMetrics;
import org.javai.askdata.prompt.ConversationHistory;
import org.javai.askdata.result.QueryResult;
import org.javai.askdata.validation.ValidationVerdict;
import org.javai.askdata.visualization.ChartSpec;

/**
 * Everything the presentation layer needs about one question.
 *
 * <p>Exactly one of {@code result} and {@code failure} is present. Fields that the pipeline
 * never reached are null: a question rejected by validation has a verdict but no result.</p>
 *
 * @param question the question as asked
 * @param generatedSql the statement extracted from the oracle's response, or null
 * @param verdict the validator's verdict, or null if validation was not reached
 * @param result the rows, or null on failure
 * @param failure the failure, or null on success
 * @param chart the chosen rendering, or null on failure
 * @param metrics the oracle calls made
 */
public record PipelineOutcome(
		String question,
		String generatedSql,
		ValidationVerdict verdict,
		QueryResult result,
		PipelineFailure failure,
		ChartSpec chart,
		GenerationMetrics metrics
) {

	public PipelineOutcome {
		if ((result == null) == (failure == null)) {
			throw new IllegalArgumentException("exactly one of result and failure must be present");
		}
		metrics = metrics != null ? metrics : GenerationMetrics.empty();
	}

	static PipelineOutcome success(String question, String generatedSql, ValidationVerdict verdict,
			QueryResult result, ChartSpec chart, GenerationMetrics metrics) {
		return new PipelineOutcome(question, generatedSql, verdict, result, null, chart, metrics);
	}

	static PipelineOutcome failed(String question, String generatedSql, ValidationVerdict verdict,
			PipelineFailure failure, GenerationMetrics metrics) {
		return new PipelineOutcome(question, generatedSql, verdict, null, failure, null, metrics);
	}

	public boolean succeeded() {
		return failure == null;
	}

	/**
	 * Records this question in the history when its statement was admitted and executed.
	 */
	public ConversationHistory appendTo(ConversationHistory history) {
		if (!succeeded() || verdict == null || !verdict.admitted()) {
			return history;
		}
		return history.withTurn(question, verdict.admittedQuery().sql());
	}
}
