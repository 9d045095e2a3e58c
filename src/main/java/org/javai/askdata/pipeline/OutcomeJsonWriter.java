package org.javai.askdata.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.List;
import org.javai.askdata.generation.GenerationAttempt;
import org.javai.askdata.generation.GenerationMetrics;
import org.javai.askdata.result.ColumnSummary;
import org.javai.askdata.result.QueryResult;
import org.javai.askdata.result.ResultColumn;
import org.javai.askdata.result.ResultSummarizer;
import org.javai.askdata.validation.ValidationVerdict;
import org.javai.askdata.visualization.ChartSpec;

/**
 * Renders a {@link PipelineOutcome} as JSON for the presentation layer.
 *
 * <p>Keys are snake_case. Successful outcomes also carry summary statistics for their
 * numeric columns.</p>
 */
public final class OutcomeJsonWriter {

	private final ObjectMapper mapper;
	private final ResultSummarizer summarizer = new ResultSummarizer();

	public OutcomeJsonWriter() {
		this.mapper = new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
	}

	public String toJson(PipelineOutcome outcome) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(outcome));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render outcome as JSON", e);
		}
	}

	public ObjectNode toTree(PipelineOutcome outcome) {
		ObjectNode root = mapper.createObjectNode();
		root.put("question", outcome.question());
		root.put("generated_sql", outcome.generatedSql());
		root.put("succeeded", outcome.succeeded());
		if (outcome.verdict() != null) {
			root.set("verdict", verdict(outcome.verdict()));
		}
		if (outcome.failure() != null) {
			ObjectNode failure = root.putObject("failure");
			failure.put("kind", outcome.failure().kind().name());
			if (outcome.failure().reasonCode() != null) {
				failure.put("reason_code", outcome.failure().reasonCode().name());
			}
			failure.put("message", outcome.failure().message());
		}
		if (outcome.result() != null) {
			root.set("result", result(outcome.result()));
			root.set("summaries", summaries(summarizer.summarize(outcome.result())));
		}
		if (outcome.chart() != null) {
			root.set("chart", chart(outcome.chart()));
		}
		root.set("metrics", metrics(outcome.metrics()));
		return root;
	}

	private ObjectNode verdict(ValidationVerdict verdict) {
		ObjectNode node = mapper.createObjectNode();
		node.put("admitted", verdict.admitted());
		node.put("reason_code", verdict.reasonCode().name());
		if (verdict.matchedPattern() != null) {
			node.put("matched_pattern", verdict.matchedPattern());
		}
		node.put("detail", verdict.detail());
		return node;
	}

	private ObjectNode result(QueryResult result) {
		ObjectNode node = mapper.createObjectNode();
		ArrayNode columns = node.putArray("columns");
		for (ResultColumn column : result.columns()) {
			ObjectNode c = columns.addObject();
			c.put("name", column.name());
			c.put("type", column.inferredType().name());
		}
		ArrayNode rows = node.putArray("rows");
		for (List<Object> row : result.rows()) {
			ArrayNode r = rows.addArray();
			for (Object value : row) {
				JsonNode cell = mapper.valueToTree(value);
				r.add(cell);
			}
		}
		node.put("row_count", result.rowCount());
		node.put("truncated", result.truncated());
		return node;
	}

	private ArrayNode summaries(List<ColumnSummary> summaries) {
		ArrayNode array = mapper.createArrayNode();
		for (ColumnSummary summary : summaries) {
			ObjectNode s = array.addObject();
			s.put("column", summary.column());
			s.put("count", summary.count());
			s.put("mean", summary.mean());
			s.put("median", summary.median());
			s.put("min", summary.min());
			s.put("max", summary.max());
			s.put("sum", summary.sum());
		}
		return array;
	}

	private ObjectNode chart(ChartSpec chart) {
		ObjectNode node = mapper.createObjectNode();
		node.put("kind", chart.kind().name());
		node.put("x_field", chart.xField());
		ArrayNode y = node.putArray("y_fields");
		chart.yFields().forEach(y::add);
		node.put("rationale", chart.rationale());
		return node;
	}

	private ObjectNode metrics(GenerationMetrics metrics) {
		ObjectNode node = mapper.createObjectNode();
		node.put("model_id", metrics.modelId());
		node.put("total_attempts", metrics.totalAttempts());
		node.put("retries", metrics.retries());
		node.put("total_duration_millis", metrics.totalDurationMillis());
		ArrayNode attempts = node.putArray("attempts");
		for (GenerationAttempt attempt : metrics.attempts()) {
			ObjectNode a = attempts.addObject();
			a.put("attempt", attempt.attemptNumber());
			a.put("strict", attempt.strict());
			a.put("outcome", attempt.outcome().name());
			a.put("duration_millis", attempt.durationMillis());
			if (attempt.errorDetails() != null) {
				a.put("error_details", attempt.errorDetails());
			}
		}
		return node;
	}
}
