package org.javai.askdata.pipeline;

import java.time.Duration;
import java.util.Objects;
import org.javai.askdata.config.AskDataSettings;
import org.javai.askdata.execution.ExecutionCancelledException;
import org.javai.askdata.execution.ExecutionLimits;
import org.javai.askdata.execution.ExecutionTimeoutException;
import org.javai.askdata.execution.JdbcQueryExecutor;
import org.javai.askdata.execution.QueryExecutionException;
import org.javai.askdata.execution.QueryExecutor;
import org.javai.askdata.generation.CandidateQuery;
import org.javai.askdata.generation.GenerationCancelledException;
import org.javai.askdata.generation.GenerationResult;
import org.javai.askdata.generation.Oracle;
import org.javai.askdata.generation.OracleClients;
import org.javai.askdata.generation.OracleTimeoutException;
import org.javai.askdata.generation.OracleUnavailableException;
import org.javai.askdata.generation.QueryGenerator;
import org.javai.askdata.prompt.ConversationHistory;
import org.javai.askdata.prompt.GenerationRequest;
import org.javai.askdata.prompt.PromptComposer;
import org.javai.askdata.result.QueryResult;
import org.javai.askdata.schema.JdbcSchemaSource;
import org.javai.askdata.schema.SchemaDescriptor;
import org.javai.askdata.schema.SchemaSource;
import org.javai.askdata.schema.SchemaUnavailableException;
import org.javai.askdata.store.ReadOnlyConnectionFactory;
import org.javai.askdata.store.SqliteConnectionFactory;
import org.javai.askdata.validation.AdmittedQuery;
import org.javai.askdata.validation.QueryValidator;
import org.javai.askdata.validation.ValidationVerdict;
import org.javai.askdata.validation.ValidatorPolicy;
import org.javai.askdata.visualization.ChartSpec;
import org.javai.askdata.visualization.VisualizationSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers one question at a time: compose, generate, validate, execute, select a chart.
 *
 * <p>Every failure is turned into a {@link PipelineOutcome}; nothing is thrown to the caller
 * for a question that cannot be answered. A candidate reaches the executor only as the
 * {@link AdmittedQuery} of an admitting verdict.</p>
 *
 * <pre>{@code
 * QuestionPipeline pipeline = QuestionPipeline.builder()
 *     .schemaSource(new JdbcSchemaSource(connections))
 *     .oracle(OracleClients.groq())
 *     .executor(new JdbcQueryExecutor(connections))
 *     .build();
 * PipelineOutcome outcome = pipeline.answer("Show total deposits last month");
 * }</pre>
 */
public final class QuestionPipeline {

	private static final Logger logger = LoggerFactory.getLogger(QuestionPipeline.class);

	static final String READ_ONLY_MESSAGE = "Read-only access. Cannot modify data.";

	private final SchemaSource schemaSource;
	private final PromptComposer composer;
	private final QueryGenerator generator;
	private final ValidatorPolicy validatorPolicy;
	private final QueryExecutor executor;
	private final ExecutionLimits limits;
	private final VisualizationSelector selector;
	private final IntentScreen intentScreen;
	private final ConversationHistory initialHistory;
	private volatile QueryValidator validator;

	private QuestionPipeline(Builder builder) {
		this.schemaSource = builder.schemaSource;
		this.composer = builder.composer;
		this.generator = builder.generator;
		this.validatorPolicy = builder.validatorPolicy;
		this.executor = builder.executor;
		this.limits = builder.limits;
		this.selector = builder.selector;
		this.intentScreen = builder.intentScreen;
		this.initialHistory = builder.initialHistory;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Wires a pipeline for a SQLite database and a Groq-hosted model from settings.
	 *
	 * @throws IllegalStateException if no API key is configured
	 */
	public static QuestionPipeline fromSettings(AskDataSettings settings) {
		Objects.requireNonNull(settings, "settings must not be null");
		ReadOnlyConnectionFactory connections = new SqliteConnectionFactory(settings.database().path());
		AskDataSettings.OracleSettings oracle = settings.oracle();
		return builder()
				.settings(settings)
				.schemaSource(new JdbcSchemaSource(connections))
				.oracle(OracleClients.openAiCompatible(oracle.baseUrl(), oracle.apiKey(), oracle.model()))
				.executor(new JdbcQueryExecutor(connections))
				.build();
	}

	/**
	 * An empty history carrying the configured turn cap. Start each conversation from this and
	 * extend it with {@link ConversationHistory#withTurn(String, String)} after every answer.
	 */
	public ConversationHistory newConversation() {
		return initialHistory;
	}

	public PipelineOutcome answer(String question) {
		return answer(question, initialHistory);
	}

	public PipelineOutcome answer(String question, ConversationHistory history) {
		ConversationHistory effectiveHistory = history != null ? history : initialHistory;
		if (question == null || question.isBlank()) {
			return PipelineOutcome.failed(question, null, null,
					PipelineFailure.of(FailureKind.BLANK_QUESTION, "Please enter a question"), null);
		}
		logger.info("Question: {}", question);

		if (intentScreen != null) {
			var verb = intentScreen.findModificationIntent(question);
			if (verb.isPresent()) {
				logger.warn("Question turned away by intent screen (matched '{}'): {}", verb.get(), question);
				return PipelineOutcome.failed(question, null, null,
						PipelineFailure.of(FailureKind.INTENT_REJECTED, READ_ONLY_MESSAGE), null);
			}
		}

		SchemaDescriptor schema;
		try {
			schema = schemaSource.describe();
		}
		catch (SchemaUnavailableException e) {
			logger.warn("Schema unavailable: {}", e.getMessage());
			return PipelineOutcome.failed(question, null, null,
					PipelineFailure.of(FailureKind.SCHEMA_UNAVAILABLE, e.getMessage()), null);
		}

		GenerationRequest request = composer.compose(question, schema, effectiveHistory);
		GenerationResult generation;
		try {
			generation = generator.generate(request, effectiveHistory);
		}
		catch (OracleTimeoutException e) {
			return PipelineOutcome.failed(question, null, null,
					PipelineFailure.of(FailureKind.ORACLE_TIMEOUT, e.getMessage()), e.metrics());
		}
		catch (OracleUnavailableException e) {
			return PipelineOutcome.failed(question, null, null,
					PipelineFailure.of(FailureKind.ORACLE_UNAVAILABLE, e.getMessage()), e.metrics());
		}
		catch (GenerationCancelledException e) {
			logger.info("Question abandoned while waiting for the oracle: {}", question);
			return PipelineOutcome.failed(question, null, null,
					PipelineFailure.of(FailureKind.CANCELLED, e.getMessage()), e.metrics());
		}

		CandidateQuery candidate = generation.candidate();
		if (candidate.refused()) {
			return PipelineOutcome.failed(question, null, null,
					PipelineFailure.of(FailureKind.GENERATION_REFUSED, candidate.rawText()), generation.metrics());
		}

		ValidationVerdict verdict = validatorFor(schema).validate(candidate);
		String generatedSql = candidate.extractedSql();
		if (!candidate.hasStatement()) {
			return PipelineOutcome.failed(question, null, verdict,
					new PipelineFailure(FailureKind.GENERATION_EMPTY, verdict.reasonCode(),
							"Could not generate a SQL query for this question"),
					generation.metrics());
		}

		if (!verdict.admitted()) {
			return PipelineOutcome.failed(question, generatedSql, verdict,
					new PipelineFailure(FailureKind.VALIDATION_REJECTED, verdict.reasonCode(), verdict.detail()),
					generation.metrics());
		}
		AdmittedQuery admitted = verdict.admittedQuery();

		QueryResult result;
		try {
			result = executor.execute(admitted, limits);
		}
		catch (ExecutionTimeoutException e) {
			return PipelineOutcome.failed(question, generatedSql, verdict,
					PipelineFailure.of(FailureKind.EXECUTION_TIMEOUT, e.getMessage()), generation.metrics());
		}
		catch (ExecutionCancelledException e) {
			logger.info("Question abandoned while its query was running: {}", question);
			return PipelineOutcome.failed(question, generatedSql, verdict,
					PipelineFailure.of(FailureKind.CANCELLED, e.getMessage()), generation.metrics());
		}
		catch (QueryExecutionException e) {
			return PipelineOutcome.failed(question, generatedSql, verdict,
					PipelineFailure.of(FailureKind.EXECUTION_ERROR, e.getMessage()), generation.metrics());
		}

		ChartSpec chart = selector.select(result);
		logger.info("Answered with {} row(s), chart {}", result.rowCount(), chart.kind());
		return PipelineOutcome.success(question, generatedSql, verdict, result, chart, generation.metrics());
	}

	private QueryValidator validatorFor(SchemaDescriptor schema) {
		QueryValidator current = validator;
		if (current == null || current.schema() != schema) {
			current = new QueryValidator(schema, validatorPolicy);
			validator = current;
		}
		return current;
	}

	public static final class Builder {
		private SchemaSource schemaSource;
		private PromptComposer composer;
		private Oracle oracle;
		private QueryGenerator generator;
		private Duration oracleTimeout = QueryGenerator.DEFAULT_TIMEOUT;
		private int maxRetries = QueryGenerator.DEFAULT_MAX_RETRIES;
		private ValidatorPolicy validatorPolicy = ValidatorPolicy.defaults();
		private QueryExecutor executor;
		private ExecutionLimits limits = ExecutionLimits.defaults();
		private VisualizationSelector selector;
		private IntentScreen intentScreen;
		private ConversationHistory initialHistory = ConversationHistory.empty();

		private Builder() {
		}

		public Builder schemaSource(SchemaSource schemaSource) {
			this.schemaSource = schemaSource;
			return this;
		}

		public Builder composer(PromptComposer composer) {
			this.composer = composer;
			return this;
		}

		public Builder oracle(Oracle oracle) {
			this.oracle = oracle;
			return this;
		}

		/**
		 * Supplies a ready-made generator; oracle, timeout and retry settings are then ignored.
		 */
		public Builder generator(QueryGenerator generator) {
			this.generator = generator;
			return this;
		}

		public Builder oracleTimeout(Duration oracleTimeout) {
			this.oracleTimeout = oracleTimeout;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		public Builder validatorPolicy(ValidatorPolicy validatorPolicy) {
			this.validatorPolicy = validatorPolicy;
			return this;
		}

		public Builder executor(QueryExecutor executor) {
			this.executor = executor;
			return this;
		}

		public Builder limits(ExecutionLimits limits) {
			this.limits = limits;
			return this;
		}

		public Builder selector(VisualizationSelector selector) {
			this.selector = selector;
			return this;
		}

		public Builder intentScreen(IntentScreen intentScreen) {
			this.intentScreen = intentScreen;
			return this;
		}

		/**
		 * Applies everything in the settings except the database and oracle connections.
		 */
		public Builder settings(AskDataSettings settings) {
			AskDataSettings.OracleSettings oracleSettings = settings.oracle();
			this.composer = new PromptComposer(oracleSettings.temperature(), oracleSettings.maxTokens(),
					PromptComposer.DEFAULT_DIALECT);
			this.oracleTimeout = oracleSettings.timeout();
			this.maxRetries = oracleSettings.maxRetries();
			this.validatorPolicy = settings.validator().toPolicy();
			this.limits = settings.execution().toLimits();
			this.selector = settings.visualization().toSelector();
			this.intentScreen = settings.intentScreen().enabled() ? new IntentScreen() : null;
			this.initialHistory = settings.history().emptyHistory();
			return this;
		}

		public QuestionPipeline build() {
			if (schemaSource == null) {
				throw new IllegalStateException("schemaSource is required");
			}
			if (executor == null) {
				throw new IllegalStateException("executor is required");
			}
			if (composer == null) {
				composer = new PromptComposer();
			}
			if (generator == null) {
				if (oracle == null) {
					throw new IllegalStateException("either an oracle or a generator is required");
				}
				generator = new QueryGenerator(oracle, composer, oracleTimeout, maxRetries);
			}
			if (validatorPolicy == null) {
				validatorPolicy = ValidatorPolicy.defaults();
			}
			if (limits == null) {
				limits = ExecutionLimits.defaults();
			}
			if (selector == null) {
				selector = new VisualizationSelector();
			}
			return new QuestionPipeline(this);
		}
	}
}
