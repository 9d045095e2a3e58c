package org.javai.askdata.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.javai.askdata.execution.ExecutionLimits;
import org.javai.askdata.generation.OracleClients;
import org.javai.askdata.generation.QueryGenerator;
import org.javai.askdata.prompt.ConversationHistory;
import org.javai.askdata.prompt.PromptComposer;
import org.javai.askdata.validation.ValidatorPolicy;
import org.javai.askdata.visualization.VisualizationSelector;

/**
 * Complete runtime configuration. Every section has defaults, so an empty file is valid.
 */
public record AskDataSettings(
		OracleSettings oracle,
		DatabaseSettings database,
		ExecutionSettings execution,
		VisualizationSettings visualization,
		ValidatorSettings validator,
		IntentScreenSettings intentScreen,
		HistorySettings history,
		List<String> sampleQuestions
) {

	public static final List<String> DEFAULT_SAMPLE_QUESTIONS = List.of(
			"Show me total deposits last month",
			"What is the average account balance by account type?",
			"Find customers with balance over $50,000",
			"Show me top 10 customers by total transactions",
			"What are the most common transaction categories?",
			"Show loan distribution by type",
			"Find accounts with suspicious activity patterns");

	public AskDataSettings {
		oracle = oracle != null ? oracle : OracleSettings.defaults();
		database = database != null ? database : DatabaseSettings.defaults();
		execution = execution != null ? execution : ExecutionSettings.defaults();
		visualization = visualization != null ? visualization : VisualizationSettings.defaults();
		validator = validator != null ? validator : ValidatorSettings.defaults();
		intentScreen = intentScreen != null ? intentScreen : IntentScreenSettings.defaults();
		history = history != null ? history : HistorySettings.defaults();
		sampleQuestions = sampleQuestions != null ? List.copyOf(sampleQuestions) : DEFAULT_SAMPLE_QUESTIONS;
	}

	public static AskDataSettings defaults() {
		return new AskDataSettings(null, null, null, null, null, null, null, null);
	}

	/**
	 * Oracle connection and sampling settings. The API key normally comes from the environment.
	 */
	public record OracleSettings(
			String baseUrl,
			String model,
			String apiKey,
			double temperature,
			int maxTokens,
			int timeoutSeconds,
			int maxRetries
	) {

		public OracleSettings {
			baseUrl = baseUrl != null && !baseUrl.isBlank() ? baseUrl : OracleClients.GROQ_BASE_URL;
			model = model != null && !model.isBlank() ? model : OracleClients.GROQ_DEFAULT_MODEL;
			if (temperature < 0.0 || temperature > 1.0) {
				throw new IllegalArgumentException("oracle.temperature must be within [0, 1]");
			}
			if (maxTokens <= 0) {
				throw new IllegalArgumentException("oracle.max_tokens must be > 0");
			}
			if (timeoutSeconds <= 0) {
				throw new IllegalArgumentException("oracle.timeout_seconds must be > 0");
			}
			if (maxRetries < 0 || maxRetries > QueryGenerator.RETRY_LIMIT) {
				throw new IllegalArgumentException("oracle.max_retries must be within [0, " + QueryGenerator.RETRY_LIMIT + "]");
			}
		}

		public static OracleSettings defaults() {
			return new OracleSettings(null, null, null, PromptComposer.DEFAULT_TEMPERATURE,
					PromptComposer.DEFAULT_MAX_TOKENS, (int) QueryGenerator.DEFAULT_TIMEOUT.toSeconds(),
					QueryGenerator.DEFAULT_MAX_RETRIES);
		}

		public boolean hasApiKey() {
			return apiKey != null && !apiKey.isBlank();
		}

		public Duration timeout() {
			return Duration.ofSeconds(timeoutSeconds);
		}

		@Override
		public String toString() {
			return "OracleSettings[baseUrl=" + baseUrl + ", model=" + model
					+ ", apiKey=" + (hasApiKey() ? "****" : "<none>") + ", temperature=" + temperature
					+ ", maxTokens=" + maxTokens + ", timeoutSeconds=" + timeoutSeconds
					+ ", maxRetries=" + maxRetries + "]";
		}
	}

	public record DatabaseSettings(Path path) {

		public static final Path DEFAULT_PATH = Path.of("data", "banking.db");

		public DatabaseSettings {
			path = path != null ? path : DEFAULT_PATH;
		}

		public static DatabaseSettings defaults() {
			return new DatabaseSettings(null);
		}
	}

	public record ExecutionSettings(int maxRows, int timeoutSeconds) {

		public ExecutionSettings {
			if (maxRows <= 0) {
				throw new IllegalArgumentException("execution.max_rows must be > 0");
			}
			if (timeoutSeconds <= 0) {
				throw new IllegalArgumentException("execution.timeout_seconds must be > 0");
			}
		}

		public static ExecutionSettings defaults() {
			return new ExecutionSettings(ExecutionLimits.DEFAULT_MAX_ROWS,
					(int) ExecutionLimits.DEFAULT_TIMEOUT.toSeconds());
		}

		public ExecutionLimits toLimits() {
			return new ExecutionLimits(maxRows, Duration.ofSeconds(timeoutSeconds));
		}
	}

	public record VisualizationSettings(int displayThreshold, int maxColumns) {

		public VisualizationSettings {
			if (displayThreshold <= 0) {
				throw new IllegalArgumentException("visualization.display_threshold must be > 0");
			}
			if (maxColumns < 2) {
				throw new IllegalArgumentException("visualization.max_columns must be >= 2");
			}
		}

		public static VisualizationSettings defaults() {
			return new VisualizationSettings(VisualizationSelector.DEFAULT_DISPLAY_THRESHOLD,
					VisualizationSelector.DEFAULT_MAX_COLUMNS);
		}

		public VisualizationSelector toSelector() {
			return new VisualizationSelector(displayThreshold, maxColumns);
		}
	}

	public record ValidatorSettings(boolean parseCheck, List<String> extraDeniedKeywords) {

		public ValidatorSettings {
			extraDeniedKeywords = extraDeniedKeywords != null ? List.copyOf(extraDeniedKeywords) : List.of();
		}

		public static ValidatorSettings defaults() {
			return new ValidatorSettings(true, List.of());
		}

		public ValidatorPolicy toPolicy() {
			return new ValidatorPolicy(parseCheck, extraDeniedKeywords);
		}
	}

	public record IntentScreenSettings(boolean enabled) {

		public static IntentScreenSettings defaults() {
			return new IntentScreenSettings(false);
		}
	}

	public record HistorySettings(int maxTurns) {

		public HistorySettings {
			if (maxTurns < 0) {
				throw new IllegalArgumentException("history.max_turns must be >= 0");
			}
		}

		public static HistorySettings defaults() {
			return new HistorySettings(ConversationHistory.DEFAULT_MAX_TURNS);
		}

		public ConversationHistory emptyHistory() {
			return ConversationHistory.empty(maxTurns);
		}
	}
}
