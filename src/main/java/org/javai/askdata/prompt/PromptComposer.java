package org.javai.askdata.prompt;

import java.util.Objects;
import org.javai.askdata.prompt.ConversationHistory.PriorTurn;
import org.javai.askdata.schema.SchemaDescriptor;

/**
 * Combines the schema, the user's question and the generation constraints into a single request.
 *
 * <p>Composition is deterministic: identical inputs always produce an identical prompt, so a
 * rejected statement can be attributed to the oracle rather than to the prompt.</p>
 */
public final class PromptComposer {

	public static final double DEFAULT_TEMPERATURE = 0.1;
	public static final int DEFAULT_MAX_TOKENS = 1000;
	public static final String DEFAULT_DIALECT = "SQLite";

	/**
	 * The exact text the oracle is told to answer with when asked to modify data.
	 */
	public static final String REFUSAL_SENTINEL = "ERROR: Read-only access. Cannot modify data.";

	private static final String ROLE = "You are an expert SQL assistant for an analytics database. "
			+ "Convert natural language questions to SQL queries.";

	private static final String RULES_TEMPLATE = """
			RULES - MUST FOLLOW:
			1. Return ONLY the SQL query, nothing else (no explanations, no markdown).
			2. Produce exactly one read-only SELECT statement.
			3. NEVER use data-modifying keywords such as INSERT, UPDATE, DELETE, DROP, TRUNCATE, ALTER or CREATE.
			4. If the question asks to delete, remove, update, change, add or create anything, respond only with:
			   "%s"
			5. Use standard SQL compatible with %s.
			6. Use proper JOIN syntax when querying multiple tables.
			7. Prefer aggregate functions (SUM, COUNT, AVG, MAX, MIN) for summary questions.
			8. Add ORDER BY when showing top or bottom results.
			9. Add LIMIT when listing rows (default 10).
			10. Use descriptive column aliases with AS.
			11. Handle NULL values appropriately.""";

	private static final String EXAMPLES = """
			EXAMPLES:
			Question: "Show me top 5 customers by balance"
			SQL: SELECT c.name, SUM(a.balance) AS total_balance FROM customers c JOIN accounts a ON c.customer_id = a.customer_id GROUP BY c.customer_id ORDER BY total_balance DESC LIMIT 5

			Question: "What is the average transaction amount?"
			SQL: SELECT AVG(amount) AS average_transaction FROM transactions""";

	private static final String STRICT_ADDENDUM = """
			RETRY: the previous response did not contain a usable SQL statement.
			Respond with a single SELECT statement and nothing else: no prose, no markdown fences, no comments.
			The response must begin with the word SELECT.""";

	private final double temperature;
	private final int maxTokens;
	private final String dialect;

	public PromptComposer() {
		this(DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, DEFAULT_DIALECT);
	}

	public PromptComposer(double temperature, int maxTokens, String dialect) {
		if (Double.isNaN(temperature) || temperature < 0.0 || temperature > 1.0) {
			throw new IllegalArgumentException("temperature must be within [0, 1]");
		}
		if (maxTokens <= 0) {
			throw new IllegalArgumentException("maxTokens must be > 0");
		}
		this.temperature = temperature;
		this.maxTokens = maxTokens;
		this.dialect = dialect != null && !dialect.isBlank() ? dialect : DEFAULT_DIALECT;
	}

	public GenerationRequest compose(String question, SchemaDescriptor schema) {
		return compose(question, schema, ConversationHistory.empty());
	}

	public GenerationRequest compose(String question, SchemaDescriptor schema, ConversationHistory history) {
		Objects.requireNonNull(schema, "schema must not be null");
		if (question == null || question.isBlank()) {
			throw new IllegalArgumentException("question must not be blank");
		}
		String prompt = buildPrompt(question.trim(), schema, history, false);
		return new GenerationRequest(question, schema, temperature, maxTokens, prompt, false);
	}

	/**
	 * Derives the stricter request used when the previous response yielded no statement.
	 * Sampling settings are kept; only the prompt gains the retry addendum.
	 */
	public GenerationRequest composeStrict(GenerationRequest previous, ConversationHistory history) {
		Objects.requireNonNull(previous, "previous must not be null");
		String prompt = buildPrompt(previous.question().trim(), previous.schema(), history, true);
		return new GenerationRequest(previous.question(), previous.schema(), previous.temperature(),
				previous.maxTokens(), prompt, true);
	}

	private String buildPrompt(String question, SchemaDescriptor schema, ConversationHistory history,
			boolean strict) {
		StringBuilder sb = new StringBuilder();
		sb.append(ROLE).append("\n\n");
		sb.append(SchemaPromptRenderer.render(schema)).append("\n\n");
		sb.append(RULES_TEMPLATE.formatted(REFUSAL_SENTINEL, dialect)).append("\n\n");
		sb.append(EXAMPLES).append("\n\n");
		if (history != null && !history.isEmpty()) {
			sb.append("PREVIOUS QUESTIONS IN THIS CONVERSATION:\n");
			for (PriorTurn turn : history.turns()) {
				sb.append("Question: \"").append(turn.question()).append("\"\n");
				sb.append("SQL: ").append(turn.sql()).append("\n");
			}
			sb.append("\n");
		}
		if (strict) {
			sb.append(STRICT_ADDENDUM).append("\n\n");
		}
		sb.append("Now convert this question to SQL:\n");
		sb.append("Question: \"").append(question).append("\"\n\n");
		sb.append("SQL Query:");
		return sb.toString();
	}
}
