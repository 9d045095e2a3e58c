package org.javai.askdata.prompt;

import java.util.ArrayList;
import java.util.List;

/**
 * Prior turns offered to the composer as context for follow-up questions.
 *
 * <p>Immutable. Only turns whose SQL was admitted are worth recording, so that the oracle
 * is never shown a rejected statement as an example.</p>
 *
 * @param turns prior turns, oldest first
 * @param maxTurns how many turns are retained; older ones are dropped
 */
public record ConversationHistory(List<PriorTurn> turns, int maxTurns) {

	public static final int DEFAULT_MAX_TURNS = 3;

	public ConversationHistory {
		if (maxTurns < 0) {
			throw new IllegalArgumentException("maxTurns must be >= 0");
		}
		List<PriorTurn> copy = turns != null ? List.copyOf(turns) : List.of();
		if (copy.size() > maxTurns) {
			copy = copy.subList(copy.size() - maxTurns, copy.size());
		}
		turns = copy;
	}

	public static ConversationHistory empty() {
		return new ConversationHistory(List.of(), DEFAULT_MAX_TURNS);
	}

	public static ConversationHistory empty(int maxTurns) {
		return new ConversationHistory(List.of(), maxTurns);
	}

	public boolean isEmpty() {
		return turns.isEmpty();
	}

	/**
	 * Creates a copy with the given turn appended, dropping the oldest turn when full.
	 */
	public ConversationHistory withTurn(String question, String sql) {
		if (question == null || question.isBlank() || sql == null || sql.isBlank()) {
			return this;
		}
		List<PriorTurn> updated = new ArrayList<>(turns);
		updated.add(new PriorTurn(question, sql));
		return new ConversationHistory(updated, maxTurns);
	}

	/**
	 * A previously answered question with the statement that answered it.
	 */
	public record PriorTurn(String question, String sql) {
	}
}
