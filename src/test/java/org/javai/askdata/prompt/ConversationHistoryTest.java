package org.javai.askdata.prompt;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConversationHistoryTest {

	@Test
	@DisplayName("keeps only the most recent turns")
	void dropsOldestTurns() {
		ConversationHistory history = ConversationHistory.empty(2)
				.withTurn("q1", "SELECT 1")
				.withTurn("q2", "SELECT 2")
				.withTurn("q3", "SELECT 3");

		assertThat(history.turns())
				.extracting(ConversationHistory.PriorTurn::question)
				.containsExactly("q2", "q3");
	}

	@Test
	@DisplayName("ignores turns without SQL")
	void ignoresBlankTurns() {
		ConversationHistory history = ConversationHistory.empty().withTurn("q", " ");
		assertThat(history.isEmpty()).isTrue();
	}

	@Test
	@DisplayName("adding a turn leaves the original untouched")
	void immutable() {
		ConversationHistory original = ConversationHistory.empty();
		original.withTurn("q", "SELECT 1");
		assertThat(original.isEmpty()).isTrue();
	}

	@Test
	@DisplayName("a zero-turn history never records anything")
	void zeroTurns() {
		assertThat(ConversationHistory.empty(0).withTurn("q", "SELECT 1").isEmpty()).isTrue();
	}
}
