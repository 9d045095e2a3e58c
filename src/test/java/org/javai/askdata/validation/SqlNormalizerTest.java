package org.javai.askdata.validation;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SqlNormalizerTest {

	@Test
	@DisplayName("replaces comments and collapses whitespace")
	void stripsComments() {
		assertThat(SqlNormalizer.normalize("  SELECT /* x */ a,\n\t b -- tail\nFROM t  "))
				.isEqualTo("SELECT a, b FROM t");
	}

	@Test
	@DisplayName("leaves quoted spans alone")
	void keepsQuotedSpans() {
		assertThat(SqlNormalizer.normalize("SELECT '--  not a comment', \"a  b\", [c  d] FROM t"))
				.isEqualTo("SELECT '--  not a comment', \"a  b\", [c  d] FROM t");
	}

	@Test
	@DisplayName("handles doubled quotes inside literals")
	void doubledQuotes() {
		assertThat(SqlNormalizer.terminatorCount("SELECT 'it''s; fine'")).isZero();
	}

	@Test
	@DisplayName("counts terminators outside quotes")
	void countsTerminators() {
		assertThat(SqlNormalizer.terminatorCount("SELECT 1; SELECT ';'; ")).isEqualTo(2);
	}

	@Test
	@DisplayName("detects text after a terminator")
	void textAfterTerminator() {
		assertThat(SqlNormalizer.hasTextAfterTerminator("SELECT 1;")).isFalse();
		assertThat(SqlNormalizer.hasTextAfterTerminator("SELECT 1; SELECT 2")).isTrue();
		assertThat(SqlNormalizer.hasTextAfterTerminator("SELECT 'a;b'")).isFalse();
	}

	@Test
	@DisplayName("removes one trailing terminator")
	void trailingTerminator() {
		assertThat(SqlNormalizer.withoutTrailingTerminator("SELECT 1 ;")).isEqualTo("SELECT 1");
		assertThat(SqlNormalizer.withoutTrailingTerminator("SELECT ';'")).isEqualTo("SELECT ';'");
	}

	@Test
	@DisplayName("finds the leading word past comments")
	void leadingWord() {
		assertThat(SqlNormalizer.leadingWord("/* hi */ -- there\n  Select 1")).isEqualTo("select");
		assertThat(SqlNormalizer.leadingWord("   ")).isEmpty();
		assertThat(SqlNormalizer.leadingWord("(SELECT 1)")).isEmpty();
	}

	@Test
	@DisplayName("unterminated comments and quotes run to the end")
	void unterminated() {
		assertThat(SqlNormalizer.normalize("SELECT 1 /* open")).isEqualTo("SELECT 1");
		assertThat(SqlNormalizer.terminatorCount("SELECT 'open; ;")).isZero();
	}
}
