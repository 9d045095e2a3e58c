package org.javai.askdata.generation;

import java.util.Optional;

/**
 * What the oracle produced for one question.
 *
 * <p>An absent {@code extractedSql} is an ordinary state, not an error: the validator turns it
 * into a {@code NO_STATEMENT_FOUND} verdict. A refusal is a response that begins with the
 * {@code ERROR:} sentinel the prompt asks for when a question requests modification.</p>
 *
 * @param rawText the oracle's text exactly as returned
 * @param extractedSql the statement found in the text, or null
 * @param refused whether the oracle declined to answer
 */
public record CandidateQuery(String rawText, String extractedSql, boolean refused) {

	public CandidateQuery {
		rawText = rawText != null ? rawText : "";
		if (extractedSql != null && extractedSql.isBlank()) {
			extractedSql = null;
		}
		if (refused && extractedSql != null) {
			throw new IllegalArgumentException("a refusal carries no statement");
		}
	}

	public static CandidateQuery of(String rawText, String extractedSql) {
		return new CandidateQuery(rawText, extractedSql, false);
	}

	public static CandidateQuery empty(String rawText) {
		return new CandidateQuery(rawText, null, false);
	}

	public static CandidateQuery refusal(String rawText) {
		return new CandidateQuery(rawText, null, true);
	}

	public Optional<String> sql() {
		return Optional.ofNullable(extractedSql);
	}

	public boolean hasStatement() {
		return extractedSql != null;
	}
}
