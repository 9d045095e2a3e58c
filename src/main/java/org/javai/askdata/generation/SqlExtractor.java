package org.javai.askdata.generation;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a SQL statement out of free-form oracle output.
 *
 * <p>The oracle is asked for a bare statement but frequently wraps it in a markdown fence,
 * prefixes it with a label such as {@code SQL Query:}, or follows it with an explanation.
 * Extraction strips the fence, skips the label and starts at the first line that opens a
 * statement. A line that merely begins with a SQL verb ({@code "Select the customers like
 * this:"}) is prose, not a statement. The statement ends at the first terminator outside
 * quotes and comments, or where a line of explanation begins. If another statement follows,
 * the remainder is kept so that the validator sees it. Nothing is ever repaired.</p>
 */
public final class SqlExtractor {

	private static final Pattern FENCE = Pattern.compile(
			"```(?:([A-Za-z0-9_+-]+)?[ \\t]*\\r?\\n)?(.*?)(?:```|\\z)", Pattern.DOTALL);

	private static final Pattern LABEL = Pattern.compile("(?i)(?:sql(?:\\s+query)?|query)\\s*:\\s*");

	private static final Pattern STATEMENT_START = Pattern.compile(
			"(?i)(?:select|with|insert|update|delete|drop|create|alter|truncate|replace|merge|upsert|pragma"
					+ "|attach|detach|grant|revoke|begin|commit|rollback|savepoint|vacuum|reindex|explain|values"
					+ "|exec|execute|call)\\b");

	private static final Pattern WORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	/**
	 * Words that follow a verb in a sentence but not in a statement.
	 */
	private static final Set<String> PROSE_WORDS = Set.of("the", "an", "this", "that", "these", "those", "it",
			"its", "is", "are", "was", "were", "will", "would", "can", "could", "should", "you", "your", "we",
			"our", "my", "me", "us", "here", "following", "below", "above", "to", "by", "if", "when", "which");

	private static final String SENTENCE_PUNCTUATION = ":,.!?";

	/**
	 * Sentence openers that start an explanation on the line after a statement.
	 */
	private static final Pattern PROSE_OPENER = Pattern.compile(
			"(?:This|The|These|That|It|Here|Note|Explanation|I|We|You)(?:\\s|:)");

	/**
	 * Text that carries a statement on past a blank line.
	 */
	private static final Pattern CONTINUATION = Pattern.compile(
			"(?i)(?:[(),]|(?:from|where|group|order|having|limit|offset|join|inner|left|right|full|cross|natural"
					+ "|on|and|or|union|intersect|except|window|select|as)\\b)");

	private static final String REFUSAL_PREFIX = "ERROR:";

	private static final String QUOTES = "\"'`\u201C\u2018";

	private SqlExtractor() {
	}

	/**
	 * Interprets a raw oracle response as a candidate query.
	 */
	public static CandidateQuery toCandidate(String rawText) {
		if (rawText == null || rawText.isBlank()) {
			return CandidateQuery.empty(rawText);
		}
		if (isRefusal(rawText)) {
			return CandidateQuery.refusal(rawText);
		}
		return extract(rawText)
				.map(sql -> CandidateQuery.of(rawText, sql))
				.orElseGet(() -> CandidateQuery.empty(rawText));
	}

	/**
	 * @return true if the response begins with the refusal sentinel, fenced, quoted or bare
	 */
	public static boolean isRefusal(String rawText) {
		if (rawText == null) {
			return false;
		}
		String body = unfence(rawText).strip();
		int start = 0;
		while (start < body.length() && QUOTES.indexOf(body.charAt(start)) >= 0) {
			start++;
		}
		return body.regionMatches(true, start, REFUSAL_PREFIX, 0, REFUSAL_PREFIX.length());
	}

	public static Optional<String> extract(String rawText) {
		if (rawText == null || rawText.isBlank()) {
			return Optional.empty();
		}
		String text = unfence(rawText);
		int start = statementStart(text);
		if (start < 0) {
			return Optional.empty();
		}
		int end = statementEnd(text, start);
		String statement;
		if (end == text.length() || text.charAt(end) != ';') {
			statement = text.substring(start, end);
		}
		else if (startsStatement(text, skipWhitespaceAndComments(text, end + 1))) {
			statement = text.substring(start);
		}
		else {
			statement = text.substring(start, end + 1);
		}
		statement = statement.strip();
		return statement.isEmpty() ? Optional.empty() : Optional.of(statement);
	}

	static String unfence(String text) {
		if (!text.contains("```")) {
			return text;
		}
		Matcher matcher = FENCE.matcher(text);
		String first = null;
		while (matcher.find()) {
			String language = matcher.group(1);
			String body = matcher.group(2);
			if (language != null && language.equalsIgnoreCase("sql")) {
				return body;
			}
			if (first == null) {
				first = body;
			}
		}
		return first != null ? first : text;
	}

	private static int statementStart(String text) {
		int lineStart = 0;
		int length = text.length();
		while (lineStart < length) {
			int lineEnd = text.indexOf('\n', lineStart);
			if (lineEnd < 0) {
				lineEnd = length;
			}
			int pos = lineStart;
			while (pos < lineEnd && Character.isWhitespace(text.charAt(pos))) {
				pos++;
			}
			Matcher label = LABEL.matcher(text).region(pos, lineEnd);
			if (label.lookingAt()) {
				pos = label.end();
			}
			int candidate = skipWhitespaceAndComments(text, pos);
			if (startsStatement(text, candidate) && looksLikeStatement(text, candidate)) {
				return pos;
			}
			lineStart = lineEnd + 1;
		}
		return -1;
	}

	private static boolean startsStatement(String text, int pos) {
		if (pos >= text.length()) {
			return false;
		}
		return STATEMENT_START.matcher(text).region(pos, text.length()).lookingAt();
	}

	/**
	 * Tells a statement from a sentence that happens to begin with a SQL verb.
	 */
	private static boolean looksLikeStatement(String text, int pos) {
		Matcher verb = STATEMENT_START.matcher(text).region(pos, text.length());
		if (!verb.lookingAt()) {
			return false;
		}
		int afterVerb = verb.end();
		if (afterVerb < text.length() && SENTENCE_PUNCTUATION.indexOf(text.charAt(afterVerb)) >= 0) {
			return false;
		}
		int lineEnd = text.indexOf('\n', pos);
		if (lineEnd < 0) {
			lineEnd = text.length();
		}
		if (text.substring(pos, lineEnd).strip().endsWith(":")) {
			return false;
		}
		int wordStart = afterVerb;
		while (wordStart < text.length() && Character.isWhitespace(text.charAt(wordStart))) {
			wordStart++;
		}
		Matcher word = WORD.matcher(text).region(wordStart, text.length());
		if (wordStart > afterVerb && word.lookingAt()) {
			int wordEnd = word.end();
			boolean wholeWord = wordEnd == text.length() || Character.isWhitespace(text.charAt(wordEnd));
			return !(wholeWord && PROSE_WORDS.contains(word.group().toLowerCase(Locale.ROOT)));
		}
		return true;
	}

	/**
	 * @return the index of the terminating semicolon, of the line break before trailing prose,
	 *         or the text length
	 */
	private static int statementEnd(String text, int from) {
		int length = text.length();
		int i = from;
		while (i < length) {
			char c = text.charAt(i);
			if (c == '\'' || c == '"' || c == '`') {
				i = skipQuoted(text, i, c);
			}
			else if (c == '[') {
				int close = text.indexOf(']', i + 1);
				i = close < 0 ? length : close + 1;
			}
			else if (c == '-' && i + 1 < length && text.charAt(i + 1) == '-') {
				int newline = text.indexOf('\n', i);
				i = newline < 0 ? length : newline;
			}
			else if (c == '/' && i + 1 < length && text.charAt(i + 1) == '*') {
				int close = text.indexOf("*/", i + 2);
				i = close < 0 ? length : close + 2;
			}
			else if (c == ';') {
				return i;
			}
			else if (c == '\n' && endsStatement(text, i + 1)) {
				return i;
			}
			else {
				i++;
			}
		}
		return length;
	}

	/**
	 * Decides whether the text after a line break is explanation rather than more of the statement.
	 * A following statement is never treated as explanation.
	 */
	private static boolean endsStatement(String text, int from) {
		int length = text.length();
		int pos = from;
		boolean blankLine = false;
		while (pos < length && Character.isWhitespace(text.charAt(pos))) {
			if (text.charAt(pos) == '\n') {
				blankLine = true;
			}
			pos++;
		}
		if (pos == length) {
			return true;
		}
		if (startsStatement(text, pos)) {
			return !looksLikeStatement(text, pos);
		}
		if (blankLine) {
			return !CONTINUATION.matcher(text).region(pos, length).lookingAt();
		}
		return PROSE_OPENER.matcher(text).region(pos, length).lookingAt();
	}

	private static int skipQuoted(String text, int open, char quote) {
		int i = open + 1;
		while (i < text.length()) {
			if (text.charAt(i) == quote) {
				if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
					i += 2;
					continue;
				}
				return i + 1;
			}
			i++;
		}
		return text.length();
	}

	private static int skipWhitespaceAndComments(String text, int from) {
		int length = text.length();
		int i = from;
		while (i < length) {
			char c = text.charAt(i);
			if (Character.isWhitespace(c)) {
				i++;
			}
			else if (c == '-' && i + 1 < length && text.charAt(i + 1) == '-') {
				int newline = text.indexOf('\n', i);
				i = newline < 0 ? length : newline + 1;
			}
			else if (c == '/' && i + 1 < length && text.charAt(i + 1) == '*') {
				int close = text.indexOf("*/", i + 2);
				i = close < 0 ? length : close + 2;
			}
			else {
				break;
			}
		}
		return i;
	}
}
