package org.javai.askdata.validation;

import java.util.Locale;

/**
 * Quote-aware text operations on SQL.
 *
 * <p>Normalization replaces comments with a space, collapses whitespace runs outside quoted
 * spans to a single space and trims the result. Quoted spans ({@code '...'}, {@code "..."},
 * {@code `...`} and {@code [...]}) are copied verbatim. An unterminated quote runs to the end
 * of the text.</p>
 */
public final class SqlNormalizer {

	private SqlNormalizer() {
	}

	public static String normalize(String sql) {
		if (sql == null) {
			return "";
		}
		StringBuilder out = new StringBuilder(sql.length());
		int length = sql.length();
		int i = 0;
		boolean pendingSpace = false;
		while (i < length) {
			char c = sql.charAt(i);
			if (Character.isWhitespace(c)) {
				pendingSpace = true;
				i++;
				continue;
			}
			if (c == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
				int newline = sql.indexOf('\n', i);
				i = newline < 0 ? length : newline + 1;
				pendingSpace = true;
				continue;
			}
			if (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
				int close = sql.indexOf("*/", i + 2);
				i = close < 0 ? length : close + 2;
				pendingSpace = true;
				continue;
			}
			if (pendingSpace && out.length() > 0) {
				out.append(' ');
			}
			pendingSpace = false;
			int end = quotedSpanEnd(sql, i);
			if (end > i) {
				out.append(sql, i, end);
				i = end;
			}
			else {
				out.append(c);
				i++;
			}
		}
		return out.toString();
	}

	/**
	 * Removes a single trailing terminator, and the whitespace around it, from normalized text.
	 */
	public static String withoutTrailingTerminator(String normalized) {
		String text = normalized.strip();
		int[] positions = terminatorPositions(text);
		if (positions.length > 0 && positions[positions.length - 1] == text.length() - 1) {
			return text.substring(0, text.length() - 1).strip();
		}
		return text;
	}

	/**
	 * @return the number of {@code ;} characters outside quoted spans
	 */
	public static int terminatorCount(String normalized) {
		return terminatorPositions(normalized).length;
	}

	/**
	 * @return true if any terminator outside quoted spans is followed by further text
	 */
	public static boolean hasTextAfterTerminator(String normalized) {
		for (int position : terminatorPositions(normalized)) {
			String rest = normalized.substring(position + 1).replace(";", "");
			if (!rest.isBlank()) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Returns the first word after leading whitespace and comments, lower case, or an empty
	 * string if the text holds no word.
	 */
	public static String leadingWord(String sql) {
		String normalized = normalize(sql);
		int end = 0;
		while (end < normalized.length() && isIdentifierChar(normalized.charAt(end))) {
			end++;
		}
		return normalized.substring(0, end).toLowerCase(Locale.ROOT);
	}

	static boolean isIdentifierChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '$';
	}

	private static int[] terminatorPositions(String text) {
		int[] positions = new int[text.length()];
		int count = 0;
		int i = 0;
		while (i < text.length()) {
			int end = quotedSpanEnd(text, i);
			if (end > i) {
				i = end;
				continue;
			}
			if (text.charAt(i) == ';') {
				positions[count++] = i;
			}
			i++;
		}
		int[] result = new int[count];
		System.arraycopy(positions, 0, result, 0, count);
		return result;
	}

	/**
	 * @return the index just past the quoted span starting at {@code start}, or {@code start}
	 * if no quoted span starts there
	 */
	private static int quotedSpanEnd(String text, int start) {
		char open = text.charAt(start);
		char close;
		if (open == '\'' || open == '"' || open == '`') {
			close = open;
		}
		else if (open == '[') {
			close = ']';
		}
		else {
			return start;
		}
		int i = start + 1;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == close) {
				if (close != ']' && i + 1 < text.length() && text.charAt(i + 1) == close) {
					i += 2;
					continue;
				}
				return i + 1;
			}
			i++;
		}
		return text.length();
	}
}
