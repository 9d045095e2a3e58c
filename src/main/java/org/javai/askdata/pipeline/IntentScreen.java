package org.javai.askdata.pipeline;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns away questions that plainly ask to change data, before the oracle is called.
 *
 * <p>This saves an oracle round trip and gives a clearer message. It is not a safety
 * mechanism: the validator and the read-only connection enforce that.</p>
 */
public final class IntentScreen {

	public static final List<String> DEFAULT_VERBS = List.of(
			"delete", "remove", "drop", "erase", "update", "change", "modify", "edit",
			"alter", "insert", "add", "create", "new", "truncate", "clear", "wipe");

	private final List<String> verbs;
	private final Pattern pattern;

	public IntentScreen() {
		this(DEFAULT_VERBS);
	}

	public IntentScreen(List<String> verbs) {
		if (verbs == null || verbs.isEmpty()) {
			throw new IllegalArgumentException("verbs must not be empty");
		}
		this.verbs = List.copyOf(verbs);
		StringBuilder alternatives = new StringBuilder();
		for (String verb : this.verbs) {
			if (alternatives.length() > 0) {
				alternatives.append('|');
			}
			alternatives.append(Pattern.quote(verb.toLowerCase(Locale.ROOT)));
		}
		this.pattern = Pattern.compile("\\b(" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE);
	}

	/**
	 * @return the first modification verb in the question, if any
	 */
	public Optional<String> findModificationIntent(String question) {
		if (question == null) {
			return Optional.empty();
		}
		Matcher matcher = pattern.matcher(question);
		return matcher.find() ? Optional.of(matcher.group(1).toLowerCase(Locale.ROOT)) : Optional.empty();
	}

	public List<String> verbs() {
		return verbs;
	}
}
