package org.javai.askdata.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Whole-word keyword matcher over untrusted SQL text.
 *
 * <p>A keyword only matches when it is not part of a longer identifier, so {@code dropout_rate}
 * and {@code created_at} are safe while {@code DROP} is not. Matching is case-insensitive.
 * Configured keywords extend the defaults; the defaults can never be removed.</p>
 *
 * <p>A keyword ending in {@code _} is a prefix and covers whole families of identifiers, such as
 * SQLite's {@code pragma_table_info} table-valued functions.</p>
 */
public final class Denylist {

	private static final String IDENTIFIER_CHAR = "[A-Za-z0-9_$]";

	private final Map<String, DenyCategory> keywords;
	private final Pattern pattern;

	private Denylist(Map<String, DenyCategory> keywords) {
		this.keywords = Map.copyOf(keywords);
		List<String> alternatives = new ArrayList<>();
		for (String keyword : keywords.keySet()) {
			alternatives.add(isPrefix(keyword)
					? Pattern.quote(keyword) + IDENTIFIER_CHAR + "*"
					: Pattern.quote(keyword));
		}
		this.pattern = Pattern.compile("(?<!" + IDENTIFIER_CHAR + ")(" + String.join("|", alternatives) + ")(?!"
				+ IDENTIFIER_CHAR + ")", Pattern.CASE_INSENSITIVE);
	}

	public static Denylist defaults() {
		return withExtras(List.of());
	}

	/**
	 * @param extras additional keywords; blank entries are ignored
	 */
	public static Denylist withExtras(Collection<String> extras) {
		Map<String, DenyCategory> keywords = new LinkedHashMap<>();
		for (DenyCategory category : DenyCategory.values()) {
			for (String keyword : category.keywords()) {
				keywords.put(keyword, category);
			}
		}
		if (extras != null) {
			for (String extra : extras) {
				if (extra == null || extra.isBlank()) {
					continue;
				}
				keywords.putIfAbsent(extra.strip().toLowerCase(Locale.ROOT), DenyCategory.CUSTOM);
			}
		}
		return new Denylist(keywords);
	}

	/**
	 * Finds the earliest denylisted keyword in the text.
	 */
	public Optional<Match> firstMatch(String text) {
		if (text == null || text.isEmpty()) {
			return Optional.empty();
		}
		Matcher matcher = pattern.matcher(text);
		if (!matcher.find()) {
			return Optional.empty();
		}
		String keyword = matcher.group(1).toLowerCase(Locale.ROOT);
		return Optional.of(new Match(keyword, categoryOf(keyword), matcher.start(1)));
	}

	private DenyCategory categoryOf(String matched) {
		DenyCategory exact = keywords.get(matched);
		if (exact != null) {
			return exact;
		}
		for (Map.Entry<String, DenyCategory> entry : keywords.entrySet()) {
			if (isPrefix(entry.getKey()) && matched.startsWith(entry.getKey())) {
				return entry.getValue();
			}
		}
		return DenyCategory.CUSTOM;
	}

	private static boolean isPrefix(String keyword) {
		return keyword.endsWith("_");
	}

	public boolean contains(String keyword) {
		return keyword != null && keywords.containsKey(keyword.toLowerCase(Locale.ROOT));
	}

	public Set<String> keywords() {
		return keywords.keySet();
	}

	/**
	 * A denylisted keyword found in the text.
	 *
	 * @param keyword the matched text, lower case; for a prefix keyword the whole identifier
	 * @param category the category it belongs to
	 * @param position offset of the match in the scanned text
	 */
	public record Match(String keyword, DenyCategory category, int position) {
	}
}
