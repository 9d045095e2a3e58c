package org.javai.askdata.validation;

import java.util.List;

/**
 * Tunable parts of validation. The denylist defaults and the ordering of the rules are fixed.
 *
 * @param parseCheck whether admitted text must also parse as a single SELECT and reference only known tables
 * @param extraDeniedKeywords keywords rejected in addition to the defaults
 */
public record ValidatorPolicy(boolean parseCheck, List<String> extraDeniedKeywords) {

	public ValidatorPolicy {
		extraDeniedKeywords = extraDeniedKeywords != null ? List.copyOf(extraDeniedKeywords) : List.of();
	}

	public static ValidatorPolicy defaults() {
		return new ValidatorPolicy(true, List.of());
	}

	public static ValidatorPolicy textOnly() {
		return new ValidatorPolicy(false, List.of());
	}
}
