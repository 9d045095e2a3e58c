package org.javai.askdata.validation;

import java.util.List;

/**
 * Groups of keywords that disqualify a statement wherever they appear. A keyword ending in
 * {@code _} is a prefix: it matches every identifier that starts with it.
 */
public enum DenyCategory {
	DATA_MODIFYING("insert", "update", "delete", "merge", "replace", "upsert", "truncate"),
	SCHEMA_ALTERING("create", "alter", "drop", "rename", "reindex", "vacuum"),
	PRIVILEGE_ALTERING("grant", "revoke"),
	TRANSACTION_CONTROL("begin", "commit", "rollback", "savepoint"),
	FILE_SYSTEM_ACCESS("attach", "detach", "load_extension", "readfile", "writefile", "outfile", "dumpfile"),
	ADMINISTRATIVE("pragma", "pragma_", "recursive", "exec", "execute", "call", "shutdown"),
	/**
	 * Keywords added by configuration.
	 */
	CUSTOM;

	private final List<String> keywords;

	DenyCategory(String... keywords) {
		this.keywords = List.of(keywords);
	}

	public List<String> keywords() {
		return keywords;
	}
}
