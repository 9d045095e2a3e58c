package org.javai.askdata.validation;

import java.util.Objects;

/**
 * A statement the validator has admitted for execution.
 *
 * <p>Instances can only be created by {@link QueryValidator}; the executor accepts nothing
 * else, so raw oracle text has no path to the database.</p>
 */
public final class AdmittedQuery {

	private final String sql;
	private final String extractedSql;

	AdmittedQuery(String sql, String extractedSql) {
		if (sql == null || sql.isBlank()) {
			throw new IllegalArgumentException("sql must not be blank");
		}
		this.sql = sql;
		this.extractedSql = extractedSql;
	}

	/**
	 * @return the normalized statement, without comments or a trailing terminator
	 */
	public String sql() {
		return sql;
	}

	/**
	 * @return the statement as it was extracted from the oracle's response
	 */
	public String extractedSql() {
		return extractedSql;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof AdmittedQuery other)) {
			return false;
		}
		return sql.equals(other.sql) && Objects.equals(extractedSql, other.extractedSql);
	}

	@Override
	public int hashCode() {
		return Objects.hash(sql, extractedSql);
	}

	@Override
	public String toString() {
		return "AdmittedQuery[" + sql + "]";
	}
}
