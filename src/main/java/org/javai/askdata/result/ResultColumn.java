package org.javai.askdata.result;

/**
 * A column of a query result.
 *
 * @param name the column label as reported by the store
 * @param inferredType the inferred type
 */
public record ResultColumn(String name, ColumnType inferredType) {

	public ResultColumn {
		if (name == null) {
			throw new IllegalArgumentException("name must not be null");
		}
		inferredType = inferredType != null ? inferredType : ColumnType.UNKNOWN;
	}

	public boolean isNumeric() {
		return inferredType == ColumnType.NUMERIC;
	}
}
