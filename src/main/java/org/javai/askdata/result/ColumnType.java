package org.javai.askdata.result;

/**
 * Type of a result column as inferred from its declared type and its values.
 */
public enum ColumnType {
	NUMERIC,
	TEMPORAL,
	TEXT,
	BOOLEAN,
	UNKNOWN
}
