package org.javai.askdata.result;

/**
 * Summary statistics over the non-null values of one numeric column.
 */
public record ColumnSummary(
		String column,
		int count,
		double mean,
		double median,
		double min,
		double max,
		double sum
) {
}
