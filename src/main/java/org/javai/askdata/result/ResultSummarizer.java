package org.javai.askdata.result;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Computes mean, median, min, max and sum for every numeric column of a result.
 */
public final class ResultSummarizer {

	/**
	 * @return one summary per numeric column holding at least one value, in column order
	 */
	public List<ColumnSummary> summarize(QueryResult result) {
		List<ColumnSummary> summaries = new ArrayList<>();
		for (int i = 0; i < result.columnCount(); i++) {
			ResultColumn column = result.columns().get(i);
			if (!column.isNumeric()) {
				continue;
			}
			double[] values = result.columnValues(i).stream()
					.filter(Number.class::isInstance)
					.mapToDouble(v -> ((Number) v).doubleValue())
					.toArray();
			if (values.length == 0) {
				continue;
			}
			summaries.add(summarize(column.name(), values));
		}
		return summaries;
	}

	private static ColumnSummary summarize(String name, double[] values) {
		double[] sorted = values.clone();
		Arrays.sort(sorted);
		double sum = 0;
		for (double v : sorted) {
			sum += v;
		}
		int n = sorted.length;
		double median = n % 2 == 1 ? sorted[n / 2] : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
		return new ColumnSummary(name, n, sum / n, median, sorted[0], sorted[n - 1], sum);
	}
}
