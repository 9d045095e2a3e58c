package org.javai.askdata.visualization;

import java.util.ArrayList;
import java.util.List;
import org.javai.askdata.result.ColumnType;
import org.javai.askdata.result.QueryResult;
import org.javai.askdata.result.ResultColumn;

/**
 * Chooses a rendering for a query result from its shape.
 *
 * <p>The choice depends only on the row count, the column count and the inferred column
 * types, so the same result always gets the same chart. Rules in order:</p>
 * <ol>
 *   <li>no rows, or more than {@code maxColumns} columns: table</li>
 *   <li>exactly one temporal and one numeric column: time series</li>
 *   <li>more than {@code displayThreshold} rows, or a single row: table</li>
 *   <li>one text and one numeric column: bar</li>
 *   <li>an axis column and two or more numeric columns: line</li>
 *   <li>anything else: table</li>
 * </ol>
 */
public final class VisualizationSelector {

	public static final int DEFAULT_DISPLAY_THRESHOLD = 500;
	public static final int DEFAULT_MAX_COLUMNS = 10;

	private final int displayThreshold;
	private final int maxColumns;

	public VisualizationSelector() {
		this(DEFAULT_DISPLAY_THRESHOLD, DEFAULT_MAX_COLUMNS);
	}

	public VisualizationSelector(int displayThreshold, int maxColumns) {
		if (displayThreshold <= 0) {
			throw new IllegalArgumentException("displayThreshold must be > 0");
		}
		if (maxColumns < 2) {
			throw new IllegalArgumentException("maxColumns must be >= 2");
		}
		this.displayThreshold = displayThreshold;
		this.maxColumns = maxColumns;
	}

	public ChartSpec select(QueryResult result) {
		if (result == null || result.rowCount() == 0) {
			return ChartSpec.table("No rows to chart");
		}
		List<ResultColumn> columns = result.columns();
		if (columns.size() > maxColumns) {
			return ChartSpec.table("Too many columns to chart (" + columns.size() + " > " + maxColumns + ")");
		}

		List<ResultColumn> temporal = result.columnsOfType(ColumnType.TEMPORAL);
		List<ResultColumn> numeric = result.columnsOfType(ColumnType.NUMERIC);
		List<ResultColumn> text = result.columnsOfType(ColumnType.TEXT);

		if (columns.size() == 2 && temporal.size() == 1 && numeric.size() == 1) {
			return new ChartSpec(ChartKind.TIME_SERIES, temporal.get(0).name(), List.of(numeric.get(0).name()),
					"One date/time column with one numeric column");
		}
		if (result.rowCount() > displayThreshold) {
			return ChartSpec.table("Row count " + result.rowCount() + " exceeds display threshold " + displayThreshold);
		}
		if (result.rowCount() == 1) {
			return ChartSpec.table("Single row result");
		}
		if (columns.size() == 2 && text.size() == 1 && numeric.size() == 1) {
			return new ChartSpec(ChartKind.BAR, text.get(0).name(), List.of(numeric.get(0).name()),
					"One categorical column with one numeric column");
		}

		ResultColumn axis = axisColumn(result, temporal);
		if (axis != null) {
			List<String> series = new ArrayList<>();
			for (ResultColumn column : numeric) {
				if (column != axis) {
					series.add(column.name());
				}
			}
			if (series.size() >= 2 && series.size() == columns.size() - 1) {
				return new ChartSpec(ChartKind.LINE, axis.name(), series,
						"Several numeric columns over a shared axis");
			}
		}
		return ChartSpec.table("No chart fits this result shape");
	}

	/**
	 * The shared axis for a line chart: the single temporal column, or a first column of
	 * strictly increasing whole numbers.
	 */
	private static ResultColumn axisColumn(QueryResult result, List<ResultColumn> temporal) {
		if (temporal.size() == 1) {
			return temporal.get(0);
		}
		if (!temporal.isEmpty()) {
			return null;
		}
		ResultColumn first = result.columns().get(0);
		if (!first.isNumeric()) {
			return null;
		}
		long previous = Long.MIN_VALUE;
		for (Object value : result.columnValues(0)) {
			if (!isIntegral(value)) {
				return null;
			}
			long current = ((Number) value).longValue();
			if (current <= previous) {
				return null;
			}
			previous = current;
		}
		return first;
	}

	private static boolean isIntegral(Object value) {
		return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte;
	}

	public int displayThreshold() {
		return displayThreshold;
	}

	public int maxColumns() {
		return maxColumns;
	}
}
