package org.javai.askdata.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows returned by an executed query.
 *
 * <p>Immutable. Cells may be null. {@code truncated} is true only when the store had more
 * rows than the execution limit allowed.</p>
 *
 * @param columns the columns, in select-list order
 * @param rows the rows; every row has one value per column
 * @param truncated whether rows were dropped because of the row limit
 */
public record QueryResult(List<ResultColumn> columns, List<List<Object>> rows, boolean truncated) {

	public QueryResult {
		columns = columns != null ? List.copyOf(columns) : List.of();
		List<List<Object>> copy = new ArrayList<>();
		if (rows != null) {
			for (List<Object> row : rows) {
				if (row == null || row.size() != columns.size()) {
					throw new IllegalArgumentException("every row must have " + columns.size() + " values");
				}
				copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
			}
		}
		rows = Collections.unmodifiableList(copy);
	}

	public static QueryResult empty(List<ResultColumn> columns) {
		return new QueryResult(columns, List.of(), false);
	}

	public int rowCount() {
		return rows.size();
	}

	public int columnCount() {
		return columns.size();
	}

	public boolean isEmpty() {
		return rows.isEmpty();
	}

	public List<String> columnNames() {
		List<String> names = new ArrayList<>(columns.size());
		for (ResultColumn column : columns) {
			names.add(column.name());
		}
		return names;
	}

	public List<ResultColumn> columnsOfType(ColumnType type) {
		return columns.stream().filter(c -> c.inferredType() == type).toList();
	}

	/**
	 * @return the values of one column, top to bottom
	 */
	public List<Object> columnValues(int columnIndex) {
		if (columnIndex < 0 || columnIndex >= columns.size()) {
			throw new IndexOutOfBoundsException("column " + columnIndex + " of " + columns.size());
		}
		List<Object> values = new ArrayList<>(rows.size());
		for (List<Object> row : rows) {
			values.add(row.get(columnIndex));
		}
		return values;
	}
}
