package org.javai.askdata.result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class QueryResultTest {

	private final List<ResultColumn> columns = List.of(
			new ResultColumn("name", ColumnType.TEXT),
			new ResultColumn("total", ColumnType.NUMERIC));

	@Test
	void rowsMustMatchColumns() {
		assertThatThrownBy(() -> new QueryResult(columns, List.of(List.of("only one")), false))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("2 values");
	}

	@Test
	void rowsAreCopiedAndMayHoldNulls() {
		List<Object> row = new ArrayList<>(Arrays.asList("Alice", null));
		QueryResult result = new QueryResult(columns, List.of(row), false);
		row.set(0, "changed");

		assertThat(result.rows().get(0)).containsExactly("Alice", null);
		assertThatThrownBy(() -> result.rows().get(0).set(0, "x")).isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void columnAccessors() {
		QueryResult result = new QueryResult(columns, List.of(List.of("a", 1), List.of("b", 2)), false);

		assertThat(result.columnNames()).containsExactly("name", "total");
		assertThat(result.columnsOfType(ColumnType.NUMERIC)).extracting(ResultColumn::name).containsExactly("total");
		assertThat(result.columnValues(1)).containsExactly(1, 2);
		assertThatThrownBy(() -> result.columnValues(2)).isInstanceOf(IndexOutOfBoundsException.class);
	}
}
