package org.javai.askdata.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable description of the tables and columns a question may be answered from.
 *
 * <p>The descriptor grounds every generation request and backs the validator's
 * table reference check. Once built it is never mutated, so a single instance can be
 * shared by concurrent pipeline invocations without synchronisation.</p>
 *
 * <pre>{@code
 * SchemaDescriptor schema = SchemaDescriptor.builder()
 *     .addTable("transactions")
 *     .addColumn("transactions", "amount", "REAL")
 *     .addColumn("transactions", "transaction_date", "TIMESTAMP")
 *     .build();
 * }</pre>
 *
 * @param tables tables in declaration order
 */
public record SchemaDescriptor(List<TableSpec> tables) {

	public SchemaDescriptor {
		tables = tables != null ? List.copyOf(tables) : List.of();
	}

	public static SchemaDescriptor empty() {
		return new SchemaDescriptor(List.of());
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean isEmpty() {
		return tables.isEmpty();
	}

	/**
	 * Finds a table by name, ignoring case.
	 */
	public Optional<TableSpec> findTable(String name) {
		if (name == null || name.isBlank()) {
			return Optional.empty();
		}
		return tables.stream()
				.filter(t -> t.name().equalsIgnoreCase(name))
				.findFirst();
	}

	public boolean hasTable(String name) {
		return findTable(name).isPresent();
	}

	public List<String> tableNames() {
		return tables.stream().map(TableSpec::name).toList();
	}

	/**
	 * A table and its columns in ordinal order.
	 */
	public record TableSpec(String name, List<ColumnSpec> columns) {

		public TableSpec {
			if (name == null || name.isBlank()) {
				throw new IllegalArgumentException("table name must not be blank");
			}
			columns = columns != null ? List.copyOf(columns) : List.of();
		}

		public Optional<ColumnSpec> findColumn(String columnName) {
			if (columnName == null || columnName.isBlank()) {
				return Optional.empty();
			}
			return columns.stream()
					.filter(c -> c.name().equalsIgnoreCase(columnName))
					.findFirst();
		}
	}

	/**
	 * A column with the type the store declares for it (may be blank for untyped SQLite columns).
	 */
	public record ColumnSpec(String name, String declaredType) {

		public ColumnSpec {
			if (name == null || name.isBlank()) {
				throw new IllegalArgumentException("column name must not be blank");
			}
			declaredType = declaredType != null ? declaredType.trim() : "";
		}
	}

	/**
	 * Fluent builder. Tables keep insertion order; adding a column to an unknown table creates it.
	 */
	public static final class Builder {

		private final Map<String, TableBuilder> tables = new LinkedHashMap<>();

		private Builder() {
		}

		public Builder addTable(String tableName) {
			if (tableName == null || tableName.isBlank()) {
				return this;
			}
			tables.putIfAbsent(key(tableName), new TableBuilder(tableName));
			return this;
		}

		public Builder addColumn(String tableName, String columnName, String declaredType) {
			if (tableName == null || tableName.isBlank() || columnName == null || columnName.isBlank()) {
				return this;
			}
			TableBuilder table = tables.computeIfAbsent(key(tableName), k -> new TableBuilder(tableName));
			table.columns.put(key(columnName), new ColumnSpec(columnName, declaredType));
			return this;
		}

		public SchemaDescriptor build() {
			List<TableSpec> built = new ArrayList<>();
			for (TableBuilder table : tables.values()) {
				built.add(new TableSpec(table.name, new ArrayList<>(table.columns.values())));
			}
			return new SchemaDescriptor(built);
		}

		private static String key(String name) {
			return name.toLowerCase(Locale.ROOT);
		}
	}

	private static final class TableBuilder {
		private final String name;
		private final Map<String, ColumnSpec> columns = new LinkedHashMap<>();

		private TableBuilder(String name) {
			this.name = name;
		}
	}
}
