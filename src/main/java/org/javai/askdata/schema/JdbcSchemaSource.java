package org.javai.askdata.schema;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.javai.askdata.store.ReadOnlyConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the schema descriptor by introspecting the store through JDBC metadata.
 *
 * <p>The store is introspected on the first call to {@link #describe()}; the resulting
 * descriptor is cached and returned unchanged afterwards. Engine-internal tables
 * ({@code sqlite_*}) are skipped.</p>
 */
public final class JdbcSchemaSource implements SchemaSource {

	private static final Logger logger = LoggerFactory.getLogger(JdbcSchemaSource.class);
	private static final String INTERNAL_TABLE_PREFIX = "sqlite_";

	private final ReadOnlyConnectionFactory connections;
	private volatile SchemaDescriptor cached;

	public JdbcSchemaSource(ReadOnlyConnectionFactory connections) {
		this.connections = Objects.requireNonNull(connections, "connections must not be null");
	}

	@Override
	public SchemaDescriptor describe() {
		SchemaDescriptor descriptor = cached;
		if (descriptor == null) {
			synchronized (this) {
				descriptor = cached;
				if (descriptor == null) {
					descriptor = introspect();
					cached = descriptor;
				}
			}
		}
		return descriptor;
	}

	private SchemaDescriptor introspect() {
		try (Connection connection = connections.open()) {
			DatabaseMetaData metaData = connection.getMetaData();
			SchemaDescriptor.Builder builder = SchemaDescriptor.builder();
			for (String table : tableNames(metaData)) {
				builder.addTable(table);
				try (ResultSet columns = metaData.getColumns(null, null, table, "%")) {
					while (columns.next()) {
						// the table name is a LIKE pattern, so '_' also matches other tables
						if (table.equals(columns.getString("TABLE_NAME"))) {
							builder.addColumn(table, columns.getString("COLUMN_NAME"), columns.getString("TYPE_NAME"));
						}
					}
				}
			}
			SchemaDescriptor descriptor = builder.build();
			if (descriptor.isEmpty()) {
				throw new SchemaUnavailableException("Store at " + connections + " contains no tables");
			}
			logger.info("Loaded schema with {} table(s): {}", descriptor.tables().size(), descriptor.tableNames());
			return descriptor;
		}
		catch (SQLException e) {
			throw new SchemaUnavailableException("Unable to introspect store: " + e.getMessage(), e);
		}
	}

	private static List<String> tableNames(DatabaseMetaData metaData) throws SQLException {
		List<String> names = new ArrayList<>();
		try (ResultSet tables = metaData.getTables(null, null, "%", new String[] { "TABLE" })) {
			while (tables.next()) {
				String name = tables.getString("TABLE_NAME");
				if (name != null && !name.toLowerCase(Locale.ROOT).startsWith(INTERNAL_TABLE_PREFIX)) {
					names.add(name);
				}
			}
		}
		return names;
	}
}
