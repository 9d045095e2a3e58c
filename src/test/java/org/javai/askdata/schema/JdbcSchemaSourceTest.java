package org.javai.askdata.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.askdata.store.ReadOnlyConnectionFactory;
import org.javai.askdata.store.SqliteConnectionFactory;
import org.javai.askdata.testsupport.BankingDatabase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JdbcSchemaSourceTest {

	@TempDir
	Path tempDir;

	@Test
	@DisplayName("introspects tables and columns with their declared types")
	void introspectsTables() throws SQLException {
		SqliteConnectionFactory connections = BankingDatabase.create(tempDir);

		SchemaDescriptor schema = new JdbcSchemaSource(connections).describe();

		assertThat(schema.tableNames()).containsExactlyInAnyOrder("customers", "accounts", "transactions");
		SchemaDescriptor.TableSpec transactions = schema.findTable("transactions").orElseThrow();
		assertThat(transactions.columns())
				.extracting(SchemaDescriptor.ColumnSpec::name)
				.containsExactly("transaction_id", "account_id", "transaction_type", "amount", "transaction_date");
		assertThat(transactions.findColumn("transaction_date").orElseThrow().declaredType()).isEqualTo("DATE");
	}

	@Test
	@DisplayName("skips engine-internal tables")
	void skipsInternalTables() throws SQLException {
		SqliteConnectionFactory connections = BankingDatabase.create(tempDir);
		BankingDatabase.execute(connections,
				"CREATE TABLE loans (loan_id INTEGER PRIMARY KEY AUTOINCREMENT, amount REAL)",
				"INSERT INTO loans (amount) VALUES (100.0)");

		SchemaDescriptor schema = new JdbcSchemaSource(connections).describe();

		assertThat(schema.tableNames()).contains("loans");
		assertThat(schema.tableNames()).noneMatch(name -> name.startsWith("sqlite_"));
	}

	@Test
	@DisplayName("keeps columns with their own table when names differ only where '_' stands")
	void underscoreInTableName() throws SQLException {
		SqliteConnectionFactory connections = BankingDatabase.create(tempDir);
		BankingDatabase.execute(connections,
				"CREATE TABLE a_b (x INTEGER)",
				"CREATE TABLE axb (y INTEGER, z TEXT)");

		SchemaDescriptor schema = new JdbcSchemaSource(connections).describe();

		assertThat(schema.findTable("a_b").orElseThrow().columns())
				.extracting(SchemaDescriptor.ColumnSpec::name)
				.containsExactly("x");
		assertThat(schema.findTable("axb").orElseThrow().columns())
				.extracting(SchemaDescriptor.ColumnSpec::name)
				.containsExactly("y", "z");
	}

	@Test
	@DisplayName("introspects once and then serves the cached descriptor")
	void cachesDescriptor() throws SQLException {
		SqliteConnectionFactory delegate = BankingDatabase.create(tempDir);
		AtomicInteger opened = new AtomicInteger();
		ReadOnlyConnectionFactory counting = () -> {
			opened.incrementAndGet();
			return delegate.open();
		};
		JdbcSchemaSource source = new JdbcSchemaSource(counting);

		SchemaDescriptor first = source.describe();
		SchemaDescriptor second = source.describe();

		assertThat(second).isSameAs(first);
		assertThat(opened).hasValue(1);
	}

	@Test
	@DisplayName("reports a missing database as unavailable")
	void missingDatabase() {
		JdbcSchemaSource source = new JdbcSchemaSource(new SqliteConnectionFactory(tempDir.resolve("missing.db")));

		assertThatThrownBy(source::describe)
				.isInstanceOf(SchemaUnavailableException.class);
	}

	@Test
	@DisplayName("reports a database without tables as unavailable")
	void emptyDatabase() throws SQLException {
		SqliteConnectionFactory connections = new SqliteConnectionFactory(tempDir.resolve("empty.db"));
		BankingDatabase.execute(connections, "CREATE TABLE scratch (x INTEGER)", "DROP TABLE scratch");

		assertThatThrownBy(() -> new JdbcSchemaSource(connections).describe())
				.isInstanceOf(SchemaUnavailableException.class)
				.hasMessageContaining("no tables");
	}

	@Test
	@DisplayName("static source returns the descriptor it wraps")
	void staticSource() {
		SchemaDescriptor schema = SchemaDescriptor.builder().addTable("t").build();
		assertThat(new StaticSchemaSource(schema).describe()).isSameAs(schema);
	}
}
