package org.javai.askdata.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SchemaDescriptorTest {

	private final SchemaDescriptor schema = SchemaDescriptor.builder()
			.addTable("customers")
			.addColumn("customers", "customer_id", "INTEGER")
			.addColumn("customers", "name", "TEXT")
			.addColumn("accounts", "balance", "REAL")
			.build();

	@Nested
	@DisplayName("Builder")
	class BuilderBehaviour {

		@Test
		@DisplayName("keeps tables and columns in insertion order")
		void keepsInsertionOrder() {
			assertThat(schema.tableNames()).containsExactly("customers", "accounts");
			assertThat(schema.tables().get(0).columns())
					.extracting(SchemaDescriptor.ColumnSpec::name)
					.containsExactly("customer_id", "name");
		}

		@Test
		@DisplayName("creates a table implicitly when a column is added to it")
		void createsTableForColumn() {
			assertThat(schema.findTable("accounts")).isPresent();
			assertThat(schema.findTable("accounts").get().findColumn("BALANCE")).isPresent();
		}

		@Test
		@DisplayName("treats differently cased names as the same table")
		void mergesCaseVariants() {
			SchemaDescriptor merged = SchemaDescriptor.builder()
					.addTable("Orders")
					.addColumn("ORDERS", "id", "INTEGER")
					.build();

			assertThat(merged.tables()).hasSize(1);
			assertThat(merged.tables().get(0).name()).isEqualTo("Orders");
		}

		@Test
		@DisplayName("ignores blank table names")
		void ignoresBlankNames() {
			assertThat(SchemaDescriptor.builder().addTable(" ").build().isEmpty()).isTrue();
		}
	}

	@Nested
	@DisplayName("Lookup")
	class Lookup {

		@Test
		@DisplayName("finds tables ignoring case")
		void findsIgnoringCase() {
			assertThat(schema.hasTable("CUSTOMERS")).isTrue();
			assertThat(schema.hasTable("loans")).isFalse();
			assertThat(schema.hasTable(null)).isFalse();
		}

		@Test
		@DisplayName("normalises a missing declared type to blank")
		void blankDeclaredType() {
			SchemaDescriptor.ColumnSpec column = new SchemaDescriptor.ColumnSpec("x", null);
			assertThat(column.declaredType()).isEmpty();
		}

		@Test
		@DisplayName("rejects blank table names in records")
		void rejectsBlankTableName() {
			assertThatThrownBy(() -> new SchemaDescriptor.TableSpec("", null))
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("is immutable")
		void immutable() {
			assertThatThrownBy(() -> schema.tables().clear())
					.isInstanceOf(UnsupportedOperationException.class);
		}
	}
}
