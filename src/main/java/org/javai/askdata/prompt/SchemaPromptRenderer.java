package org.javai.askdata.prompt;

import org.javai.askdata.schema.SchemaDescriptor;
import org.javai.askdata.schema.SchemaDescriptor.ColumnSpec;
import org.javai.askdata.schema.SchemaDescriptor.TableSpec;

/**
 * Renders a schema descriptor as the compact table/column contract embedded in prompts.
 *
 * <pre>
 * DATABASE SCHEMA:
 * - customers
 *   • customer_id (INTEGER)
 *   • name (TEXT)
 * </pre>
 */
public final class SchemaPromptRenderer {

	private static final String SCHEMA_FOOTER = """

			Table and column names MUST be taken from this schema exactly as shown.
			If a name does not appear in this schema, do not use it.""";

	private SchemaPromptRenderer() {
	}

	public static String render(SchemaDescriptor schema) {
		StringBuilder sb = new StringBuilder("DATABASE SCHEMA:\n");
		if (schema == null || schema.isEmpty()) {
			sb.append("(no tables available)\n");
			return sb.toString().trim();
		}
		for (TableSpec table : schema.tables()) {
			sb.append("- ").append(table.name()).append("\n");
			for (ColumnSpec column : table.columns()) {
				sb.append("  • ").append(column.name());
				if (!column.declaredType().isBlank()) {
					sb.append(" (").append(column.declaredType()).append(")");
				}
				sb.append("\n");
			}
		}
		sb.append(SCHEMA_FOOTER);
		return sb.toString().trim();
	}
}
