package org.javai.askdata.validation;

import java.util.Optional;
import java.util.Set;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.javai.askdata.schema.SchemaDescriptor;

/**
 * Parses a statement that has passed the text rules and checks its type and table references.
 */
final class StatementInspector {

	private final SchemaDescriptor schema;

	StatementInspector(SchemaDescriptor schema) {
		this.schema = schema;
	}

	/**
	 * @return a rejecting verdict, or empty if the statement is a SELECT over known tables
	 */
	Optional<ValidationVerdict> inspect(String sql) {
		Statement statement;
		try {
			statement = CCJSqlParserUtil.parse(sql);
		}
		catch (JSQLParserException e) {
			return Optional.of(ValidationVerdict.reject(ReasonCode.UNPARSEABLE, null,
					"Invalid SQL syntax: " + firstLine(e.getMessage())));
		}

		if (!(statement instanceof Select select)) {
			return Optional.of(ValidationVerdict.reject(ReasonCode.NOT_READ_ONLY,
					statement.getClass().getSimpleName(),
					"Only SELECT statements are allowed, got: " + statement.getClass().getSimpleName()));
		}

		if (schema == null || schema.isEmpty()) {
			return Optional.empty();
		}
		TablesNamesFinder tablesFinder = new TablesNamesFinder();
		Set<String> tables = tablesFinder.getTables((Statement) select);
		for (String table : tables) {
			String name = tableName(table);
			if (!schema.hasTable(name)) {
				return Optional.of(ValidationVerdict.reject(ReasonCode.UNKNOWN_TABLE, name,
						"Unknown table: " + name + ". Available tables: " + schema.tableNames()));
			}
		}
		return Optional.empty();
	}

	static String tableName(String reference) {
		String name = reference.trim();
		int dot = name.lastIndexOf('.');
		if (dot >= 0) {
			name = name.substring(dot + 1);
		}
		if (name.length() >= 2) {
			char first = name.charAt(0);
			char last = name.charAt(name.length() - 1);
			if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
				name = name.substring(1, name.length() - 1);
			}
		}
		return name;
	}

	private static String firstLine(String message) {
		if (message == null) {
			return "";
		}
		int newline = message.indexOf('\n');
		return newline < 0 ? message : message.substring(0, newline);
	}
}
