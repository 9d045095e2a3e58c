package org.javai.askdata.execution;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import org.javai.askdata.result.ColumnType;

/**
 * Infers a column's type from its declared type and the values it holds.
 *
 * <p>SQLite declares types loosely and computed columns often have none, so values decide
 * whenever the declared type does not name a date or time.</p>
 */
final class ColumnTypeInference {

	private static final DateTimeFormatter SPACE_SEPARATED_DATE_TIME =
			DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSS]");

	private ColumnTypeInference() {
	}

	static ColumnType infer(String declaredType, List<Object> values) {
		String declared = declaredType != null ? declaredType.toUpperCase(Locale.ROOT) : "";
		if (declared.contains("DATE") || declared.contains("TIME")) {
			return ColumnType.TEMPORAL;
		}

		boolean sawValue = false;
		boolean allNumbers = true;
		boolean allBooleans = true;
		boolean allTemporal = true;
		for (Object value : values) {
			if (value == null) {
				continue;
			}
			sawValue = true;
			allNumbers &= value instanceof Number;
			allBooleans &= value instanceof Boolean;
			allTemporal &= isTemporal(value);
		}
		if (!sawValue) {
			return fromDeclaredType(declared);
		}
		if (allNumbers) {
			return ColumnType.NUMERIC;
		}
		if (allBooleans) {
			return ColumnType.BOOLEAN;
		}
		if (allTemporal) {
			return ColumnType.TEMPORAL;
		}
		return ColumnType.TEXT;
	}

	private static ColumnType fromDeclaredType(String declared) {
		if (declared.isEmpty() || declared.equals("NULL")) {
			return ColumnType.UNKNOWN;
		}
		if (declared.contains("INT") || declared.contains("REAL") || declared.contains("FLOA")
				|| declared.contains("DOUB") || declared.contains("NUM") || declared.contains("DEC")) {
			return ColumnType.NUMERIC;
		}
		if (declared.contains("BOOL")) {
			return ColumnType.BOOLEAN;
		}
		if (declared.contains("CHAR") || declared.contains("CLOB") || declared.contains("TEXT")) {
			return ColumnType.TEXT;
		}
		return ColumnType.UNKNOWN;
	}

	private static boolean isTemporal(Object value) {
		if (value instanceof java.util.Date || value instanceof TemporalAccessor) {
			return true;
		}
		if (value instanceof String text) {
			return parsesAsDate(text.strip());
		}
		return false;
	}

	static boolean parsesAsDate(String text) {
		if (text.length() < 7 || !Character.isDigit(text.charAt(0))) {
			return false;
		}
		try {
			if (text.length() == 7) {
				YearMonth.parse(text);
			}
			else if (text.length() == 10) {
				LocalDate.parse(text);
			}
			else if (text.indexOf('T') > 0) {
				parseIsoDateTime(text);
			}
			else {
				LocalDateTime.parse(text, SPACE_SEPARATED_DATE_TIME);
			}
			return true;
		}
		catch (DateTimeParseException e) {
			return false;
		}
	}

	private static void parseIsoDateTime(String text) {
		try {
			LocalDateTime.parse(text);
		}
		catch (DateTimeParseException e) {
			OffsetDateTime.parse(text);
		}
	}
}
