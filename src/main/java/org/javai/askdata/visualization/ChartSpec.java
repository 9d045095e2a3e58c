package org.javai.askdata.visualization;

import java.util.List;

/**
 * Declarative description of how a result should be rendered.
 *
 * @param kind the chart kind
 * @param xField the column plotted on the x axis, null for tables
 * @param yFields the columns plotted as values, empty for tables
 * @param rationale why this kind was chosen
 */
public record ChartSpec(ChartKind kind, String xField, List<String> yFields, String rationale) {

	public ChartSpec {
		if (kind == null) {
			throw new IllegalArgumentException("kind must not be null");
		}
		yFields = yFields != null ? List.copyOf(yFields) : List.of();
		if (kind != ChartKind.TABLE && (xField == null || yFields.isEmpty())) {
			throw new IllegalArgumentException(kind + " needs an x field and at least one y field");
		}
		rationale = rationale != null ? rationale : "";
	}

	public static ChartSpec table(String rationale) {
		return new ChartSpec(ChartKind.TABLE, null, List.of(), rationale);
	}

	public boolean isChart() {
		return kind != ChartKind.TABLE;
	}
}
