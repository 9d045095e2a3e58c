package org.javai.askdata.visualization;

/**
 * The kinds of rendering the selector can choose.
 */
public enum ChartKind {
	BAR,
	LINE,
	TIME_SERIES,
	TABLE
}
