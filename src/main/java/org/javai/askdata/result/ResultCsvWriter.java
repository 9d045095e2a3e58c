package org.javai.askdata.result;

import com.opencsv.CSVWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Exports a query result as CSV: one header line with the column names, then one line per row.
 * Null cells are written as empty fields.
 */
public final class ResultCsvWriter {

	public String toCsv(QueryResult result) {
		StringWriter out = new StringWriter();
		try {
			write(result, out);
		}
		catch (IOException e) {
			throw new IllegalStateException("Writing CSV to memory failed", e);
		}
		return out.toString();
	}

	public void write(QueryResult result, Path target) throws IOException {
		try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
			write(result, out);
		}
	}

	/**
	 * Writes the result to the given writer. The writer is flushed but not closed.
	 */
	public void write(QueryResult result, Writer out) throws IOException {
		CSVWriter csv = new CSVWriter(out);
		csv.writeNext(result.columnNames().toArray(new String[0]));
		for (List<Object> row : result.rows()) {
			String[] cells = new String[row.size()];
			for (int i = 0; i < cells.length; i++) {
				Object value = row.get(i);
				cells[i] = value != null ? value.toString() : "";
			}
			csv.writeNext(cells);
		}
		csv.flush();
	}
}
