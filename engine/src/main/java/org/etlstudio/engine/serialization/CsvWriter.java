package org.etlstudio.engine.serialization;

import org.etlstudio.engine.execution.Column;
import org.etlstudio.engine.execution.Row;
import org.etlstudio.engine.execution.Table;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes a {@link Table} as CSV with a header row and no index column.
 *
 * Values containing commas, quotes, or newlines are quoted. Missing values
 * are written as empty fields; floating point values always carry a
 * fractional part ({@code 3.0}), matching what dataframe writers produce.
 */
public final class CsvWriter {

    public static final CsvWriter INSTANCE = new CsvWriter();

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';
    private static final String LINE_ENDING = "\n";

    private CsvWriter() {
    }

    public void write(Table table, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(table, writer);
        }
    }

    public void write(Table table, Writer writer) throws IOException {
        writeHeader(writer, table.columns());
        for (Row row : table.rows()) {
            writeRow(writer, row);
        }
    }

    public String toCsvString(Table table) {
        StringWriter writer = new StringWriter();
        try {
            write(table, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    private void writeHeader(Writer writer, List<Column> columns) throws IOException {
        String header = columns.stream()
                .map(col -> escapeField(col.name()))
                .collect(Collectors.joining(String.valueOf(DELIMITER)));
        writer.write(header);
        writer.write(LINE_ENDING);
    }

    private void writeRow(Writer writer, Row row) throws IOException {
        List<Object> values = row.values();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                writer.write(DELIMITER);
            }
            writer.write(formatValue(values.get(i)));
        }
        writer.write(LINE_ENDING);
    }

    private String formatValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double d) {
            return formatDouble(d);
        }
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        return escapeField(value.toString());
    }

    public static String formatDouble(double d) {
        if (Double.isNaN(d)) {
            return "";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "inf" : "-inf";
        }
        double abs = Math.abs(d);
        if (abs != 0.0 && (abs < 1e-4 || abs >= 1e16)) {
            return Double.toString(d);
        }
        String plain = BigDecimal.valueOf(d).toPlainString();
        return plain.contains(".") ? plain : plain + ".0";
    }

    private String escapeField(String value) {
        boolean needsQuoting = value.indexOf(DELIMITER) >= 0
                || value.indexOf(QUOTE) >= 0
                || value.indexOf('\n') >= 0
                || value.indexOf('\r') >= 0;

        if (!needsQuoting) {
            return value;
        }

        // Escape quotes by doubling them and wrap in quotes
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append(QUOTE);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == QUOTE) {
                sb.append(QUOTE);
            }
            sb.append(c);
        }
        sb.append(QUOTE);
        return sb.toString();
    }
}
