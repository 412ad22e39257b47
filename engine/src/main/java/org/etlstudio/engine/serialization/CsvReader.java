package org.etlstudio.engine.serialization;

import org.etlstudio.engine.execution.Column;
import org.etlstudio.engine.execution.Row;
import org.etlstudio.engine.execution.Table;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads RFC 4180 CSV text with a header row into a {@link Table}.
 *
 * Column types are inferred per column over all non-empty fields, trying
 * integer, then floating point, then boolean, falling back to text. Empty
 * fields are missing values. Integer columns with missing values are
 * widened to floating point, as dataframe readers do. Blank lines are
 * skipped.
 */
public final class CsvReader {

    public static final CsvReader INSTANCE = new CsvReader();

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';

    private CsvReader() {
    }

    public Table read(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalArgumentException if the text has no header or a record
     *                                  has more fields than the header
     */
    public Table parse(String text) {
        List<List<String>> records = tokenize(text == null ? "" : text);
        if (records.isEmpty()) {
            throw new IllegalArgumentException("No columns to parse from file");
        }
        List<String> header = records.get(0);
        int width = header.size();
        List<List<String>> body = records.subList(1, records.size());
        for (int r = 0; r < body.size(); r++) {
            if (body.get(r).size() > width) {
                throw new IllegalArgumentException(String.format(
                        "Error tokenizing data: expected %d fields in line %d, saw %d",
                        width, r + 2, body.get(r).size()));
            }
        }

        List<Column> columns = new ArrayList<>(width);
        List<Object[]> typed = new ArrayList<>(body.size());
        for (int r = 0; r < body.size(); r++) {
            typed.add(new Object[width]);
        }
        for (int c = 0; c < width; c++) {
            String dtype = convertColumn(body, c, typed);
            columns.add(new Column(header.get(c), dtype));
        }

        List<Row> rows = new ArrayList<>(typed.size());
        for (Object[] values : typed) {
            rows.add(Row.of(values));
        }
        return new Table(columns, rows);
    }

    // ==================== Type inference ====================

    private enum Kind { LONG, DOUBLE, BOOLEAN, STRING }

    private String convertColumn(List<List<String>> body, int c, List<Object[]> typed) {
        Kind kind = Kind.LONG;
        boolean hasNull = false;
        boolean any = false;
        for (List<String> record : body) {
            String field = c < record.size() ? record.get(c) : "";
            if (field.isEmpty()) {
                hasNull = true;
                continue;
            }
            any = true;
            kind = widen(kind, field);
        }
        if (!any) {
            // An all-empty column reads as missing floats
            return hasNull ? Column.FLOAT64 : Column.OBJECT;
        }
        if (kind == Kind.LONG && hasNull) {
            kind = Kind.DOUBLE;
        }
        for (int r = 0; r < body.size(); r++) {
            List<String> record = body.get(r);
            String field = c < record.size() ? record.get(c) : "";
            typed.get(r)[c] = field.isEmpty() ? null : convert(kind, field);
        }
        return switch (kind) {
            case LONG -> Column.INT64;
            case DOUBLE -> Column.FLOAT64;
            case BOOLEAN -> hasNull ? Column.OBJECT : Column.BOOL;
            case STRING -> Column.OBJECT;
        };
    }

    private static Kind widen(Kind current, String field) {
        switch (current) {
            case LONG:
                if (isLong(field)) {
                    return Kind.LONG;
                }
                // fall through
            case DOUBLE:
                if (isDouble(field)) {
                    return Kind.DOUBLE;
                }
                if (current == Kind.LONG && isBoolean(field)) {
                    return Kind.BOOLEAN;
                }
                return Kind.STRING;
            case BOOLEAN:
                return isBoolean(field) ? Kind.BOOLEAN : Kind.STRING;
            default:
                return Kind.STRING;
        }
    }

    private static Object convert(Kind kind, String field) {
        return switch (kind) {
            case LONG -> Long.parseLong(field.trim());
            case DOUBLE -> Double.parseDouble(field.trim());
            case BOOLEAN -> field.trim().equalsIgnoreCase("true");
            case STRING -> field;
        };
    }

    private static boolean isLong(String field) {
        String s = field.trim();
        if (s.isEmpty()) {
            return false;
        }
        int start = s.charAt(0) == '-' || s.charAt(0) == '+' ? 1 : 0;
        if (start == s.length() || s.length() - start > 18) {
            return false;
        }
        for (int i = start; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isDouble(String field) {
        String s = field.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty() || s.endsWith("d") || s.endsWith("f") || s.startsWith("0x")) {
            return false;
        }
        try {
            Double.parseDouble(s);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isBoolean(String field) {
        String s = field.trim();
        return s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false");
    }

    // ==================== Tokenizer ====================

    private static List<List<String>> tokenize(String text) {
        List<List<String>> records = new ArrayList<>();
        List<String> record = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean fieldStarted = false;
        int i = 0;
        if (text.startsWith("\uFEFF")) {
            i = 1;
        }
        for (; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inQuotes) {
                if (c == QUOTE) {
                    if (i + 1 < text.length() && text.charAt(i + 1) == QUOTE) {
                        field.append(QUOTE);
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    field.append(c);
                }
                continue;
            }
            if (c == QUOTE) {
                inQuotes = true;
                fieldStarted = true;
            } else if (c == DELIMITER) {
                record.add(field.toString());
                field.setLength(0);
                fieldStarted = true;
            } else if (c == '\n' || c == '\r') {
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                endRecord(records, record, field, fieldStarted);
                record = new ArrayList<>();
                fieldStarted = false;
            } else {
                field.append(c);
                fieldStarted = true;
            }
        }
        endRecord(records, record, field, fieldStarted);
        return records;
    }

    private static void endRecord(List<List<String>> records, List<String> record, StringBuilder field,
            boolean fieldStarted) {
        if (!fieldStarted && record.isEmpty()) {
            // Blank line
            field.setLength(0);
            return;
        }
        record.add(field.toString());
        field.setLength(0);
        records.add(record);
    }
}
