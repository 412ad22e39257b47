package org.etlstudio.engine.validation;

import org.etlstudio.engine.execution.Column;
import org.etlstudio.engine.execution.Row;
import org.etlstudio.engine.execution.Table;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Computes and compares table signatures.
 *
 * The sample hash covers a canonical CSV rendering of the header and the
 * first {@code sampleLimit} rows:
 * <ul>
 *   <li>null and NaN render as an empty field</li>
 *   <li>numbers render as plain decimals rounded to 12 significant digits
 *       with trailing zeros stripped, so {@code 3}, {@code 3.0} and
 *       {@code 3.000000000001} render alike</li>
 *   <li>booleans render as {@code true}/{@code false}</li>
 *   <li>everything else renders with {@code toString()}</li>
 * </ul>
 */
public final class SignatureCalculator {

    public static final int DEFAULT_SAMPLE_LIMIT = 200;

    private static final MathContext SIGNIFICANT_DIGITS = new MathContext(12, RoundingMode.HALF_EVEN);

    private SignatureCalculator() {
    }

    public static TableSignature signature(Table table) {
        return signature(table, table.rowCount(), DEFAULT_SAMPLE_LIMIT);
    }

    public static TableSignature signature(Table table, int sampleLimit) {
        return signature(table, table.rowCount(), sampleLimit);
    }

    /**
     * @param table       The table, possibly holding only the leading rows
     * @param rowCount    Total row count of the full result
     * @param sampleLimit Number of leading rows hashed
     */
    public static TableSignature signature(Table table, long rowCount, int sampleLimit) {
        List<String> dtypes = new ArrayList<>(table.columnCount());
        for (Column column : table.columns()) {
            dtypes.add(column.dtype());
        }
        return new TableSignature(table.columnNames(), dtypes, rowCount,
                md5Hex(canonicalSample(table, sampleLimit)));
    }

    /**
     * Matches on column names and order, then row count, then sample hash.
     * Dtypes are never compared.
     */
    public static SignatureComparison compare(TableSignature expected, TableSignature actual) {
        if (!expected.columns().equals(actual.columns())) {
            return SignatureComparison.mismatch(
                    "columns differ: " + expected.columns() + " vs " + actual.columns());
        }
        if (expected.rowCount() != actual.rowCount()) {
            return SignatureComparison.mismatch(
                    "row count differs: " + expected.rowCount() + " vs " + actual.rowCount());
        }
        if (!expected.sampleHash().equals(actual.sampleHash())) {
            return SignatureComparison.mismatch(
                    "sample hash differs: " + expected.sampleHash() + " vs " + actual.sampleHash());
        }
        return SignatureComparison.match();
    }

    // ==================== Canonical form ====================

    static String canonicalSample(Table table, int sampleLimit) {
        StringBuilder sb = new StringBuilder();
        appendRecord(sb, new ArrayList<Object>(table.columnNames()));
        int limit = Math.min(Math.max(sampleLimit, 0), table.rowCount());
        for (int i = 0; i < limit; i++) {
            Row row = table.rows().get(i);
            appendRecord(sb, row.values());
        }
        return sb.toString();
    }

    private static void appendRecord(StringBuilder sb, List<Object> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(canonicalValue(values.get(i))));
        }
        sb.append('\n');
    }

    static String canonicalValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Boolean b) {
            return b ? "true" : "false";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) {
                return "";
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? "inf" : "-inf";
            }
            return plain(BigDecimal.valueOf(d));
        }
        if (value instanceof BigDecimal decimal) {
            return plain(decimal);
        }
        if (value instanceof BigInteger integer) {
            return plain(new BigDecimal(integer));
        }
        if (value instanceof Number number) {
            return plain(BigDecimal.valueOf(number.longValue()));
        }
        return value.toString();
    }

    private static String plain(BigDecimal decimal) {
        BigDecimal rounded = decimal.round(SIGNIFICANT_DIGITS).stripTrailingZeros();
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.toPlainString();
    }

    private static String escape(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0
                && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return "\"" + field.replace("\"", "\"\"") + "\"";
    }

    private static String md5Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
