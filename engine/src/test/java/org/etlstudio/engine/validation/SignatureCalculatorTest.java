package org.etlstudio.engine.validation;

import org.etlstudio.engine.execution.Column;
import org.etlstudio.engine.execution.Row;
import org.etlstudio.engine.execution.Table;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for table signatures and their comparison.
 */
class SignatureCalculatorTest {

    private static Table table(String dtype, Object... values) {
        List<Row> rows = new java.util.ArrayList<>();
        for (Object value : values) {
            rows.add(Row.of("k", value));
        }
        return new Table(List.of(Column.of("name", Column.OBJECT), Column.of("v", dtype)), rows);
    }

    // ==================== Canonical values ====================

    @Nested
    @DisplayName("Canonical values")
    class CanonicalValueTests {

        @Test
        @DisplayName("Integers and integral floats render alike")
        void testIntegralNumbers() {
            assertEquals("3", SignatureCalculator.canonicalValue(3L));
            assertEquals("3", SignatureCalculator.canonicalValue(3.0));
            assertEquals("0", SignatureCalculator.canonicalValue(-0.0));
        }

        @Test
        @DisplayName("Floats are rounded to twelve significant digits")
        void testRounding() {
            assertEquals("0.3", SignatureCalculator.canonicalValue(0.1 + 0.2));
            assertEquals("2.5", SignatureCalculator.canonicalValue(2.5));
            assertEquals("1234567.89012", SignatureCalculator.canonicalValue(1234567.890123456));
        }

        @Test
        @DisplayName("Missing and special values")
        void testSpecialValues() {
            assertEquals("", SignatureCalculator.canonicalValue(null));
            assertEquals("", SignatureCalculator.canonicalValue(Double.NaN));
            assertEquals("-inf", SignatureCalculator.canonicalValue(Double.NEGATIVE_INFINITY));
            assertEquals("true", SignatureCalculator.canonicalValue(Boolean.TRUE));
        }

        @Test
        @DisplayName("The sample is a CSV rendering of header and leading rows")
        void testCanonicalSample() {
            Table t = new Table(List.of(Column.of("a", Column.OBJECT), Column.of("b", Column.FLOAT64)),
                    List.of(Row.of("x,y", 1.50), Row.of("z", null), Row.of("w", 2.0)));

            assertEquals("a,b\n\"x,y\",1.5\nz,\n", SignatureCalculator.canonicalSample(t, 2));
        }
    }

    // ==================== Comparison ====================

    @Nested
    @DisplayName("Comparison")
    class ComparisonTests {

        @Test
        @DisplayName("Dtypes are not compared")
        void testDtypesIgnored() {
            TableSignature ints = SignatureCalculator.signature(table(Column.INT64, 1L, 2L));
            TableSignature floats = SignatureCalculator.signature(table(Column.FLOAT64, 1.0, 2.0));

            SignatureComparison comparison = SignatureCalculator.compare(ints, floats);

            assertTrue(comparison.matches());
            assertEquals(SignatureComparison.MATCH, comparison.reason());
        }

        @Test
        @DisplayName("Column differences are reported first")
        void testColumnsDiffer() {
            Table other = new Table(List.of(Column.of("v", Column.INT64)), List.of(Row.of(1L)));

            SignatureComparison comparison = SignatureCalculator.compare(
                    SignatureCalculator.signature(table(Column.INT64, 1L)), SignatureCalculator.signature(other));

            assertFalse(comparison.matches());
            assertEquals("columns differ: [name, v] vs [v]", comparison.reason());
        }

        @Test
        @DisplayName("Row count differences")
        void testRowCountDiffers() {
            SignatureComparison comparison = SignatureCalculator.compare(
                    SignatureCalculator.signature(table(Column.INT64, 1L, 2L)),
                    SignatureCalculator.signature(table(Column.INT64, 1L)));

            assertEquals("row count differs: 2 vs 1", comparison.reason());
        }

        @Test
        @DisplayName("Value differences show up in the sample hash")
        void testHashDiffers() {
            SignatureComparison comparison = SignatureCalculator.compare(
                    SignatureCalculator.signature(table(Column.INT64, 1L, 2L)),
                    SignatureCalculator.signature(table(Column.INT64, 2L, 1L)));

            assertFalse(comparison.matches());
            assertTrue(comparison.reason().startsWith("sample hash differs: "));
        }

        @Test
        @DisplayName("Rows beyond the sample limit only count towards the row count")
        void testSampleLimit() {
            TableSignature a = SignatureCalculator.signature(table(Column.INT64, 1L, 2L, 3L), 2);
            TableSignature b = SignatureCalculator.signature(table(Column.INT64, 1L, 2L, 99L), 2);

            assertTrue(SignatureCalculator.compare(a, b).matches());
        }

        @Test
        @DisplayName("An externally reported row count overrides the table size")
        void testReportedRowCount() {
            TableSignature signature = SignatureCalculator.signature(table(Column.INT64, 1L), 500L, 200);

            assertEquals(500L, signature.rowCount());
            assertEquals(32, signature.sampleHash().length());
        }
    }
}
