package org.etlstudio.engine.serialization;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small JSON reader and writer for request documents, workflow results and
 * the Python harness output.
 *
 * Supports objects, arrays, strings, numbers, booleans and null. Objects
 * keep key order. The bare tokens {@code NaN}, {@code Infinity} and
 * {@code -Infinity} that Python's encoder emits are read as doubles.
 * Non-finite doubles are written as null.
 */
public final class Json {

    private Json() {
    }

    // ========== PARSING ==========

    /**
     * Parse a JSON string into a Map (for objects) or List (for arrays).
     *
     * @throws IllegalArgumentException on malformed input
     */
    public static Object parse(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        Parser parser = new Parser(json.trim());
        Object value = parser.parseValue();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw new IllegalArgumentException("Unexpected trailing content at position " + parser.pos);
        }
        return value;
    }

    /**
     * Parse JSON and cast to Map.
     *
     * @throws IllegalArgumentException if the document is not an object
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> parseObject(String json) {
        Object result = parse(json);
        if (!(result instanceof Map)) {
            throw new IllegalArgumentException("Expected a JSON object");
        }
        return (Map<String, Object>) result;
    }

    // ========== SERIALIZATION ==========

    /**
     * Serialize an object to JSON string.
     */
    public static String toJson(Object value) {
        StringBuilder sb = new StringBuilder();
        writeValue(sb, value);
        return sb.toString();
    }

    @SuppressWarnings("unchecked")
    private static void writeValue(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String s) {
            writeString(sb, s);
        } else if (value instanceof Double d) {
            sb.append(d.isNaN() || d.isInfinite() ? "null" : d.toString());
        } else if (value instanceof Number n) {
            sb.append(n);
        } else if (value instanceof Boolean b) {
            sb.append(b ? "true" : "false");
        } else if (value instanceof Map<?, ?> m) {
            writeObject(sb, (Map<String, Object>) m);
        } else if (value instanceof List<?> l) {
            writeArray(sb, l);
        } else {
            writeString(sb, value.toString());
        }
    }

    private static void writeString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    private static void writeObject(StringBuilder sb, Map<String, Object> map) {
        sb.append('{');
        boolean first = true;
        for (var entry : map.entrySet()) {
            if (!first)
                sb.append(',');
            first = false;
            writeString(sb, entry.getKey());
            sb.append(':');
            writeValue(sb, entry.getValue());
        }
        sb.append('}');
    }

    private static void writeArray(StringBuilder sb, List<?> list) {
        sb.append('[');
        boolean first = true;
        for (Object item : list) {
            if (!first)
                sb.append(',');
            first = false;
            writeValue(sb, item);
        }
        sb.append(']');
    }

    // ========== PARSER IMPLEMENTATION ==========

    private static class Parser {
        private final String json;
        private int pos = 0;

        Parser(String json) {
            this.json = json;
        }

        boolean atEnd() {
            return pos >= json.length();
        }

        Object parseValue() {
            skipWhitespace();
            if (pos >= json.length())
                throw new IllegalArgumentException("Unexpected end of JSON input");

            char c = json.charAt(pos);
            return switch (c) {
                case '{' -> parseObject();
                case '[' -> parseArray();
                case '"' -> parseString();
                case 't', 'f' -> parseBoolean();
                case 'n' -> parseNull();
                case 'N', 'I' -> parseNonFinite();
                default -> parseNumber();
            };
        }

        private Map<String, Object> parseObject() {
            Map<String, Object> map = new LinkedHashMap<>();
            pos++; // skip '{'
            skipWhitespace();

            if (pos < json.length() && json.charAt(pos) == '}') {
                pos++;
                return map;
            }

            while (true) {
                skipWhitespace();
                if (pos >= json.length() || json.charAt(pos) != '"') {
                    throw new IllegalArgumentException("Expected object key at position " + pos);
                }
                String key = parseString();
                skipWhitespace();
                expect(':');
                Object value = parseValue();
                map.put(key, value);
                skipWhitespace();

                if (pos >= json.length())
                    throw new IllegalArgumentException("Unterminated object");
                char c = json.charAt(pos++);
                if (c == '}') {
                    return map;
                } else if (c != ',') {
                    throw new IllegalArgumentException("Expected ',' or '}' at position " + (pos - 1));
                }
            }
        }

        private List<Object> parseArray() {
            List<Object> list = new ArrayList<>();
            pos++; // skip '['
            skipWhitespace();

            if (pos < json.length() && json.charAt(pos) == ']') {
                pos++;
                return list;
            }

            while (true) {
                list.add(parseValue());
                skipWhitespace();

                if (pos >= json.length())
                    throw new IllegalArgumentException("Unterminated array");
                char c = json.charAt(pos++);
                if (c == ']') {
                    return list;
                } else if (c != ',') {
                    throw new IllegalArgumentException("Expected ',' or ']' at position " + (pos - 1));
                }
            }
        }

        private String parseString() {
            pos++; // skip opening quote
            StringBuilder sb = new StringBuilder();
            while (pos < json.length()) {
                char c = json.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                } else if (c == '\\' && pos < json.length()) {
                    char escaped = json.charAt(pos++);
                    switch (escaped) {
                        case '"' -> sb.append('"');
                        case '\\' -> sb.append('\\');
                        case '/' -> sb.append('/');
                        case 'b' -> sb.append('\b');
                        case 'f' -> sb.append('\f');
                        case 'n' -> sb.append('\n');
                        case 'r' -> sb.append('\r');
                        case 't' -> sb.append('\t');
                        case 'u' -> {
                            if (pos + 4 > json.length()) {
                                throw new IllegalArgumentException("Truncated unicode escape at position " + pos);
                            }
                            String hex = json.substring(pos, pos + 4);
                            sb.append((char) Integer.parseInt(hex, 16));
                            pos += 4;
                        }
                        default -> sb.append(escaped);
                    }
                } else {
                    sb.append(c);
                }
            }
            throw new IllegalArgumentException("Unterminated string");
        }

        private Number parseNumber() {
            int start = pos;
            if (pos < json.length() && json.charAt(pos) == '-')
                pos++;
            if (json.startsWith("Infinity", pos)) {
                pos += 8;
                return Double.NEGATIVE_INFINITY;
            }
            while (pos < json.length() && Character.isDigit(json.charAt(pos)))
                pos++;

            boolean isFloat = false;
            if (pos < json.length() && json.charAt(pos) == '.') {
                isFloat = true;
                pos++;
                while (pos < json.length() && Character.isDigit(json.charAt(pos)))
                    pos++;
            }
            if (pos < json.length() && (json.charAt(pos) == 'e' || json.charAt(pos) == 'E')) {
                isFloat = true;
                pos++;
                if (pos < json.length() && (json.charAt(pos) == '+' || json.charAt(pos) == '-'))
                    pos++;
                while (pos < json.length() && Character.isDigit(json.charAt(pos)))
                    pos++;
            }

            String num = json.substring(start, pos);
            try {
                if (isFloat) {
                    return Double.parseDouble(num);
                }
                try {
                    return Long.parseLong(num);
                } catch (NumberFormatException overflow) {
                    return Double.parseDouble(num);
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number at position " + start, e);
            }
        }

        private Double parseNonFinite() {
            if (json.startsWith("NaN", pos)) {
                pos += 3;
                return Double.NaN;
            } else if (json.startsWith("Infinity", pos)) {
                pos += 8;
                return Double.POSITIVE_INFINITY;
            }
            throw new IllegalArgumentException("Invalid token at position " + pos);
        }

        private Boolean parseBoolean() {
            if (json.startsWith("true", pos)) {
                pos += 4;
                return true;
            } else if (json.startsWith("false", pos)) {
                pos += 5;
                return false;
            }
            throw new IllegalArgumentException("Invalid boolean at position " + pos);
        }

        private Object parseNull() {
            if (json.startsWith("null", pos)) {
                pos += 4;
                return null;
            }
            throw new IllegalArgumentException("Invalid null at position " + pos);
        }

        void skipWhitespace() {
            while (pos < json.length() && Character.isWhitespace(json.charAt(pos))) {
                pos++;
            }
        }

        private void expect(char expected) {
            if (pos < json.length() && json.charAt(pos) == expected) {
                pos++;
            } else {
                throw new IllegalArgumentException("Expected '" + expected + "' at position " + pos);
            }
        }
    }

    // ========== HELPER METHODS ==========

    /**
     * Get a string value from a map; numbers and booleans are rendered as text.
     */
    public static String getString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof String s) {
            return s;
        }
        return value instanceof Number || value instanceof Boolean ? value.toString() : null;
    }

    /**
     * Get an integer value from a map; numeric strings are accepted.
     */
    public static Integer getInt(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return (int) Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Expected a number for '" + key + "' but got: " + s, e);
            }
        }
        return null;
    }

    /**
     * Get a numeric value from a map; numeric strings are accepted.
     */
    public static Double getDouble(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Expected a number for '" + key + "' but got: " + s, e);
            }
        }
        return null;
    }

    /**
     * Get a nested object from a map.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> getObject(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    /**
     * Get a list from a map.
     */
    @SuppressWarnings("unchecked")
    public static List<Object> getList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof List ? (List<Object>) value : null;
    }
}
