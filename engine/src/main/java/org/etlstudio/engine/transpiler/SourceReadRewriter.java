package org.etlstudio.engine.transpiler;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces the path literal of source-read calls in program text.
 *
 * A read call is recognised by a call prefix (e.g. {@code pd.read_csv(})
 * followed by a quoted path literal. Only the literal is replaced; the rest
 * of the call is left as written.
 */
final class SourceReadRewriter {

    private final String callPrefix;
    private final TargetDialect dialect;
    private final UnaryOperator<String> literalBody;

    /**
     * @param callPrefix  Regex matching the call up to its first argument
     * @param dialect     Dialect used to quote the staged path
     * @param literalBody Escaping applied to a path inside a quoted literal
     */
    SourceReadRewriter(String callPrefix, TargetDialect dialect, UnaryOperator<String> literalBody) {
        this.callPrefix = Objects.requireNonNull(callPrefix, "Call prefix cannot be null");
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
        this.literalBody = Objects.requireNonNull(literalBody, "Literal escaping cannot be null");
    }

    String rewrite(String text, Map<String, String> replacements) {
        String rewritten = text;
        for (Map.Entry<String, String> entry : replacements.entrySet()) {
            Pattern pattern = Pattern.compile(
                    "(" + callPrefix + "\\s*)r?([\"'])(?:" + alternatives(entry.getKey()) + ")\\2");
            Matcher matcher = pattern.matcher(rewritten);
            String staged = Matcher.quoteReplacement(dialect.quoteStringLiteral(entry.getValue()));
            rewritten = matcher.replaceAll("$1" + staged);
        }
        return rewritten;
    }

    private String alternatives(String path) {
        Set<String> forms = new LinkedHashSet<>();
        forms.add(literalBody.apply(path));
        forms.add(path);
        StringJoiner joiner = new StringJoiner("|");
        for (String form : forms) {
            joiner.add(Pattern.quote(form));
        }
        return joiner.toString();
    }

    // ==================== Literal escaping ====================

    static String pythonLiteralBody(String value) {
        String quoted = PythonDialect.INSTANCE.quoteStringLiteral(value);
        return quoted.substring(1, quoted.length() - 1);
    }

    static String sqlLiteralBody(String value) {
        return value.replace("'", "''");
    }
}
