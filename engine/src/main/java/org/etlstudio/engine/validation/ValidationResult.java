package org.etlstudio.engine.validation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of checking one backend against the interpreter.
 *
 * @param backend  Backend display name, or the requested language when unsupported
 * @param valid    Whether the signatures match
 * @param reason   "match" or why they differ
 * @param expected Interpreter signature; null when the language is unsupported
 * @param actual   Backend signature; null when the language is unsupported
 */
public record ValidationResult(
        String backend,
        boolean valid,
        String reason,
        TableSignature expected,
        TableSignature actual) {

    public ValidationResult {
        Objects.requireNonNull(backend, "Backend cannot be null");
        Objects.requireNonNull(reason, "Reason cannot be null");
    }

    public static ValidationResult unsupported(String language) {
        return new ValidationResult(String.valueOf(language), false, "unsupported language: " + language, null, null);
    }

    public Map<String, Object> toJsonMap() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("backend", backend);
        json.put("valid", valid);
        json.put("reason", reason);
        if (expected != null) {
            json.put("expected", expected.toJsonMap());
        }
        if (actual != null) {
            json.put("actual", actual.toJsonMap());
        }
        return json;
    }
}
