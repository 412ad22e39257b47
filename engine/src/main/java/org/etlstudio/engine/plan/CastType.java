package org.etlstudio.engine.plan;

import java.util.Locale;

/**
 * Target types of a select node's column casts.
 *
 * Unrecognised and missing type names cast to {@link #STRING}.
 */
public enum CastType {
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    DATE("date"),
    DATETIME("datetime"),
    STRING("string");

    private final String wireName;

    CastType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static CastType fromWireName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (CastType type : values()) {
                if (type.wireName.equals(normalized)) {
                    return type;
                }
            }
        }
        return STRING;
    }
}
