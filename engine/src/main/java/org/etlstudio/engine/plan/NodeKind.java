package org.etlstudio.engine.plan;

import java.util.Locale;

/**
 * Closed enumeration of pipeline node kinds.
 *
 * The wire name is the tag used in request documents. {@link #UNKNOWN}
 * covers every tag that is not recognised; such nodes copy their input.
 */
public enum NodeKind {
    LOAD("source.load", 0),
    SELECT("transform.select", 1),
    FILTER("transform.filter", 1),
    AGGREGATE("transform.aggregate", 1),
    DERIVE("transform.derive", 1),
    SORT("transform.sort", 1),
    SAMPLE("transform.sample", 1),
    JOIN("transform.join", 2),
    WRITE("sink.write", 1),
    UNKNOWN("unknown", 1);

    private final String wireName;
    private final int arity;

    NodeKind(String wireName, int arity) {
        this.wireName = wireName;
        this.arity = arity;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Number of distinct parents a node of this kind must have.
     */
    public int arity() {
        return arity;
    }

    /**
     * Resolves a wire name. Legacy tags of the studio front end are accepted
     * as aliases; anything else maps to {@link #UNKNOWN}.
     */
    public static NodeKind fromWireName(String wireName) {
        if (wireName == null) {
            return UNKNOWN;
        }
        return switch (wireName.trim().toLowerCase(Locale.ROOT)) {
            case "source.load", "source.csv" -> LOAD;
            case "transform.select" -> SELECT;
            case "transform.filter" -> FILTER;
            case "transform.aggregate", "transform.summarize" -> AGGREGATE;
            case "transform.derive", "transform.formula" -> DERIVE;
            case "transform.sort" -> SORT;
            case "transform.sample" -> SAMPLE;
            case "transform.join" -> JOIN;
            case "sink.write", "sink.csv" -> WRITE;
            default -> UNKNOWN;
        };
    }
}
