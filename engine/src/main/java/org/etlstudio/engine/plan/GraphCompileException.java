package org.etlstudio.engine.plan;

/**
 * Exception thrown when a pipeline graph is malformed: unknown node ids,
 * duplicate ids, wrong parent counts or unsupported payload values.
 */
public class GraphCompileException extends RuntimeException {

    public GraphCompileException(String message) {
        super(message);
    }

    public GraphCompileException(String message, Throwable cause) {
        super(message, cause);
    }
}
