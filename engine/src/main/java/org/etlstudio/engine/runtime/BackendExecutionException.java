package org.etlstudio.engine.runtime;

import org.etlstudio.engine.transpiler.Backend;

/**
 * Program text failed under its backend's runtime. The message is the
 * backend's own error text.
 */
public class BackendExecutionException extends Exception {

    private final Backend backend;

    public BackendExecutionException(Backend backend, String message) {
        super(message);
        this.backend = backend;
    }

    public BackendExecutionException(Backend backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    public Backend backend() {
        return backend;
    }
}
