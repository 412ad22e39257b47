package org.etlstudio.engine.runtime;

import org.etlstudio.engine.staging.StagingArea;
import org.etlstudio.engine.transpiler.Backend;

/**
 * Executes program text under one backend and returns the resulting table.
 *
 * Every call runs in a fresh namespace: no connection, interpreter or
 * session state is shared between calls. The text is trusted; nothing is
 * sandboxed.
 */
public interface BackendRuntime {

    Backend backend();

    /**
     * @param programText The program to run
     * @param staging     The call's staging area, for any scratch files
     * @return The result table
     * @throws BackendExecutionException if the program fails or produces no table
     */
    BackendResult execute(String programText, StagingArea staging) throws BackendExecutionException;
}
