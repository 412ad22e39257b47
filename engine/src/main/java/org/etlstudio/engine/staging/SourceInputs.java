package org.etlstudio.engine.staging;

import org.etlstudio.engine.plan.LoadNode;
import org.etlstudio.engine.plan.PipelineGraph;
import org.etlstudio.engine.plan.PipelineNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Works out which source paths in program text must be redirected before a
 * backend runs it.
 *
 * Sources with uploaded content are staged and redirected to the staged
 * file. Other relative sources are redirected to their absolute location
 * under the working directory, so a backend process reads the same file the
 * interpreter read.
 */
public final class SourceInputs {

    private SourceInputs() {
    }

    /**
     * @return Original path to replacement path, in node order
     */
    public static Map<String, String> replacements(PipelineGraph graph, StagingArea staging, Path workingDirectory)
            throws IOException {
        Map<String, String> uploads = new LinkedHashMap<>();
        Map<String, String> replacements = new LinkedHashMap<>();
        for (PipelineNode node : graph.nodes()) {
            if (!(node instanceof LoadNode load)) {
                continue;
            }
            if (load.inlineContent().isPresent()) {
                uploads.put(load.path(), load.inlineContent().get());
            } else {
                Path resolved = workingDirectory.resolve(load.path()).toAbsolutePath().normalize();
                if (!resolved.toString().equals(load.path())) {
                    replacements.put(load.path(), resolved.toString());
                }
            }
        }
        for (Map.Entry<String, Path> entry : staging.stage(uploads).entrySet()) {
            replacements.put(entry.getKey(), entry.getValue().toString());
        }
        return replacements;
    }
}
