package com.gantry.core.gate;

import java.nio.file.Path;
import java.util.List;

/**
 * What a gate gets to see about the job it checks.
 */
public record GateContext(
    String taskId,
    String jobId,
    Path jobDir,
    List<String> touchedFiles
) {

    public GateContext {
        touchedFiles = touchedFiles == null ? List.of() : List.copyOf(touchedFiles);
    }
}
