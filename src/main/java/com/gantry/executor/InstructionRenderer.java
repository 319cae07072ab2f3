package com.gantry.executor;

import com.gantry.core.model.Task;
import com.gantry.core.security.RoleCapabilities;

/**
 * Turns a task into the context document handed to an executor.
 * The result is opaque to the orchestrator.
 */
public interface InstructionRenderer {

    String render(Task task, RoleCapabilities capabilities, int attempt);
}
