package com.gantry.core.board;

import com.gantry.core.model.Task;

/**
 * @param task         the created task, or the existing one for a repeated dedup key
 * @param deduplicated true when no new task was created
 */
public record IntakeResult(Task task, boolean deduplicated) {}
