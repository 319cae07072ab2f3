package com.gantry.core.verdict;

import com.gantry.core.model.Verdict;

/**
 * A stored verdict next to the verdict the engine gives today for the same inputs.
 *
 * @param taskId     task judged
 * @param jobId      job whose inputs were replayed
 * @param stored     verdict recorded when the job finished, may be null
 * @param replayed   verdict recomputed from the stored inputs
 * @param consistent true when decision and reasons match
 */
public record VerdictReplay(
    String taskId,
    String jobId,
    Verdict stored,
    Verdict replayed,
    boolean consistent
) {}
