package com.gantry.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Judgement of one job. Never mutated; a later job's verdict supersedes it.
 *
 * @param decision DONE, RETRY or ESCALATE
 * @param reasons  de-duplicated reason codes in the order they were found
 * @param actions  advisory follow-up actions; never executed by the engine
 * @param judgedAt when the verdict was produced
 */
public record Verdict(
    VerdictDecision decision,
    List<String> reasons,
    List<String> actions,
    Instant judgedAt
) implements Serializable {

    public Verdict {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        actions = actions == null ? List.of() : List.copyOf(actions);
    }
}
