package com.gantry.core.verdict;

import com.gantry.core.model.GateResult;
import com.gantry.core.model.Submission;
import com.gantry.core.model.TaskScope;

import java.util.List;
import java.util.Set;

/**
 * Inputs of one judgement. Everything the verdict engine looks at is in here,
 * which is what makes a verdict replayable.
 *
 * @param taskId                task id the job claims to belong to; may be null
 * @param role                  task role, used for tool and test requirements
 * @param scope                 task scope touched files are checked against
 * @param submission            executor submission, null if the executor never produced one
 * @param gateResults           gate outcomes for the job
 * @param requiredGates         gates configured as required
 * @param failureReason         why the job failed outside its submission (crash, timeout, lost,
 *                              unreadable result), or null
 * @param exitCode              exit code of the executor process, null if it never exited
 */
public record JudgeRequest(
    String taskId,
    String role,
    TaskScope scope,
    Submission submission,
    List<GateResult> gateResults,
    Set<String> requiredGates,
    String failureReason,
    Integer exitCode
) {

    public JudgeRequest {
        gateResults = gateResults == null ? List.of() : List.copyOf(gateResults);
        requiredGates = requiredGates == null ? Set.of() : Set.copyOf(requiredGates);
    }
}
