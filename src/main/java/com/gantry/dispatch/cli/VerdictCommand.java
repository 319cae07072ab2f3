package com.gantry.dispatch.cli;

import com.gantry.core.model.Verdict;
import com.gantry.core.persistence.RecordNotFoundException;
import com.gantry.core.verdict.VerdictReplay;
import com.gantry.core.verdict.VerdictReplayService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Optional;

/**
 * CLI command: gantry verdict &lt;task-id&gt;
 * <p>
 * Prints the stored verdict of the task's latest judged job next to a replay
 * under the current rules. Nothing is written.
 */
@Command(name = "verdict", mixinStandardHelpOptions = true, description = "Show and replay a task's verdict")
@Component
public class VerdictCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    private final VerdictReplayService replayService;

    public VerdictCommand(VerdictReplayService replayService) {
        this.replayService = replayService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        Optional<VerdictReplay> replay;
        try {
            replay = replayService.replay(taskId);
        } catch (RecordNotFoundException e) {
            ConsoleOutput.error("Task not found: " + taskId);
            return;
        }
        if (replay.isEmpty()) {
            ConsoleOutput.info("No verdict recorded for " + taskId);
            return;
        }
        VerdictReplay result = replay.get();
        ConsoleOutput.info("Task " + taskId + ", job " + result.jobId());
        print("stored  ", result.stored());
        print("replayed", result.replayed());
        if (result.consistent()) {
            ConsoleOutput.success("Replay matches the stored verdict");
        } else {
            ConsoleOutput.error("Replay differs from the stored verdict");
        }
    }

    private static void print(String label, Verdict verdict) {
        String actions = verdict.actions().isEmpty() ? "" : " actions=" + verdict.actions();
        ConsoleOutput.verdict(verdict.decision().name(), label + " " + verdict.reasons() + actions);
    }
}
