package com.gantry.dispatch.cli;

import com.gantry.core.board.IllegalTransitionException;
import com.gantry.core.model.Job;
import com.gantry.core.persistence.RecordNotFoundException;
import com.gantry.core.scheduler.JobConflictException;
import com.gantry.core.scheduler.JobOperations;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: gantry cancel &lt;job-id&gt;
 */
@Command(name = "cancel", mixinStandardHelpOptions = true,
        description = "Cancel a running job and hold its task in BLOCKED")
@Component
public class CancelCommand implements Runnable {

    @Parameters(index = "0", description = "Job ID")
    private String jobId;

    private final JobOperations jobOperations;

    public CancelCommand(JobOperations jobOperations) {
        this.jobOperations = jobOperations;
    }

    @Override
    public void run() {
        try {
            Job job = jobOperations.cancel(jobId);
            ConsoleOutput.success("Cancelled " + job.id() + "; task " + job.taskId() + " is on hold");
        } catch (RecordNotFoundException e) {
            ConsoleOutput.error("Job not found: " + jobId);
        } catch (JobConflictException | IllegalTransitionException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }
}
