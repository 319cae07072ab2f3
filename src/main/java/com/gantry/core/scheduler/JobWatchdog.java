package com.gantry.core.scheduler;

import com.gantry.core.model.Job;
import com.gantry.core.model.JobStatus;
import com.gantry.core.model.ReasonCodes;
import com.gantry.core.persistence.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Force-cancels jobs still RUNNING after deadline plus grace, independently of
 * the scheduler tick, so a stuck tick cannot keep a runaway process alive.
 */
@Component
public class JobWatchdog {

    private static final Logger log = LoggerFactory.getLogger(JobWatchdog.class);

    private final JobRepository jobRepository;
    private final JobReaper reaper;
    private final SchedulerProperties properties;
    private final Clock clock;

    public JobWatchdog(JobRepository jobRepository, JobReaper reaper, SchedulerProperties properties, Clock clock) {
        this.jobRepository = jobRepository;
        this.reaper = reaper;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${gantry.scheduler.watchdog-ms:15000}")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Watchdog sweep failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return number of jobs force-cancelled
     */
    public int sweep() {
        Instant now = clock.instant();
        int cancelled = 0;
        for (Job job : jobRepository.findByStatus(JobStatus.RUNNING)) {
            if (job.deadline() == null || !now.isAfter(job.deadline().plus(properties.getWatchdogGrace()))) {
                continue;
            }
            try {
                if (reaper.expire(job, ReasonCodes.EXECUTOR_TIMEOUT)) {
                    cancelled++;
                }
            } catch (RuntimeException e) {
                log.error("Watchdog could not cancel {}: {}", job.id(), e.getMessage(), e);
            }
        }
        if (cancelled > 0) {
            log.warn("Watchdog force-cancelled {} overdue job(s)", cancelled);
        }
        return cancelled;
    }
}
