package com.gantry.core.scheduler;

import com.gantry.core.admission.AdmissionController;
import com.gantry.core.admission.AdmissionDecision;
import com.gantry.core.board.TaskBoard;
import com.gantry.core.logging.MdcContext;
import com.gantry.core.model.Job;
import com.gantry.core.model.JobStatus;
import com.gantry.core.model.Lane;
import com.gantry.core.model.Task;
import com.gantry.core.persistence.JobRepository;
import com.gantry.executor.DispatchResult;
import com.gantry.executor.ExecutorDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * The single logical scheduler. Each tick:
 * <ol>
 *   <li>reaps finished and expired jobs</li>
 *   <li>promotes backlog tasks the admission controller lets into READY</li>
 *   <li>admits and dispatches each regular lane in queue order</li>
 *   <li>closes parents whose children are all done</li>
 * </ol>
 * Nothing here blocks: deferred work is simply offered again next tick.
 */
@Component
public class SchedulerLoop {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private static final List<Lane> DISPATCH_LANES = Arrays.stream(Lane.values())
            .filter(lane -> !lane.escalation())
            .toList();

    private final JobReaper reaper;
    private final TaskBoard taskBoard;
    private final AdmissionController admissionController;
    private final ExecutorDispatcher dispatcher;
    private final JobRepository jobRepository;

    public SchedulerLoop(JobReaper reaper,
                         TaskBoard taskBoard,
                         AdmissionController admissionController,
                         ExecutorDispatcher dispatcher,
                         JobRepository jobRepository) {
        this.reaper = reaper;
        this.taskBoard = taskBoard;
        this.admissionController = admissionController;
        this.dispatcher = dispatcher;
        this.jobRepository = jobRepository;
    }

    /**
     * Re-claims executor slots for jobs that were RUNNING before a restart.
     * Their back-ends report them LOST on the next poll unless they survived.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recover() {
        List<Job> running = jobRepository.findByStatus(JobStatus.RUNNING);
        running.forEach(dispatcher::reclaim);
        if (!running.isEmpty()) {
            log.info("Recovered {} running job(s) from the state store", running.size());
        }
    }

    @Scheduled(fixedDelayString = "${gantry.scheduler.tick-ms:2000}")
    public void scheduledTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return number of jobs started
     */
    public int tick() {
        reaper.reapAll();
        promoteBacklog();
        int started = 0;
        for (Lane lane : DISPATCH_LANES) {
            started += dispatchLane(lane);
        }
        taskBoard.rollUpParents();
        return started;
    }

    void promoteBacklog() {
        for (Task task : taskBoard.backlog()) {
            MdcContext.setTask(task.id(), task.lane().key());
            try {
                AdmissionDecision decision = admissionController.admitToReady(task);
                if (decision.isGranted()) {
                    taskBoard.promote(task.id());
                } else {
                    log.debug("Task {} stays in backlog: {}", task.id(), decision.reason());
                }
            } catch (RuntimeException e) {
                log.warn("Promotion of {} failed: {}", task.id(), e.getMessage());
            } finally {
                MdcContext.clear();
            }
        }
    }

    int dispatchLane(Lane lane) {
        int started = 0;
        for (Task task : taskBoard.dispatchQueue(lane)) {
            MdcContext.setTask(task.id(), lane.key());
            try {
                AdmissionDecision decision = admissionController.admit(task);
                if (decision.outcome() == AdmissionDecision.Outcome.DEFERRED) {
                    log.debug("Lane {} full: {}", lane.key(), decision.reason());
                    break;
                }
                if (!decision.isGranted()) {
                    continue;
                }
                DispatchResult result = dispatcher.dispatch(task);
                if (result.outcome() == DispatchResult.Outcome.STARTED) {
                    started++;
                } else {
                    log.debug("Task {} not dispatched: {}", task.id(), result.reason());
                }
            } catch (RuntimeException e) {
                log.warn("Dispatch of {} failed: {}", task.id(), e.getMessage());
            } finally {
                MdcContext.clear();
            }
        }
        return started;
    }
}
