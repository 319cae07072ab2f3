package com.gantry.core.health;

import com.gantry.core.admission.AdmissionController;
import com.gantry.core.admission.CircuitBreakerRegistry;
import com.gantry.core.admission.DegradationMonitor;
import com.gantry.core.admission.LaneSnapshot;
import com.gantry.core.model.JobStatus;
import com.gantry.core.model.Task;
import com.gantry.core.model.TaskStatus;
import com.gantry.core.persistence.JobRepository;
import com.gantry.core.persistence.TaskRepository;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class OpsStatusService {

    private final TaskRepository taskRepository;
    private final JobRepository jobRepository;
    private final AdmissionController admissionController;
    private final DegradationMonitor degradationMonitor;
    private final CircuitBreakerRegistry breakers;

    public OpsStatusService(TaskRepository taskRepository,
                            JobRepository jobRepository,
                            AdmissionController admissionController,
                            DegradationMonitor degradationMonitor,
                            CircuitBreakerRegistry breakers) {
        this.taskRepository = taskRepository;
        this.jobRepository = jobRepository;
        this.admissionController = admissionController;
        this.degradationMonitor = degradationMonitor;
        this.breakers = breakers;
    }

    public OpsStatus status() {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0L);
        }
        for (Task task : taskRepository.findAll()) {
            counts.merge(task.status(), 1L, Long::sum);
        }
        return new OpsStatus(
                degradationMonitor.currentLevel(),
                degradationMonitor.failureRate(),
                degradationMonitor.saturation(),
                counts,
                jobRepository.findByStatus(JobStatus.RUNNING).size(),
                admissionController.laneSnapshots(),
                breakers.snapshot());
    }

    public List<LaneSnapshot> lanes() {
        return admissionController.laneSnapshots();
    }
}
