package com.gantry.dispatch.api;

import com.gantry.core.model.GateResult;
import com.gantry.core.model.Job;
import com.gantry.core.persistence.JobRepository;
import com.gantry.core.scheduler.JobOperations;
import com.gantry.core.verdict.SubmissionPayload;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for executor submissions, external gate results and job cancels.
 */
@RestController
@RequestMapping("/api/v1/jobs")
public class JobController {

    private final JobRepository jobRepository;
    private final JobOperations jobOperations;

    public JobController(JobRepository jobRepository, JobOperations jobOperations) {
        this.jobRepository = jobRepository;
        this.jobOperations = jobOperations;
    }

    @GetMapping("/{jobId}")
    public Job get(@PathVariable String jobId) {
        return jobRepository.get(jobId);
    }

    /**
     * POST /api/v1/jobs/{jobId}/submission — Structured result of a running job.
     * 400 with SCHEMA_VIOLATION codes for a malformed payload, 409 if one was already recorded.
     */
    @PostMapping("/{jobId}/submission")
    public ResponseEntity<Map<String, Object>> submit(@PathVariable String jobId,
                                                      @RequestBody SubmissionPayload payload) {
        Job job = jobOperations.submit(jobId, payload);
        return ResponseEntity.accepted().body(summary(job));
    }

    @PostMapping("/{jobId}/gates")
    public Map<String, Object> gates(@PathVariable String jobId, @RequestBody List<GateResult> results) {
        Job job = jobOperations.recordGateResults(jobId, results);
        Map<String, Object> body = summary(job);
        body.put("gates", job.gateResults().stream().map(GateResult::gate).toList());
        return body;
    }

    @PostMapping("/{jobId}/cancel")
    public Map<String, Object> cancel(@PathVariable String jobId) {
        return summary(jobOperations.cancel(jobId));
    }

    private static Map<String, Object> summary(Job job) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job_id", job.id());
        body.put("task_id", job.taskId());
        body.put("status", job.status().name());
        return body;
    }
}
