package com.gantry.dispatch.api;

import com.gantry.core.board.IntakeResult;
import com.gantry.core.board.TaskBoard;
import com.gantry.core.model.Job;
import com.gantry.core.model.Lane;
import com.gantry.core.model.Task;
import com.gantry.core.model.TaskStatus;
import com.gantry.core.persistence.JobRepository;
import com.gantry.core.verdict.VerdictReplayService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST controller for task intake and the operator actions on tasks.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final TaskBoard taskBoard;
    private final JobRepository jobRepository;
    private final VerdictReplayService replayService;

    public TaskController(TaskBoard taskBoard, JobRepository jobRepository, VerdictReplayService replayService) {
        this.taskBoard = taskBoard;
        this.jobRepository = jobRepository;
        this.replayService = replayService;
    }

    /**
     * POST /api/v1/tasks — Create a task. 201 for a new task, 200 when a dedup key matched.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody CreateTaskRequest request) {
        IntakeResult result = taskBoard.create(request.toNewTask());
        Task task = result.task();
        log.info("Task {} {} via API", task.id(), result.deduplicated() ? "deduplicated" : "created");
        return ResponseEntity.status(result.deduplicated() ? HttpStatus.OK : HttpStatus.CREATED)
                .body(summary(task, result.deduplicated()));
    }

    @GetMapping
    public List<Task> list(@RequestParam(required = false) String status,
                           @RequestParam(required = false) String lane) {
        TaskStatus statusFilter = status == null ? null : TaskStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        Lane laneFilter = lane == null ? null : Lane.parse(lane);
        return taskBoard.list(statusFilter, laneFilter);
    }

    /**
     * GET /api/v1/tasks/{id} — Task with its job history.
     */
    @GetMapping("/{id}")
    public Map<String, Object> get(@PathVariable String id) {
        Task task = taskBoard.get(id);
        List<Job> jobs = jobRepository.findByTask(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("task", task);
        body.put("jobs", jobs);
        return body;
    }

    /**
     * GET /api/v1/tasks/{id}/verdict — Stored verdict of the latest judged job and a fresh replay.
     */
    @GetMapping("/{id}/verdict")
    public ResponseEntity<Map<String, Object>> verdict(@PathVariable String id) {
        taskBoard.get(id);
        var replay = replayService.replay(id);
        if (replay.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "No verdict recorded for task " + id));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("task_id", id);
        body.put("job_id", replay.get().jobId());
        body.put("stored", replay.get().stored());
        body.put("replayed", replay.get().replayed());
        body.put("consistent", replay.get().consistent());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{id}/split")
    public ResponseEntity<Map<String, Object>> split(@PathVariable String id,
                                                     @RequestBody List<CreateTaskRequest> children) {
        if (children == null || children.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least one child task is required"));
        }
        var created = taskBoard.split(id, children.stream().map(CreateTaskRequest::toNewTask).toList());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "parent_id", id,
                "children", created.stream().map(Task::id).toList()));
    }

    @PostMapping("/{id}/block")
    public Map<String, Object> block(@PathVariable String id,
                                     @RequestBody(required = false) Map<String, String> body) {
        String reason = body == null || body.get("reason") == null ? "blocked_by_operator" : body.get("reason");
        return summary(taskBoard.block(id, reason), false);
    }

    @PostMapping("/{id}/unblock")
    public Map<String, Object> unblock(@PathVariable String id) {
        return summary(taskBoard.unblock(id), false);
    }

    @PostMapping("/{id}/release")
    public Map<String, Object> release(@PathVariable String id) {
        return summary(taskBoard.releaseFromQuarantine(id), false);
    }

    @PostMapping("/{id}/lane")
    public ResponseEntity<Map<String, Object>> lane(@PathVariable String id, @RequestBody Map<String, String> body) {
        String lane = body == null ? null : body.get("lane");
        if (lane == null || lane.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "lane is required"));
        }
        return ResponseEntity.ok(summary(taskBoard.overrideLane(id, Lane.parse(lane)), false));
    }

    private static Map<String, Object> summary(Task task, boolean deduplicated) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("task_id", task.id());
        body.put("status", task.status().name());
        body.put("lane", task.lane().key());
        body.put("attempt", task.attempt());
        body.put("reasons", task.reasons());
        if (deduplicated) {
            body.put("deduplicated", true);
        }
        return body;
    }
}
