package com.gantry.core.persistence;

import com.gantry.core.model.Lane;
import com.gantry.core.model.Task;
import com.gantry.core.model.TaskStatus;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Task records in the {@code tasks} namespace, keyed by task id.
 */
@Component
public class TaskRepository {

    private static final String SEQUENCE_NAME = "task";

    private final JsonRecords<Task> records;
    private final SequenceGenerator sequences;

    public TaskRepository(StateStore store, SequenceGenerator sequences) {
        this.records = new JsonRecords<>(store, StateNamespace.TASKS, Task.class, StateJson.mapper());
        this.sequences = sequences;
    }

    /** Reserves the next creation sequence number; ids are derived from it. */
    public long nextSequence() {
        return sequences.next(SEQUENCE_NAME);
    }

    public static String idFor(long sequence) {
        return "TASK-%04d".formatted(sequence);
    }

    public Task create(Task task) {
        return records.create(task.id(), task);
    }

    public Optional<Task> find(String taskId) {
        return records.get(taskId);
    }

    public Task get(String taskId) {
        return find(taskId).orElseThrow(() -> new RecordNotFoundException("Task " + taskId + " not found"));
    }

    public Task update(String taskId, UnaryOperator<Task> mutator) {
        return records.update(taskId, mutator);
    }

    /** All tasks in creation order. */
    public List<Task> findAll() {
        return records.list().stream().sorted(Comparator.comparingLong(Task::sequence)).toList();
    }

    public List<Task> findByStatus(TaskStatus status) {
        return findAll().stream().filter(t -> t.status() == status).toList();
    }

    public List<Task> findChildren(String parentId) {
        return findAll().stream().filter(t -> parentId.equals(t.parentId())).toList();
    }

    public Optional<Task> findByDedupKey(String dedupKey) {
        return findAll().stream().filter(t -> dedupKey.equals(t.dedupKey())).findFirst();
    }

    public long countInProgress(Lane lane) {
        return findAll().stream()
                .filter(t -> t.status() == TaskStatus.IN_PROGRESS && t.lane() == lane)
                .count();
    }
}
