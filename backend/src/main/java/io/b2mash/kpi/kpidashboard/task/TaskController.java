package io.b2mash.kpi.kpidashboard.task;

import io.b2mash.kpi.kpidashboard.phase.PhaseRescale;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TaskController {

  /** Mirrors {@code Hours.MAX_TASK_HOURS} for request validation. */
  static final String MAX_TASK_HOURS = "1000000";

  private final TaskService taskService;

  public TaskController(TaskService taskService) {
    this.taskService = taskService;
  }

  @GetMapping("/api/tasks")
  public ResponseEntity<List<TaskResponse>> listTasks() {
    return ResponseEntity.ok(taskService.listTasks().stream().map(TaskResponse::from).toList());
  }

  @GetMapping("/api/tasks/{taskId}")
  public ResponseEntity<TaskResponse> getTask(@PathVariable UUID taskId) {
    return ResponseEntity.ok(TaskResponse.from(taskService.getTask(taskId)));
  }

  @PostMapping("/api/tasks")
  public ResponseEntity<TaskResponse> createTask(@Valid @RequestBody CreateTaskRequest request) {
    var task =
        taskService.createTask(
            request.name(),
            request.resource(),
            request.workHours(),
            request.baselineHours(),
            request.percentComplete(),
            request.startDate(),
            request.finishDate(),
            request.parentId(),
            request.currentPhase());
    return ResponseEntity.created(URI.create("/api/tasks/" + task.id()))
        .body(TaskResponse.from(task));
  }

  /**
   * The single authoritative-edit entrypoint. {@code rescale} is {@code proportional} or {@code
   * targeted:<phase>} and only matters when work hours change.
   */
  @PatchMapping("/api/tasks/{taskId}")
  public ResponseEntity<TaskResponse> updateTask(
      @PathVariable UUID taskId,
      @RequestParam(required = false) String rescale,
      @RequestBody TaskFieldUpdate update) {
    var task = taskService.applyFieldUpdate(taskId, update, PhaseRescale.parse(rescale));
    return ResponseEntity.ok(TaskResponse.from(task));
  }

  @PostMapping("/api/tasks/{taskId}/rescale/proportional")
  public ResponseEntity<TaskResponse> rescaleProportional(
      @PathVariable UUID taskId, @Valid @RequestBody ProportionalRescaleRequest request) {
    var task = taskService.rescaleProportional(taskId, request.workHours());
    return ResponseEntity.ok(TaskResponse.from(task));
  }

  @PostMapping("/api/tasks/{taskId}/rescale/phase")
  public ResponseEntity<TaskResponse> addHoursToPhase(
      @PathVariable UUID taskId, @Valid @RequestBody PhaseHoursRequest request) {
    var task = taskService.addHoursToPhase(taskId, request.phase(), request.hours());
    return ResponseEntity.ok(TaskResponse.from(task));
  }

  @PostMapping("/api/tasks/{taskId}/log-hours")
  public ResponseEntity<TaskResponse> logHours(
      @PathVariable UUID taskId, @Valid @RequestBody LogHoursRequest request) {
    var task =
        taskService.logHours(taskId, request.hours(), PhaseRescale.parse(request.rescale()));
    return ResponseEntity.ok(TaskResponse.from(task));
  }

  @DeleteMapping("/api/tasks/{taskId}")
  public ResponseEntity<Void> deleteTask(@PathVariable UUID taskId) {
    taskService.deleteTask(taskId);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record CreateTaskRequest(
      @NotBlank @Size(max = 500) String name,
      String resource,
      @NotNull @Positive @DecimalMax(MAX_TASK_HOURS) BigDecimal workHours,
      @DecimalMax(MAX_TASK_HOURS) BigDecimal baselineHours,
      @Min(0) @Max(100) Integer percentComplete,
      @NotNull LocalDate startDate,
      LocalDate finishDate,
      UUID parentId,
      TaskPhase currentPhase) {}

  public record ProportionalRescaleRequest(
      @NotNull @Positive @DecimalMax(MAX_TASK_HOURS) BigDecimal workHours) {}

  public record PhaseHoursRequest(
      @NotNull TaskPhase phase, @NotNull @DecimalMax(MAX_TASK_HOURS) BigDecimal hours) {}

  public record LogHoursRequest(
      @NotNull @Positive @DecimalMax(MAX_TASK_HOURS) BigDecimal hours, String rescale) {}

  public record TaskResponse(
      UUID id,
      String name,
      String resource,
      BigDecimal workHours,
      BigDecimal baselineHours,
      int percentComplete,
      LocalDate startDate,
      LocalDate finishDate,
      UUID parentId,
      BigDecimal devHours,
      BigDecimal testHours,
      BigDecimal reviewHours,
      TaskPhase currentPhase,
      BigDecimal hoursCompleted,
      BigDecimal hoursRemaining,
      BigDecimal earnedValue,
      BigDecimal variance,
      Instant updatedAt) {

    public static TaskResponse from(Task task) {
      return new TaskResponse(
          task.id(),
          task.name(),
          task.resource(),
          task.workHours(),
          task.baselineHours(),
          task.percentComplete(),
          task.startDate(),
          task.finishDate(),
          task.parentId(),
          task.devHours(),
          task.testHours(),
          task.reviewHours(),
          task.currentPhase(),
          task.hoursCompleted(),
          task.hoursRemaining(),
          task.earnedValue(),
          task.variance(),
          task.updatedAt());
    }
  }
}
