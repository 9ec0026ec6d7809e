package io.b2mash.kpi.kpidashboard.dependency;

import io.b2mash.kpi.kpidashboard.store.TaskStore;
import io.b2mash.kpi.kpidashboard.store.TaskView;
import io.b2mash.kpi.kpidashboard.task.Task;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DependencyController {

  private final DependencyService dependencyService;
  private final TaskStore taskStore;

  public DependencyController(DependencyService dependencyService, TaskStore taskStore) {
    this.dependencyService = dependencyService;
    this.taskStore = taskStore;
  }

  @GetMapping("/api/dependencies")
  public ResponseEntity<List<DependencyResponse>> listDependencies() {
    var snapshot = taskStore.snapshot();
    return ResponseEntity.ok(
        dependencyService.listDependencies().stream()
            .map(d -> DependencyResponse.from(d, snapshot))
            .toList());
  }

  @PostMapping("/api/dependencies")
  public ResponseEntity<DependencyResponse> addDependency(
      @Valid @RequestBody CreateDependencyRequest request) {
    var dependency =
        dependencyService.addDependency(
            request.predecessorId(),
            request.successorId(),
            request.type(),
            request.lagDays() != null ? request.lagDays() : 0);
    return ResponseEntity.created(URI.create("/api/dependencies/" + dependency.id()))
        .body(DependencyResponse.from(dependency, taskStore.snapshot()));
  }

  @DeleteMapping("/api/dependencies/{dependencyId}")
  public ResponseEntity<Void> removeDependency(@PathVariable UUID dependencyId) {
    dependencyService.removeDependency(dependencyId);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record CreateDependencyRequest(
      @NotNull UUID predecessorId,
      @NotNull UUID successorId,
      DependencyType type,
      @Min(0) Integer lagDays) {}

  public record DependencyResponse(
      UUID id,
      UUID predecessorId,
      String predecessorName,
      UUID successorId,
      String successorName,
      DependencyType type,
      int lagDays) {

    public static DependencyResponse from(Dependency dependency, TaskView view) {
      return new DependencyResponse(
          dependency.id(),
          dependency.predecessorId(),
          view.findTask(dependency.predecessorId()).map(Task::name).orElse(null),
          dependency.successorId(),
          view.findTask(dependency.successorId()).map(Task::name).orElse(null),
          dependency.type(),
          dependency.lagDays());
    }
  }
}
