package io.b2mash.kpi.kpidashboard.baseline;

import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import io.b2mash.kpi.kpidashboard.store.TaskStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class BaselineService {

  private static final Logger log = LoggerFactory.getLogger(BaselineService.class);

  private final TaskStore taskStore;
  private final Clock clock;

  public BaselineService(TaskStore taskStore, Clock clock) {
    this.taskStore = taskStore;
    this.clock = clock;
  }

  /** Most recent first. */
  public List<BaselineSnapshot> listBaselines() {
    return taskStore.snapshot().baselines().stream()
        .sorted(Comparator.comparing(BaselineSnapshot::capturedAt).reversed())
        .toList();
  }

  public BaselineSnapshot getBaseline(UUID baselineId) {
    return taskStore.snapshot().requireBaseline(baselineId);
  }

  /** Captures every task as it stands now. Capture and store happen in one transaction. */
  public BaselineSnapshot createBaseline(String name, BaselineType type) {
    if (name == null || name.isBlank()) {
      throw new InvalidStateException("Invalid baseline", "Baseline name must not be blank");
    }
    var baseline =
        taskStore.inTransaction(
            table -> {
              var snapshot =
                  new BaselineSnapshot(
                      UUID.randomUUID(),
                      name.trim(),
                      type != null ? type : BaselineType.MANUAL,
                      Instant.now(clock),
                      BaselineComparator.capture(table));
              table.putBaseline(snapshot);
              return snapshot;
            });
    log.info(
        "Captured baseline {} ({}, {}) with {} tasks",
        baseline.id(),
        baseline.name(),
        baseline.type().value(),
        baseline.tasks().size());
    return baseline;
  }

  public void deleteBaseline(UUID baselineId) {
    taskStore.inTransaction(
        table -> {
          table.requireBaseline(baselineId);
          table.removeBaseline(baselineId);
          return null;
        });
    log.info("Deleted baseline {}", baselineId);
  }

  public BaselineComparison compare(UUID baselineId) {
    var snapshot = taskStore.snapshot();
    return BaselineComparator.compare(snapshot.requireBaseline(baselineId), snapshot);
  }
}
