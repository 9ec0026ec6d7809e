package io.b2mash.kpi.kpidashboard.scurve;

import io.b2mash.kpi.kpidashboard.config.EngineProperties;
import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import io.b2mash.kpi.kpidashboard.store.TaskStore;
import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.stereotype.Service;

@Service
public class SCurveService {

  private final TaskStore taskStore;
  private final EngineProperties engineProperties;
  private final Clock clock;

  public SCurveService(TaskStore taskStore, EngineProperties engineProperties, Clock clock) {
    this.taskStore = taskStore;
    this.engineProperties = engineProperties;
    this.clock = clock;
  }

  /** Portfolio curve over every leaf task. */
  public SCurve portfolioCurve(Integer binDays) {
    var snapshot = taskStore.snapshot();
    return SCurveBuilder.build(snapshot.leafTasks(), resolveBinDays(binDays), LocalDate.now(clock));
  }

  /** Curve of one project: the leaves under {@code rootTaskId}, or the root itself if it is one. */
  public SCurve projectCurve(UUID rootTaskId, Integer binDays) {
    var snapshot = taskStore.snapshot();
    var root = snapshot.requireTask(rootTaskId);
    var leaves = snapshot.subtreeLeaves(rootTaskId);
    return SCurveBuilder.build(leaves, resolveBinDays(binDays), LocalDate.now(clock))
        .withProject(root.name());
  }

  private int resolveBinDays(Integer binDays) {
    if (binDays == null) {
      return engineProperties.sCurveBinDays();
    }
    if (binDays < 1) {
      throw new InvalidStateException(
          "Invalid bin size", "binDays must be at least 1, but got: " + binDays);
    }
    return binDays;
  }
}
