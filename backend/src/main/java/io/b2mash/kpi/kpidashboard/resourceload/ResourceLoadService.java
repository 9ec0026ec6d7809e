package io.b2mash.kpi.kpidashboard.resourceload;

import io.b2mash.kpi.kpidashboard.config.EngineProperties;
import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import io.b2mash.kpi.kpidashboard.store.TaskStore;
import java.time.Clock;
import java.time.LocalDate;
import org.springframework.stereotype.Service;

@Service
public class ResourceLoadService {

  static final int MAX_PERIODS = 104;

  private final TaskStore taskStore;
  private final EngineProperties engineProperties;
  private final Clock clock;

  public ResourceLoadService(TaskStore taskStore, EngineProperties engineProperties, Clock clock) {
    this.taskStore = taskStore;
    this.engineProperties = engineProperties;
    this.clock = clock;
  }

  /** Remaining open work per resource and period. */
  public ResourceLoadReport load(LoadPeriod period, Integer periods) {
    return analyze(period, periods, LoadView.LOAD);
  }

  /** Completed, remaining and available hours per resource against capacity. */
  public ResourceLoadReport allocation(LoadPeriod period, Integer periods) {
    return analyze(period, periods, LoadView.ALLOCATION);
  }

  private ResourceLoadReport analyze(LoadPeriod period, Integer periods, LoadView view) {
    int periodCount = periods != null ? periods : engineProperties.defaultLoadPeriods();
    if (periodCount < 1 || periodCount > MAX_PERIODS) {
      throw new InvalidStateException(
          "Invalid window",
          "Window must span between 1 and " + MAX_PERIODS + " periods, but got: " + periodCount);
    }
    var snapshot = taskStore.snapshot();
    return ResourceLoadAnalyzer.analyze(
        snapshot.resources(),
        snapshot.leafTasks(),
        period,
        periodCount,
        LocalDate.now(clock),
        view);
  }
}
