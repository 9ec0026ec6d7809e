package io.b2mash.kpi.kpidashboard.whatif;

import io.b2mash.kpi.kpidashboard.store.TaskStore;
import java.math.BigDecimal;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Runs simulations against the store's current snapshot. Never opens a write transaction. */
@Service
public class WhatIfService {

  private static final Logger log = LoggerFactory.getLogger(WhatIfService.class);

  private final TaskStore taskStore;

  public WhatIfService(TaskStore taskStore) {
    this.taskStore = taskStore;
  }

  public ResourceRemovalImpact removeResource(String resource, boolean redistribute) {
    var impact = WhatIfSimulator.removeResource(taskStore.snapshot(), resource, redistribute);
    log.debug(
        "Simulated removal of resource {}: {} tasks, {} hours orphaned",
        resource,
        impact.affectedTasks(),
        impact.orphanedHours());
    return impact;
  }

  public ScheduleSlipImpact slipSchedule(int weeks) {
    return WhatIfSimulator.slipSchedule(taskStore.snapshot(), weeks);
  }

  public AddHoursImpact addHours(UUID taskId, BigDecimal extraHours) {
    return WhatIfSimulator.addHours(taskStore.snapshot(), taskId, extraHours);
  }
}
