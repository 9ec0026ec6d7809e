package io.b2mash.kpi.kpidashboard.milestone;

import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import io.b2mash.kpi.kpidashboard.exception.ResourceNotFoundException;
import io.b2mash.kpi.kpidashboard.store.TaskStore;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class MilestoneService {

  private static final Logger log = LoggerFactory.getLogger(MilestoneService.class);

  static final String DEFAULT_COLOR = "#9333ea";

  private final TaskStore taskStore;

  public MilestoneService(TaskStore taskStore) {
    this.taskStore = taskStore;
  }

  /** Milestones in date order. */
  public List<Milestone> listMilestones() {
    return taskStore.snapshot().milestones().stream()
        .sorted(Comparator.comparing(Milestone::date).thenComparing(Milestone::name))
        .toList();
  }

  public Milestone addMilestone(String name, LocalDate date, String color, String description) {
    if (name == null || name.isBlank()) {
      throw new InvalidStateException("Invalid milestone", "Milestone name must not be blank");
    }
    if (date == null) {
      throw new InvalidStateException("Invalid milestone", "Milestone date is required");
    }
    var milestone =
        new Milestone(
            UUID.randomUUID(),
            name.trim(),
            date,
            color == null || color.isBlank() ? DEFAULT_COLOR : color,
            description);
    taskStore.inTransaction(
        table -> {
          table.putMilestone(milestone);
          return milestone;
        });
    log.info("Added milestone {} ({}) on {}", milestone.id(), milestone.name(), date);
    return milestone;
  }

  public void removeMilestone(UUID milestoneId) {
    taskStore.inTransaction(
        table -> {
          if (table.findMilestone(milestoneId).isEmpty()) {
            throw new ResourceNotFoundException("Milestone", milestoneId);
          }
          table.removeMilestone(milestoneId);
          return null;
        });
    log.info("Removed milestone {}", milestoneId);
  }
}
