package io.b2mash.kpi.kpidashboard.resource;

import io.b2mash.kpi.kpidashboard.config.EngineProperties;
import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import io.b2mash.kpi.kpidashboard.exception.ResourceConflictException;
import io.b2mash.kpi.kpidashboard.store.TaskStore;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ResourceService {

  private static final Logger log = LoggerFactory.getLogger(ResourceService.class);

  private final TaskStore taskStore;
  private final EngineProperties engineProperties;

  public ResourceService(TaskStore taskStore, EngineProperties engineProperties) {
    this.taskStore = taskStore;
    this.engineProperties = engineProperties;
  }

  public List<Resource> listResources() {
    return List.copyOf(taskStore.snapshot().resources());
  }

  public Resource getResource(String name) {
    return taskStore.snapshot().requireResource(name);
  }

  /** Registers a resource; a null capacity uses the configured weekly default. */
  public Resource createResource(
      String name, BigDecimal capacityHoursPerWeek, LeadPreference leadPreference) {
    if (name == null || name.isBlank()) {
      throw new InvalidStateException("Invalid resource", "Resource name must not be blank");
    }
    var capacity =
        capacityHoursPerWeek != null
            ? capacityHoursPerWeek
            : engineProperties.defaultWeeklyCapacityHours();
    requirePositiveCapacity(capacity);
    var resource =
        new Resource(
            name.trim(),
            capacity,
            true,
            leadPreference != null ? leadPreference : LeadPreference.ASK);

    taskStore.inTransaction(
        table -> {
          if (table.findResource(resource.name()).isPresent()) {
            throw new ResourceConflictException(
                "Resource exists", "A resource named '" + resource.name() + "' already exists");
          }
          table.putResource(resource);
          return resource;
        });
    log.info("Created resource {} with {}h/week", resource.name(), capacity);
    return resource;
  }

  /** Updates capacity, activity and lead preference; null arguments keep the current value. */
  public Resource updateResource(
      String name, BigDecimal capacityHoursPerWeek, Boolean active, LeadPreference leadPreference) {
    if (capacityHoursPerWeek != null) {
      requirePositiveCapacity(capacityHoursPerWeek);
    }
    var updated =
        taskStore.inTransaction(
            table -> {
              var current = table.requireResource(name);
              var next =
                  new Resource(
                      current.name(),
                      capacityHoursPerWeek != null
                          ? capacityHoursPerWeek
                          : current.capacityHoursPerWeek(),
                      active != null ? active : current.active(),
                      leadPreference != null ? leadPreference : current.leadPreference());
              table.putResource(next);
              return next;
            });
    log.info(
        "Updated resource {}: capacity={}h/week, active={}, mode={}",
        name,
        updated.capacityHoursPerWeek(),
        updated.active(),
        updated.leadPreference().mode().value());
    return updated;
  }

  private static void requirePositiveCapacity(BigDecimal capacity) {
    if (capacity.signum() <= 0) {
      throw new InvalidStateException(
          "Invalid capacity", "Capacity must be greater than 0, but got: " + capacity);
    }
  }
}
