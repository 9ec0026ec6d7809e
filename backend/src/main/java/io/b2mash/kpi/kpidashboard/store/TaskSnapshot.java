package io.b2mash.kpi.kpidashboard.store;

import io.b2mash.kpi.kpidashboard.baseline.BaselineSnapshot;
import io.b2mash.kpi.kpidashboard.dependency.Dependency;
import io.b2mash.kpi.kpidashboard.milestone.Milestone;
import io.b2mash.kpi.kpidashboard.resource.Resource;
import io.b2mash.kpi.kpidashboard.task.Task;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable, coherent state of the whole store at one commit. Read-side components work on a
 * snapshot and never observe a later write.
 */
public final class TaskSnapshot extends TaskView {

  private static final TaskSnapshot EMPTY =
      new TaskSnapshot(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());

  private final Map<UUID, Task> tasks;
  private final Map<String, Resource> resources;
  private final Map<UUID, Dependency> dependencies;
  private final Map<UUID, Milestone> milestones;
  private final Map<UUID, BaselineSnapshot> baselines;

  TaskSnapshot(
      Map<UUID, Task> tasks,
      Map<String, Resource> resources,
      Map<UUID, Dependency> dependencies,
      Map<UUID, Milestone> milestones,
      Map<UUID, BaselineSnapshot> baselines) {
    this.tasks = frozen(tasks);
    this.resources = frozen(resources);
    this.dependencies = frozen(dependencies);
    this.milestones = frozen(milestones);
    this.baselines = frozen(baselines);
  }

  public static TaskSnapshot empty() {
    return EMPTY;
  }

  /** A private, mutable working copy seeded from this snapshot. */
  public TaskTable toTable() {
    return new TaskTable(tasks, resources, dependencies, milestones, baselines);
  }

  private static <K, V> Map<K, V> frozen(Map<K, V> source) {
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  @Override
  protected Map<UUID, Task> taskMap() {
    return tasks;
  }

  @Override
  protected Map<String, Resource> resourceMap() {
    return resources;
  }

  @Override
  protected Map<UUID, Dependency> dependencyMap() {
    return dependencies;
  }

  @Override
  protected Map<UUID, Milestone> milestoneMap() {
    return milestones;
  }

  @Override
  protected Map<UUID, BaselineSnapshot> baselineMap() {
    return baselines;
  }
}
