package io.b2mash.kpi.kpidashboard.store;

import io.b2mash.kpi.kpidashboard.baseline.BaselineSnapshot;
import io.b2mash.kpi.kpidashboard.dependency.Dependency;
import io.b2mash.kpi.kpidashboard.milestone.Milestone;
import io.b2mash.kpi.kpidashboard.resource.Resource;
import io.b2mash.kpi.kpidashboard.task.Task;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Mutable working copy used inside one write transaction, or privately by a simulation. Changes
 * become visible to readers only through {@link TaskStore#inTransaction}.
 */
public final class TaskTable extends TaskView {

  private final Map<UUID, Task> tasks;
  private final Map<String, Resource> resources;
  private final Map<UUID, Dependency> dependencies;
  private final Map<UUID, Milestone> milestones;
  private final Map<UUID, BaselineSnapshot> baselines;

  TaskTable(
      Map<UUID, Task> tasks,
      Map<String, Resource> resources,
      Map<UUID, Dependency> dependencies,
      Map<UUID, Milestone> milestones,
      Map<UUID, BaselineSnapshot> baselines) {
    this.tasks = new LinkedHashMap<>(tasks);
    this.resources = new LinkedHashMap<>(resources);
    this.dependencies = new LinkedHashMap<>(dependencies);
    this.milestones = new LinkedHashMap<>(milestones);
    this.baselines = new LinkedHashMap<>(baselines);
  }

  public void putTask(Task task) {
    tasks.put(task.id(), task);
  }

  public void removeTask(UUID taskId) {
    tasks.remove(taskId);
    dependencies
        .values()
        .removeIf(d -> d.predecessorId().equals(taskId) || d.successorId().equals(taskId));
  }

  public void putResource(Resource resource) {
    resources.put(resource.name(), resource);
  }

  public void putDependency(Dependency dependency) {
    dependencies.put(dependency.id(), dependency);
  }

  public void removeDependency(UUID dependencyId) {
    dependencies.remove(dependencyId);
  }

  public void putMilestone(Milestone milestone) {
    milestones.put(milestone.id(), milestone);
  }

  public void removeMilestone(UUID milestoneId) {
    milestones.remove(milestoneId);
  }

  public void putBaseline(BaselineSnapshot baseline) {
    baselines.put(baseline.id(), baseline);
  }

  public void removeBaseline(UUID baselineId) {
    baselines.remove(baselineId);
  }

  TaskSnapshot toSnapshot() {
    return new TaskSnapshot(tasks, resources, dependencies, milestones, baselines);
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
