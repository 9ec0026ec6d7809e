package io.b2mash.kpi.kpidashboard.store;

import io.b2mash.kpi.kpidashboard.baseline.BaselineSnapshot;
import io.b2mash.kpi.kpidashboard.dependency.Dependency;
import io.b2mash.kpi.kpidashboard.exception.ResourceNotFoundException;
import io.b2mash.kpi.kpidashboard.milestone.Milestone;
import io.b2mash.kpi.kpidashboard.resource.Resource;
import io.b2mash.kpi.kpidashboard.task.Task;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read queries over the flat task table. Tasks are addressed by id and point at their parent by
 * id; the child relation is computed on demand.
 */
public abstract class TaskView {

  protected abstract Map<UUID, Task> taskMap();

  protected abstract Map<String, Resource> resourceMap();

  protected abstract Map<UUID, Dependency> dependencyMap();

  protected abstract Map<UUID, Milestone> milestoneMap();

  protected abstract Map<UUID, BaselineSnapshot> baselineMap();

  public Collection<Task> tasks() {
    return taskMap().values();
  }

  public Optional<Task> findTask(UUID id) {
    return Optional.ofNullable(taskMap().get(id));
  }

  public Task requireTask(UUID id) {
    var task = taskMap().get(id);
    if (task == null) {
      throw new ResourceNotFoundException("Task", id);
    }
    return task;
  }

  public List<Task> children(UUID parentId) {
    return taskMap().values().stream().filter(t -> parentId.equals(t.parentId())).toList();
  }

  public boolean hasChildren(UUID taskId) {
    return taskMap().values().stream().anyMatch(t -> taskId.equals(t.parentId()));
  }

  /** Tasks without subtasks. Parents only restate their children's totals. */
  public List<Task> leafTasks() {
    var parentIds =
        taskMap().values().stream()
            .map(Task::parentId)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
    return taskMap().values().stream().filter(t -> !parentIds.contains(t.id())).toList();
  }

  /** Leaves of the subtree under {@code rootId}; the root itself when it has no subtasks. */
  public List<Task> subtreeLeaves(UUID rootId) {
    var childrenByParent = childrenByParent();
    return walkDown(rootId, childrenByParent).stream()
        .filter(t -> !childrenByParent.containsKey(t.id()))
        .toList();
  }

  /** The task and everything below it, root first. */
  private List<Task> walkDown(UUID rootId, Map<UUID, List<Task>> childrenByParent) {
    var result = new ArrayList<Task>();
    Deque<Task> pending = new ArrayDeque<>();
    pending.push(requireTask(rootId));
    while (!pending.isEmpty()) {
      var task = pending.pop();
      result.add(task);
      childrenByParent.getOrDefault(task.id(), List.of()).forEach(pending::push);
    }
    return result;
  }

  private Map<UUID, List<Task>> childrenByParent() {
    return taskMap().values().stream()
        .filter(t -> t.parentId() != null)
        .collect(Collectors.groupingBy(Task::parentId));
  }

  public Collection<Resource> resources() {
    return resourceMap().values();
  }

  public Optional<Resource> findResource(String name) {
    return Optional.ofNullable(resourceMap().get(name));
  }

  public Resource requireResource(String name) {
    var resource = resourceMap().get(name);
    if (resource == null) {
      throw new ResourceNotFoundException("Resource", name);
    }
    return resource;
  }

  public Collection<Dependency> dependencies() {
    return dependencyMap().values();
  }

  public Optional<Dependency> findDependency(UUID id) {
    return Optional.ofNullable(dependencyMap().get(id));
  }

  public Collection<Milestone> milestones() {
    return milestoneMap().values();
  }

  public Optional<Milestone> findMilestone(UUID id) {
    return Optional.ofNullable(milestoneMap().get(id));
  }

  public Collection<BaselineSnapshot> baselines() {
    return baselineMap().values();
  }

  public BaselineSnapshot requireBaseline(UUID id) {
    var baseline = baselineMap().get(id);
    if (baseline == null) {
      throw new ResourceNotFoundException("Baseline", id);
    }
    return baseline;
  }
}
