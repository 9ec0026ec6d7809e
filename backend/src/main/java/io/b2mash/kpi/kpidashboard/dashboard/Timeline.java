package io.b2mash.kpi.kpidashboard.dashboard;

import io.b2mash.kpi.kpidashboard.dependency.Dependency;
import io.b2mash.kpi.kpidashboard.milestone.Milestone;
import io.b2mash.kpi.kpidashboard.task.Task;
import java.util.List;

/** Tasks, links and milestones read from one snapshot. */
public record Timeline(
    List<Task> tasks, List<Dependency> dependencies, List<Milestone> milestones) {}
