package io.b2mash.kpi.kpidashboard.dependency;

/** Scheduling link between two tasks: finish-to-start, start-to-start and so on. */
public enum DependencyType {
  FS,
  SS,
  FF,
  SF
}
