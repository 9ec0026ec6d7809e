package io.b2mash.kpi.kpidashboard.resourceload;

/** Which hours a load report counts. */
public enum LoadView {
  /** Remaining hours of open tasks only. */
  LOAD,
  /** Completed and remaining hours of every task, set against capacity. */
  ALLOCATION
}
