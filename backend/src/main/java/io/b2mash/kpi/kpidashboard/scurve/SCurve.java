package io.b2mash.kpi.kpidashboard.scurve;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDate;
import java.util.List;

/**
 * Cumulative hours per date bin, in the shape charting clients consume. {@code labels[i]} is the
 * last day of bin {@code i}.
 *
 * @param project name of the root task when the curve covers one project, otherwise null
 */
public record SCurve(
    List<LocalDate> labels,
    List<Double> baseline,
    List<Double> scheduled,
    List<Double> earned,
    @JsonInclude(JsonInclude.Include.NON_NULL) String project) {

  public static SCurve empty(String project) {
    return new SCurve(List.of(), List.of(), List.of(), List.of(), project);
  }

  public SCurve withProject(String project) {
    return new SCurve(labels, baseline, scheduled, earned, project);
  }
}
