package io.b2mash.kpi.kpidashboard.phase;

import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import io.b2mash.kpi.kpidashboard.task.TaskPhase;

/**
 * How a change of work hours is spread over the phase split. Either every phase scales by the same
 * factor, or the whole delta lands on one named phase.
 *
 * @param strategy the rescale strategy
 * @param phase the receiving phase, only set for {@link Strategy#TARGETED_PHASE}
 */
public record PhaseRescale(Strategy strategy, TaskPhase phase) {

  public enum Strategy {
    PROPORTIONAL,
    TARGETED_PHASE
  }

  public PhaseRescale {
    if (strategy == null) {
      throw new InvalidStateException("Invalid rescale", "A rescale strategy is required");
    }
    if (strategy == Strategy.TARGETED_PHASE && phase == null) {
      throw new InvalidStateException(
          "Invalid rescale", "A targeted-phase rescale needs the phase that receives the hours");
    }
    if (strategy == Strategy.PROPORTIONAL) {
      phase = null;
    }
  }

  public static PhaseRescale proportional() {
    return new PhaseRescale(Strategy.PROPORTIONAL, null);
  }

  public static PhaseRescale targeted(TaskPhase phase) {
    return new PhaseRescale(Strategy.TARGETED_PHASE, phase);
  }

  /**
   * Parses the request form: {@code proportional}, or {@code targeted:<phase>} such as {@code
   * targeted:testing}. Returns null for a null or blank value.
   */
  public static PhaseRescale parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    String value = raw.trim();
    if ("proportional".equalsIgnoreCase(value)) {
      return proportional();
    }
    if (value.regionMatches(true, 0, "targeted:", 0, "targeted:".length())) {
      return targeted(TaskPhase.fromValue(value.substring("targeted:".length())));
    }
    throw new InvalidStateException(
        "Invalid rescale",
        "Rescale must be 'proportional' or 'targeted:<phase>', but got: '" + raw + "'");
  }
}
