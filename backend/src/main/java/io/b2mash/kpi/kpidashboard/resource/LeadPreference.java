package io.b2mash.kpi.kpidashboard.resource;

import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import io.b2mash.kpi.kpidashboard.phase.PhaseRatios;
import io.b2mash.kpi.kpidashboard.phase.PhaseRescale;
import io.b2mash.kpi.kpidashboard.task.TaskPhase;
import java.util.Optional;

/**
 * Per-resource defaults handed to the phase distributor by the caller.
 *
 * @param mode what to do with work-hour changes that arrive without an explicit rescale
 * @param targetPhase receiving phase when {@code mode} is {@link AdjustmentMode#TARGETED_PHASE}
 * @param ratios creation split for this resource's new tasks, null to use the configured default
 */
public record LeadPreference(AdjustmentMode mode, TaskPhase targetPhase, PhaseRatios ratios) {

  public static final LeadPreference ASK = new LeadPreference(AdjustmentMode.ASK, null, null);

  public LeadPreference {
    if (mode == null) {
      mode = AdjustmentMode.ASK;
    }
    if (mode == AdjustmentMode.TARGETED_PHASE && targetPhase == null) {
      throw new InvalidStateException(
          "Invalid lead preference", "targeted_phase mode needs a targetPhase");
    }
  }

  /** The rescale used when the caller names none; empty when the lead wants to be asked. */
  public Optional<PhaseRescale> defaultRescale() {
    return switch (mode) {
      case ASK -> Optional.empty();
      case PROPORTIONAL -> Optional.of(PhaseRescale.proportional());
      case TARGETED_PHASE -> Optional.of(PhaseRescale.targeted(targetPhase));
    };
  }
}
