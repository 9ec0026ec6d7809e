package io.b2mash.kpi.kpidashboard.phase;

import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import java.math.BigDecimal;

/**
 * Shares of a task's work hours given to development, testing and review when the task is
 * created. The three shares must be non-negative and add up to 1 (within 0.001).
 */
public record PhaseRatios(BigDecimal development, BigDecimal testing, BigDecimal review) {

  private static final BigDecimal TOLERANCE = new BigDecimal("0.001");

  public static final PhaseRatios DEFAULT =
      new PhaseRatios(new BigDecimal("0.65"), new BigDecimal("0.25"), new BigDecimal("0.10"));

  public PhaseRatios {
    if (development == null || testing == null || review == null) {
      throw new InvalidStateException("Invalid phase ratios", "All three ratios are required");
    }
    if (development.signum() < 0 || testing.signum() < 0 || review.signum() < 0) {
      throw new InvalidStateException("Invalid phase ratios", "Ratios must not be negative");
    }
    BigDecimal sum = development.add(testing).add(review);
    if (sum.subtract(BigDecimal.ONE).abs().compareTo(TOLERANCE) > 0) {
      throw new InvalidStateException(
          "Invalid phase ratios", "Ratios must add up to 1 but add up to " + sum);
    }
  }
}
