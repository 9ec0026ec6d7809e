package io.b2mash.kpi.kpidashboard.phase;

import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import io.b2mash.kpi.kpidashboard.schedule.DerivedFieldCalculator;
import io.b2mash.kpi.kpidashboard.schedule.Hours;
import io.b2mash.kpi.kpidashboard.task.Task;
import io.b2mash.kpi.kpidashboard.task.TaskPhase;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Splits and rescales a task's work across development, testing and review. Every operation keeps
 * {@code dev + test + review == workHours}; the review phase absorbs the rounding remainder.
 *
 * <p>Only the phase fields and {@code workHours} change here. Callers run the result through
 * {@link DerivedFieldCalculator} to refresh the derived fields.
 */
public final class PhaseDistributor {

  private PhaseDistributor() {}

  /** Creation split of {@code workHours} according to {@code ratios}. */
  public static Task initialSplit(Task task, BigDecimal workHours, PhaseRatios ratios) {
    BigDecimal work = Hours.round(workHours);
    BigDecimal dev = Hours.round(work.multiply(ratios.development()));
    BigDecimal test = Hours.round(work.multiply(ratios.testing()));
    return balanced(task, work, dev, test);
  }

  /** Dispatches on the caller's chosen strategy for a new work-hour total. */
  public static Task rescale(Task task, BigDecimal newWorkHours, PhaseRescale rescale) {
    return switch (rescale.strategy()) {
      case PROPORTIONAL -> rescaleProportional(task, newWorkHours);
      case TARGETED_PHASE ->
          addToPhase(task, rescale.phase(), Hours.round(newWorkHours).subtract(task.workHours()));
    };
  }

  /**
   * Multiplies each phase by {@code newWorkHours / workHours}. A task without a usable phase split
   * falls back to the default ratios.
   */
  public static Task rescaleProportional(Task task, BigDecimal newWorkHours) {
    BigDecimal work = Hours.round(newWorkHours);
    DerivedFieldCalculator.requirePositiveWork(work);
    BigDecimal phaseTotal = task.devHours().add(task.testHours()).add(task.reviewHours());
    if (task.workHours().signum() <= 0 || phaseTotal.signum() <= 0) {
      return initialSplit(task, work, PhaseRatios.DEFAULT);
    }
    BigDecimal dev = scaled(task.devHours(), work, task.workHours());
    BigDecimal test = scaled(task.testHours(), work, task.workHours());
    return balanced(task, work, dev, test);
  }

  /** Adds {@code deltaHours} to one phase; work becomes the sum of the three phases. */
  public static Task addToPhase(Task task, TaskPhase phase, BigDecimal deltaHours) {
    BigDecimal delta = Hours.round(deltaHours);
    BigDecimal updated = task.phaseHours(phase).add(delta);
    if (updated.signum() < 0) {
      throw new InvalidStateException(
          "Invalid phase hours",
          "Removing " + delta.negate() + "h would leave " + phase.value() + " negative");
    }
    var builder = task.toBuilder();
    switch (phase) {
      case DEVELOPMENT -> builder.devHours(updated);
      case TESTING -> builder.testHours(updated);
      case REVIEW -> builder.reviewHours(updated);
    }
    var adjusted = builder.build();
    return withSummedWork(adjusted);
  }

  /**
   * Direct edit of phase hours; null keeps the current value. Work becomes the sum of the three
   * phases.
   */
  public static Task setPhaseHours(Task task, BigDecimal dev, BigDecimal test, BigDecimal review) {
    var adjusted =
        task.toBuilder()
            .devHours(nonNegative(dev != null ? dev : task.devHours(), TaskPhase.DEVELOPMENT))
            .testHours(nonNegative(test != null ? test : task.testHours(), TaskPhase.TESTING))
            .reviewHours(
                nonNegative(review != null ? review : task.reviewHours(), TaskPhase.REVIEW))
            .build();
    return withSummedWork(adjusted);
  }

  /** Review takes the remainder; a negative rounding remainder comes out of testing instead. */
  private static Task balanced(Task task, BigDecimal work, BigDecimal dev, BigDecimal test) {
    BigDecimal review = work.subtract(dev).subtract(test);
    if (review.signum() < 0) {
      test = test.add(review);
      review = BigDecimal.ZERO.setScale(Hours.SCALE);
    }
    return task.toBuilder()
        .workHours(work)
        .devHours(dev)
        .testHours(test)
        .reviewHours(review)
        .build();
  }

  private static Task withSummedWork(Task task) {
    BigDecimal work = task.devHours().add(task.testHours()).add(task.reviewHours());
    DerivedFieldCalculator.requirePositiveWork(work);
    return task.toBuilder().workHours(Hours.round(work)).build();
  }

  private static BigDecimal scaled(BigDecimal hours, BigDecimal newTotal, BigDecimal oldTotal) {
    return hours.multiply(newTotal).divide(oldTotal, Hours.SCALE, RoundingMode.HALF_UP);
  }

  private static BigDecimal nonNegative(BigDecimal hours, TaskPhase phase) {
    if (hours.signum() < 0) {
      throw new InvalidStateException(
          "Invalid phase hours", phase.value() + " hours must not be negative, but got: " + hours);
    }
    return Hours.round(hours);
  }
}
