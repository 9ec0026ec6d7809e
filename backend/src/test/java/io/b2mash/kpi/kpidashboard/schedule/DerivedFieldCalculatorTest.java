package io.b2mash.kpi.kpidashboard.schedule;

import static io.b2mash.kpi.kpidashboard.TestTasks.leaf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class DerivedFieldCalculatorTest {

  // Monday
  private static final LocalDate MAR_3 = LocalDate.of(2025, 3, 3);

  @Test
  void derivesCompletionEarnedValueAndVariance() {
    var task = leaf("Build API", null, "100", "80", 0, MAR_3, MAR_3);

    var result = DerivedFieldCalculator.recalculate(task, TaskDelta.percentComplete(50));

    assertThat(result.hoursCompleted()).isEqualByComparingTo("50");
    assertThat(result.hoursRemaining()).isEqualByComparingTo("50");
    assertThat(result.variance()).isEqualByComparingTo("20");
    assertThat(result.earnedValue()).isEqualByComparingTo("40");
  }

  @Test
  void projectsFinishInBusinessDaysFromStart() {
    var task = leaf("Build API", null, "100", "80", 0, MAR_3, MAR_3);

    // 50h remaining -> 7 business days after Monday 3rd, skipping the weekend
    var result = DerivedFieldCalculator.recalculate(task, TaskDelta.percentComplete(50));

    assertThat(result.finishDate()).isEqualTo(LocalDate.of(2025, 3, 12));
  }

  @Test
  void partialDayOfRemainingWorkRoundsUpToWholeDay() {
    var task = leaf("Docs", null, "9", "9", 0, MAR_3, MAR_3);

    var result = DerivedFieldCalculator.recalculate(task, TaskDelta.workHours(new BigDecimal("9")));

    assertThat(result.finishDate()).isEqualTo(LocalDate.of(2025, 3, 5));
  }

  @Test
  void finishIsFrozenOnceNothingRemains() {
    var finish = LocalDate.of(2025, 3, 20);
    var task = leaf("Build API", null, "100", "100", 90, MAR_3, finish);

    var result = DerivedFieldCalculator.recalculate(task, TaskDelta.percentComplete(100));

    assertThat(result.hoursRemaining()).isEqualByComparingTo("0");
    assertThat(result.finishDate()).isEqualTo(finish);
  }

  @Test
  void frozenFinishIsRaisedWhenStartMovesPastIt() {
    var task = leaf("Build API", null, "40", "40", 100, MAR_3, LocalDate.of(2025, 3, 5));
    var newStart = LocalDate.of(2025, 3, 10);

    var result =
        DerivedFieldCalculator.recalculate(task, new TaskDelta(null, null, newStart, null));

    assertThat(result.finishDate()).isEqualTo(newStart);
  }

  @Test
  void explicitFinishSuppressesProjection() {
    var task = leaf("Build API", null, "100", "100", 0, MAR_3, MAR_3);
    var finish = LocalDate.of(2025, 4, 30);

    var result = DerivedFieldCalculator.recalculate(task, new TaskDelta(null, 10, null, finish));

    assertThat(result.finishDate()).isEqualTo(finish);
  }

  @Test
  void completedPlusRemainingEqualsWorkAfterRounding() {
    var task = leaf("Odd", null, "33.3", "30", 0, MAR_3, MAR_3);

    var result = DerivedFieldCalculator.recalculate(task, TaskDelta.percentComplete(33));

    assertThat(result.hoursCompleted()).isEqualByComparingTo("11.0");
    assertThat(result.hoursCompleted().add(result.hoursRemaining()))
        .isEqualByComparingTo(result.workHours());
  }

  @Test
  void earnedValueNeverExceedsBaseline() {
    var task = leaf("Build API", null, "120", "80", 0, MAR_3, MAR_3);

    var result = DerivedFieldCalculator.recalculate(task, TaskDelta.percentComplete(100));

    assertThat(result.earnedValue()).isEqualByComparingTo(result.baselineHours());
  }

  @Test
  void rejectsNonPositiveWork() {
    var task = leaf("Build API", null, "100", "80", 0, MAR_3, MAR_3);

    assertThatThrownBy(
            () -> DerivedFieldCalculator.recalculate(task, TaskDelta.workHours(BigDecimal.ZERO)))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void rejectsPercentOutsideRange() {
    var task = leaf("Build API", null, "100", "80", 0, MAR_3, MAR_3);

    assertThatThrownBy(
            () -> DerivedFieldCalculator.recalculate(task, TaskDelta.percentComplete(101)))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(
            () -> DerivedFieldCalculator.recalculate(task, TaskDelta.percentComplete(-1)))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void rejectsExplicitFinishBeforeStart() {
    var task = leaf("Build API", null, "100", "80", 0, MAR_3, MAR_3);

    assertThatThrownBy(
            () ->
                DerivedFieldCalculator.recalculate(
                    task, new TaskDelta(null, null, null, LocalDate.of(2025, 3, 1))))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void businessDaysSkipWeekend() {
    var friday = LocalDate.of(2025, 3, 7);

    assertThat(BusinessDays.advance(friday, 1)).isEqualTo(LocalDate.of(2025, 3, 10));
    assertThat(BusinessDays.advance(friday, 0)).isEqualTo(friday);
    assertThat(BusinessDays.isBusinessDay(LocalDate.of(2025, 3, 8))).isFalse();
  }

  @Test
  void businessDaysFromAWeekendAnchorStartOnMonday() {
    var saturday = LocalDate.of(2025, 3, 8);

    assertThat(BusinessDays.advance(saturday, 1)).isEqualTo(LocalDate.of(2025, 3, 10));
    assertThat(BusinessDays.advance(saturday, 5)).isEqualTo(LocalDate.of(2025, 3, 14));
    assertThat(BusinessDays.advance(LocalDate.of(2025, 3, 9), 6))
        .isEqualTo(LocalDate.of(2025, 3, 17));
  }

  @Test
  void businessDaysAdvanceWholeWeeksAtOnce() {
    // Wednesday; five business days always land on the next Wednesday
    var wednesday = LocalDate.of(2025, 3, 5);

    assertThat(BusinessDays.advance(wednesday, 3)).isEqualTo(LocalDate.of(2025, 3, 10));
    assertThat(BusinessDays.advance(wednesday, 5)).isEqualTo(LocalDate.of(2025, 3, 12));
    assertThat(BusinessDays.advance(wednesday, 5_000)).isEqualTo(wednesday.plusWeeks(1_000));
  }

  @Test
  void projectsFinishForTheLargestAllowedWork() {
    var finish = DerivedFieldCalculator.projectFinish(MAR_3, Hours.MAX_TASK_HOURS);

    // 1,000,000h / 8 = 125,000 business days = 25,000 weeks
    assertThat(finish).isEqualTo(MAR_3.plusWeeks(25_000));
  }

  @Test
  void rejectsWorkAboveTheTaskMaximum() {
    var task = leaf("Build API", null, "100", "80", 0, MAR_3, MAR_3);

    assertThatThrownBy(
            () ->
                DerivedFieldCalculator.recalculate(
                    task, TaskDelta.workHours(new BigDecimal("100000000000"))))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(
            () ->
                DerivedFieldCalculator.recalculate(
                    task, TaskDelta.workHours(new BigDecimal("1000000.1"))))
        .isInstanceOf(InvalidStateException.class);
  }
}
