package io.b2mash.kpi.kpidashboard.baseline;

import static io.b2mash.kpi.kpidashboard.TestTasks.child;
import static io.b2mash.kpi.kpidashboard.TestTasks.leaf;
import static io.b2mash.kpi.kpidashboard.TestTasks.parent;
import static io.b2mash.kpi.kpidashboard.TestTasks.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.b2mash.kpi.kpidashboard.schedule.DerivedFieldCalculator;
import io.b2mash.kpi.kpidashboard.schedule.TaskDelta;
import io.b2mash.kpi.kpidashboard.store.TaskSnapshot;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class BaselineComparatorTest {

  private static final LocalDate MAR_3 = LocalDate.of(2025, 3, 3);
  private static final LocalDate MAR_14 = LocalDate.of(2025, 3, 14);

  @Test
  void captureFlagsRollups() {
    var epic = parent("Epic", MAR_3);
    var story = child(epic.id(), "Story", null, "40", "40", 0, MAR_3, MAR_14);
    var view = snapshot(List.of(), epic, story);

    var captures = BaselineComparator.capture(view);

    assertThat(captures.get(epic.id()).rollup()).isTrue();
    assertThat(captures.get(story.id()).rollup()).isFalse();
    assertThat(captures.get(story.id()).workHours()).isEqualByComparingTo("40");
  }

  @Test
  void reportsDeltasAndSlipForChangedTasks() {
    var task = leaf("Build", null, "100", "100", 10, MAR_3, MAR_14);
    var baseline = baselineOf(snapshot(List.of(), task));
    var grown =
        DerivedFieldCalculator.recalculate(
            task, new TaskDelta(new BigDecimal("120"), 40, null, LocalDate.of(2025, 3, 21)));

    var comparison = BaselineComparator.compare(baseline, snapshot(List.of(), grown));

    var row = comparison.tasks().get(0);
    assertThat(row.change()).isEqualTo(BaselineChange.CHANGED);
    assertThat(row.hoursDelta()).isEqualByComparingTo("20");
    assertThat(row.pctDelta()).isEqualTo(30);
    assertThat(row.varianceDelta()).isEqualByComparingTo("20");
    assertThat(row.scheduleSlipDays()).isEqualTo(7L);
    assertThat(comparison.summary().tasksChanged()).isEqualTo(1);
    assertThat(comparison.summary().hoursDelta()).isEqualByComparingTo("20");
  }

  @Test
  void untouchedTaskIsUnchanged() {
    var task = leaf("Build", null, "100", "100", 10, MAR_3, MAR_14);
    var view = snapshot(List.of(), task);

    var comparison = BaselineComparator.compare(baselineOf(view), view);

    assertThat(comparison.tasks().get(0).change()).isEqualTo(BaselineChange.UNCHANGED);
    assertThat(comparison.tasks().get(0).scheduleSlipDays()).isZero();
    assertThat(comparison.summary().tasksChanged()).isZero();
  }

  @Test
  void addedAndRemovedTasksHaveNullDeltas() {
    var kept = leaf("Kept", null, "10", "10", 0, MAR_3, MAR_14);
    var dropped = leaf("Dropped", null, "20", "20", 0, MAR_3, MAR_14);
    var baseline = baselineOf(snapshot(List.of(), kept, dropped));
    var added = leaf("Added", null, "5", "5", 0, MAR_3, MAR_14);

    var comparison = BaselineComparator.compare(baseline, snapshot(List.of(), kept, added));

    assertThat(comparison.tasks())
        .extracting(TaskComparison::task, TaskComparison::change)
        .containsExactly(
            tuple("Kept", BaselineChange.UNCHANGED),
            tuple("Added", BaselineChange.ADDED),
            tuple("Dropped", BaselineChange.REMOVED));
    var removed = comparison.tasks().get(2);
    assertThat(removed.hoursDelta()).isNull();
    assertThat(removed.pctDelta()).isNull();
    assertThat(removed.scheduleSlipDays()).isNull();
    assertThat(comparison.summary().tasksAdded()).isEqualTo(1);
    assertThat(comparison.summary().tasksRemoved()).isEqualTo(1);
  }

  @Test
  void totalsCountLeavesOnly() {
    var epic = parent("Epic", MAR_3);
    var first = child(epic.id(), "First", null, "40", "40", 0, MAR_3, MAR_14);
    var second = child(epic.id(), "Second", null, "60", "60", 0, MAR_3, MAR_14);
    var view = snapshot(List.of(), epic, first, second);

    var comparison = BaselineComparator.compare(baselineOf(view), view);

    assertThat(comparison.summary().totalCurrentHours()).isEqualByComparingTo("100");
    assertThat(comparison.summary().totalBaselineHours()).isEqualByComparingTo("100");
  }

  private static BaselineSnapshot baselineOf(TaskSnapshot snapshot) {
    return new BaselineSnapshot(
        UUID.randomUUID(),
        "Kickoff",
        BaselineType.INITIAL,
        Instant.parse("2025-03-01T00:00:00Z"),
        BaselineComparator.capture(snapshot));
  }
}
