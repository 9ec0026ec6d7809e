package io.b2mash.kpi.kpidashboard.phase;

import static io.b2mash.kpi.kpidashboard.TestTasks.leaf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import io.b2mash.kpi.kpidashboard.task.Task;
import io.b2mash.kpi.kpidashboard.task.TaskPhase;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class PhaseDistributorTest {

  private static final LocalDate MAR_3 = LocalDate.of(2025, 3, 3);

  @Test
  void initialSplitUsesDefaultRatios() {
    var task = leaf("Feature", null, "100", "100", 0, MAR_3, MAR_3);

    assertThat(task.devHours()).isEqualByComparingTo("65");
    assertThat(task.testHours()).isEqualByComparingTo("25");
    assertThat(task.reviewHours()).isEqualByComparingTo("10");
  }

  @Test
  void initialSplitKeepsPhaseSumEqualToWork() {
    var task = leaf("Feature", null, "33.3", "33.3", 0, MAR_3, MAR_3);

    assertThat(task.devHours()).isEqualByComparingTo("21.6");
    assertThat(task.testHours()).isEqualByComparingTo("8.3");
    assertThat(phaseSum(task)).isEqualByComparingTo("33.3");
  }

  @Test
  void initialSplitHonoursGivenRatios() {
    var ratios =
        new PhaseRatios(new BigDecimal("0.5"), new BigDecimal("0.3"), new BigDecimal("0.2"));
    var draft = Task.builder().name("Feature").build();

    var task = PhaseDistributor.initialSplit(draft, new BigDecimal("40"), ratios);

    assertThat(task.devHours()).isEqualByComparingTo("20");
    assertThat(task.testHours()).isEqualByComparingTo("12");
    assertThat(task.reviewHours()).isEqualByComparingTo("8");
  }

  @Test
  void proportionalRescaleMultipliesEveryPhase() {
    var task = leaf("Feature", null, "100", "100", 0, MAR_3, MAR_3);

    var result = PhaseDistributor.rescaleProportional(task, new BigDecimal("150"));

    assertThat(result.workHours()).isEqualByComparingTo("150");
    assertThat(result.devHours()).isEqualByComparingTo("97.5");
    assertThat(result.testHours()).isEqualByComparingTo("37.5");
    assertThat(result.reviewHours()).isEqualByComparingTo("15");
  }

  @Test
  void proportionalRescaleAbsorbsRoundingInLastPhase() {
    var task = leaf("Feature", null, "100", "100", 0, MAR_3, MAR_3);

    var result = PhaseDistributor.rescaleProportional(task, new BigDecimal("33.3"));

    assertThat(phaseSum(result)).isEqualByComparingTo("33.3");
    assertThat(result.reviewHours().signum()).isNotNegative();
  }

  @Test
  void addToPhaseGrowsOnlyThatPhaseAndWork() {
    var task = leaf("Feature", null, "100", "100", 0, MAR_3, MAR_3);

    var result = PhaseDistributor.addToPhase(task, TaskPhase.TESTING, new BigDecimal("20"));

    assertThat(result.testHours()).isEqualByComparingTo("45");
    assertThat(result.devHours()).isEqualByComparingTo("65");
    assertThat(result.reviewHours()).isEqualByComparingTo("10");
    assertThat(result.workHours()).isEqualByComparingTo("120");
  }

  @Test
  void targetedRescaleAddsTheWholeDeltaToOnePhase() {
    var task = leaf("Feature", null, "100", "100", 0, MAR_3, MAR_3);

    var result =
        PhaseDistributor.rescale(
            task, new BigDecimal("110"), PhaseRescale.targeted(TaskPhase.REVIEW));

    assertThat(result.reviewHours()).isEqualByComparingTo("20");
    assertThat(result.workHours()).isEqualByComparingTo("110");
  }

  @Test
  void addToPhaseRejectsNegativeResult() {
    var task = leaf("Feature", null, "100", "100", 0, MAR_3, MAR_3);

    assertThatThrownBy(
            () -> PhaseDistributor.addToPhase(task, TaskPhase.REVIEW, new BigDecimal("-11")))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void setPhaseHoursMakesWorkTheSum() {
    var task = leaf("Feature", null, "100", "100", 0, MAR_3, MAR_3);

    var result =
        PhaseDistributor.setPhaseHours(task, new BigDecimal("50"), null, new BigDecimal("5"));

    assertThat(result.workHours()).isEqualByComparingTo("80");
  }

  @Test
  void ratiosMustAddUpToOne() {
    assertThatThrownBy(
            () ->
                new PhaseRatios(
                    new BigDecimal("0.7"), new BigDecimal("0.3"), new BigDecimal("0.1")))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void parsesRescaleRequestForms() {
    assertThat(PhaseRescale.parse("proportional")).isEqualTo(PhaseRescale.proportional());
    assertThat(PhaseRescale.parse("targeted:test").phase()).isEqualTo(TaskPhase.TESTING);
    assertThat(PhaseRescale.parse(" ")).isNull();
    assertThatThrownBy(() -> PhaseRescale.parse("sideways"))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> PhaseRescale.parse("targeted:deploy"))
        .isInstanceOf(InvalidStateException.class);
  }

  private static BigDecimal phaseSum(Task task) {
    return task.devHours().add(task.testHours()).add(task.reviewHours());
  }
}
