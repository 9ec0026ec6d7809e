package io.b2mash.kpi.kpidashboard.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.kpi.kpidashboard.config.EngineProperties;
import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import io.b2mash.kpi.kpidashboard.exception.ResourceConflictException;
import io.b2mash.kpi.kpidashboard.exception.ResourceNotFoundException;
import io.b2mash.kpi.kpidashboard.store.InMemoryTaskStore;
import io.b2mash.kpi.kpidashboard.task.TaskPhase;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResourceServiceTest {

  private ResourceService resourceService;

  @BeforeEach
  void setUp() {
    var properties =
        new EngineProperties(
            new BigDecimal("0.65"),
            new BigDecimal("0.25"),
            new BigDecimal("0.10"),
            7,
            new BigDecimal("40"),
            8);
    resourceService = new ResourceService(new InMemoryTaskStore(), properties);
  }

  @Test
  void createsResourceWithConfiguredDefaults() {
    var alice = resourceService.createResource("Alice", null, null);

    assertThat(alice.capacityHoursPerWeek()).isEqualByComparingTo("40");
    assertThat(alice.active()).isTrue();
    assertThat(alice.leadPreference().mode()).isEqualTo(AdjustmentMode.ASK);
    assertThat(alice.leadPreference().defaultRescale()).isEmpty();
  }

  @Test
  void rejectsDuplicateNameAndNonPositiveCapacity() {
    resourceService.createResource("Alice", null, null);

    assertThatThrownBy(() -> resourceService.createResource("Alice", null, null))
        .isInstanceOf(ResourceConflictException.class);
    assertThatThrownBy(() -> resourceService.createResource("Bob", BigDecimal.ZERO, null))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void updateKeepsUnspecifiedValues() {
    resourceService.createResource("Alice", new BigDecimal("32"), null);
    var preference = new LeadPreference(AdjustmentMode.TARGETED_PHASE, TaskPhase.REVIEW, null);

    var updated = resourceService.updateResource("Alice", null, false, preference);

    assertThat(updated.capacityHoursPerWeek()).isEqualByComparingTo("32");
    assertThat(updated.active()).isFalse();
    assertThat(updated.leadPreference().defaultRescale()).isPresent();
    assertThat(updated.leadPreference().defaultRescale().get().phase())
        .isEqualTo(TaskPhase.REVIEW);
  }

  @Test
  void updatingUnknownResourceIsNotFound() {
    assertThatThrownBy(() -> resourceService.updateResource("Zed", BigDecimal.TEN, null, null))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void targetedPreferenceNeedsAPhase() {
    assertThatThrownBy(() -> new LeadPreference(AdjustmentMode.TARGETED_PHASE, null, null))
        .isInstanceOf(InvalidStateException.class);
  }
}
