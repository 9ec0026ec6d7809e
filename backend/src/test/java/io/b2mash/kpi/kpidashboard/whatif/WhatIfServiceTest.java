package io.b2mash.kpi.kpidashboard.whatif;

import static io.b2mash.kpi.kpidashboard.TestTasks.child;
import static io.b2mash.kpi.kpidashboard.TestTasks.leaf;
import static io.b2mash.kpi.kpidashboard.TestTasks.parent;
import static io.b2mash.kpi.kpidashboard.TestTasks.resource;
import static io.b2mash.kpi.kpidashboard.TestTasks.store;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import io.b2mash.kpi.kpidashboard.store.TaskStore;
import io.b2mash.kpi.kpidashboard.task.Task;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WhatIfServiceTest {

  private static final LocalDate MAR_3 = LocalDate.of(2025, 3, 3);

  private TaskStore taskStore;
  private WhatIfService whatIfService;
  private Task story;

  @BeforeEach
  void setUp() {
    var epic = parent("Epic", MAR_3);
    story = child(epic.id(), "Story", "Alice", "100", "100", 50, MAR_3, LocalDate.of(2025, 3, 28));
    var other = leaf("Other", "Bob", "20", "20", 0, MAR_3, LocalDate.of(2025, 3, 14));
    taskStore =
        spy(store(List.of(resource("Alice", "40"), resource("Bob", "40")), epic, story, other));
    whatIfService = new WhatIfService(taskStore);
  }

  @Test
  void simulationsNeverWriteToTheStore() {
    var before = taskStore.snapshot();
    var tasksBefore = List.copyOf(before.tasks());

    whatIfService.removeResource("Alice", true);
    whatIfService.slipSchedule(4);
    whatIfService.addHours(story.id(), new BigDecimal("40"));

    verify(taskStore, never()).inTransaction(any());
    assertThat(taskStore.snapshot()).isSameAs(before);
    assertThat(List.copyOf(taskStore.snapshot().tasks())).isEqualTo(tasksBefore);
  }

  @Test
  void failedSimulationLeavesStoreUntouched() {
    var before = taskStore.snapshot();

    assertThatThrownBy(() -> whatIfService.addHours(story.id(), new BigDecimal("-100")))
        .isInstanceOf(InvalidStateException.class);

    verify(taskStore, never()).inTransaction(any());
    assertThat(taskStore.snapshot()).isSameAs(before);
  }
}
