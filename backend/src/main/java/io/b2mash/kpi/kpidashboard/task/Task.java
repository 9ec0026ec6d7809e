package io.b2mash.kpi.kpidashboard.task;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Immutable task row. Writers derive a new instance through {@link #toBuilder()}; the store only
 * ever holds fully derived rows.
 *
 * <p>{@code workHours}, {@code percentComplete}, {@code startDate} and {@code finishDate} are
 * authoritative on leaves and derived on parents. {@code hoursCompleted}, {@code hoursRemaining},
 * {@code earnedValue} and {@code variance} are always derived.
 *
 * <p>{@code leafPlan} is set only on parents: the task's own plan from before it received its
 * first subtask, restored when the last subtask leaves.
 */
public record Task(
    UUID id,
    String name,
    String resource,
    BigDecimal workHours,
    BigDecimal baselineHours,
    int percentComplete,
    LocalDate startDate,
    LocalDate finishDate,
    UUID parentId,
    BigDecimal devHours,
    BigDecimal testHours,
    BigDecimal reviewHours,
    TaskPhase currentPhase,
    BigDecimal hoursCompleted,
    BigDecimal hoursRemaining,
    BigDecimal earnedValue,
    BigDecimal variance,
    Instant updatedAt,
    @JsonIgnore LeafPlan leafPlan) {

  /** Authoritative leaf inputs set aside while a task is a parent. */
  public record LeafPlan(
      BigDecimal workHours,
      BigDecimal baselineHours,
      int percentComplete,
      LocalDate startDate,
      LocalDate finishDate,
      BigDecimal devHours,
      BigDecimal testHours,
      BigDecimal reviewHours) {

    public static LeafPlan of(Task task) {
      return new LeafPlan(
          task.workHours(),
          task.baselineHours(),
          task.percentComplete(),
          task.startDate(),
          task.finishDate(),
          task.devHours(),
          task.testHours(),
          task.reviewHours());
    }
  }

  public boolean isComplete() {
    return percentComplete >= 100;
  }

  public BigDecimal phaseHours(TaskPhase phase) {
    return switch (phase) {
      case DEVELOPMENT -> devHours;
      case TESTING -> testHours;
      case REVIEW -> reviewHours;
    };
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private UUID id;
    private String name;
    private String resource;
    private BigDecimal workHours = BigDecimal.ZERO;
    private BigDecimal baselineHours = BigDecimal.ZERO;
    private int percentComplete;
    private LocalDate startDate;
    private LocalDate finishDate;
    private UUID parentId;
    private BigDecimal devHours = BigDecimal.ZERO;
    private BigDecimal testHours = BigDecimal.ZERO;
    private BigDecimal reviewHours = BigDecimal.ZERO;
    private TaskPhase currentPhase = TaskPhase.DEVELOPMENT;
    private BigDecimal hoursCompleted = BigDecimal.ZERO;
    private BigDecimal hoursRemaining = BigDecimal.ZERO;
    private BigDecimal earnedValue = BigDecimal.ZERO;
    private BigDecimal variance = BigDecimal.ZERO;
    private Instant updatedAt;
    private LeafPlan leafPlan;

    private Builder() {}

    private Builder(Task task) {
      this.id = task.id;
      this.name = task.name;
      this.resource = task.resource;
      this.workHours = task.workHours;
      this.baselineHours = task.baselineHours;
      this.percentComplete = task.percentComplete;
      this.startDate = task.startDate;
      this.finishDate = task.finishDate;
      this.parentId = task.parentId;
      this.devHours = task.devHours;
      this.testHours = task.testHours;
      this.reviewHours = task.reviewHours;
      this.currentPhase = task.currentPhase;
      this.hoursCompleted = task.hoursCompleted;
      this.hoursRemaining = task.hoursRemaining;
      this.earnedValue = task.earnedValue;
      this.variance = task.variance;
      this.updatedAt = task.updatedAt;
      this.leafPlan = task.leafPlan;
    }

    public Builder id(UUID id) {
      this.id = id;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder resource(String resource) {
      this.resource = resource;
      return this;
    }

    public Builder workHours(BigDecimal workHours) {
      this.workHours = workHours;
      return this;
    }

    public Builder baselineHours(BigDecimal baselineHours) {
      this.baselineHours = baselineHours;
      return this;
    }

    public Builder percentComplete(int percentComplete) {
      this.percentComplete = percentComplete;
      return this;
    }

    public Builder startDate(LocalDate startDate) {
      this.startDate = startDate;
      return this;
    }

    public Builder finishDate(LocalDate finishDate) {
      this.finishDate = finishDate;
      return this;
    }

    public Builder parentId(UUID parentId) {
      this.parentId = parentId;
      return this;
    }

    public Builder devHours(BigDecimal devHours) {
      this.devHours = devHours;
      return this;
    }

    public Builder testHours(BigDecimal testHours) {
      this.testHours = testHours;
      return this;
    }

    public Builder reviewHours(BigDecimal reviewHours) {
      this.reviewHours = reviewHours;
      return this;
    }

    public Builder currentPhase(TaskPhase currentPhase) {
      this.currentPhase = currentPhase;
      return this;
    }

    public Builder hoursCompleted(BigDecimal hoursCompleted) {
      this.hoursCompleted = hoursCompleted;
      return this;
    }

    public Builder hoursRemaining(BigDecimal hoursRemaining) {
      this.hoursRemaining = hoursRemaining;
      return this;
    }

    public Builder earnedValue(BigDecimal earnedValue) {
      this.earnedValue = earnedValue;
      return this;
    }

    public Builder variance(BigDecimal variance) {
      this.variance = variance;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public Builder leafPlan(LeafPlan leafPlan) {
      this.leafPlan = leafPlan;
      return this;
    }

    public Task build() {
      return new Task(
          id,
          name,
          resource,
          workHours,
          baselineHours,
          percentComplete,
          startDate,
          finishDate,
          parentId,
          devHours,
          testHours,
          reviewHours,
          currentPhase,
          hoursCompleted,
          hoursRemaining,
          earnedValue,
          variance,
          updatedAt,
          leafPlan);
    }
  }
}
