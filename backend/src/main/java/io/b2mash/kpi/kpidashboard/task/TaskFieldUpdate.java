package io.b2mash.kpi.kpidashboard.task;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Payload of {@code apply-field-update}. Null components are left untouched. A blank {@code
 * resource} unassigns the task; {@code detachFromParent} moves it to the top level.
 *
 * <p>{@code baselineHours}, {@code hoursCompleted}, {@code hoursRemaining}, {@code earnedValue} and
 * {@code variance} are accepted only so that attempts to edit them can be rejected by name.
 */
public record TaskFieldUpdate(
    String name,
    String resource,
    BigDecimal workHours,
    Integer percentComplete,
    LocalDate startDate,
    LocalDate finishDate,
    UUID parentId,
    Boolean detachFromParent,
    TaskPhase currentPhase,
    BigDecimal devHours,
    BigDecimal testHours,
    BigDecimal reviewHours,
    BigDecimal baselineHours,
    BigDecimal hoursCompleted,
    BigDecimal hoursRemaining,
    BigDecimal earnedValue,
    BigDecimal variance) {

  /** Fields no caller may write directly, in request naming. */
  public List<String> readOnlyFieldsPresent() {
    var fields = new ArrayList<String>();
    if (baselineHours != null) fields.add("baselineHours");
    if (hoursCompleted != null) fields.add("hoursCompleted");
    if (hoursRemaining != null) fields.add("hoursRemaining");
    if (earnedValue != null) fields.add("earnedValue");
    if (variance != null) fields.add("variance");
    return fields;
  }

  /** Fields a parent derives from its children, in request naming. */
  public List<String> rollupFieldsPresent() {
    var fields = new ArrayList<String>();
    if (workHours != null) fields.add("workHours");
    if (percentComplete != null) fields.add("percentComplete");
    if (startDate != null) fields.add("startDate");
    if (finishDate != null) fields.add("finishDate");
    if (devHours != null) fields.add("devHours");
    if (testHours != null) fields.add("testHours");
    if (reviewHours != null) fields.add("reviewHours");
    return fields;
  }

  /** True when the payload names no field at all. */
  public boolean isEmpty() {
    return name == null
        && resource == null
        && parentId == null
        && detachFromParent == null
        && currentPhase == null
        && readOnlyFieldsPresent().isEmpty()
        && rollupFieldsPresent().isEmpty();
  }

  public boolean touchesPhaseHours() {
    return devHours != null || testHours != null || reviewHours != null;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private String name;
    private String resource;
    private BigDecimal workHours;
    private Integer percentComplete;
    private LocalDate startDate;
    private LocalDate finishDate;
    private UUID parentId;
    private Boolean detachFromParent;
    private TaskPhase currentPhase;
    private BigDecimal devHours;
    private BigDecimal testHours;
    private BigDecimal reviewHours;
    private BigDecimal baselineHours;
    private BigDecimal hoursCompleted;

    private Builder() {}

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

    public Builder detachFromParent() {
      this.detachFromParent = Boolean.TRUE;
      return this;
    }

    public Builder currentPhase(TaskPhase currentPhase) {
      this.currentPhase = currentPhase;
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

    public Builder baselineHours(BigDecimal baselineHours) {
      this.baselineHours = baselineHours;
      return this;
    }

    public Builder hoursCompleted(BigDecimal hoursCompleted) {
      this.hoursCompleted = hoursCompleted;
      return this;
    }

    public TaskFieldUpdate build() {
      return new TaskFieldUpdate(
          name,
          resource,
          workHours,
          percentComplete,
          startDate,
          finishDate,
          parentId,
          detachFromParent,
          currentPhase,
          devHours,
          testHours,
          reviewHours,
          baselineHours,
          hoursCompleted,
          null,
          null,
          null);
    }
  }
}
