package io.b2mash.kpi.kpidashboard.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import java.util.Arrays;
import java.util.Locale;

/** Reporting phase of a task. There is no automatic transition between phases. */
public enum TaskPhase {
  DEVELOPMENT("development", "dev"),
  TESTING("testing", "test"),
  REVIEW("review", "review");

  private final String value;
  private final String shortName;

  TaskPhase(String value, String shortName) {
    this.value = value;
    this.shortName = shortName;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Accepts the full phase name or its short form ({@code dev}, {@code test}), any case. */
  @JsonCreator
  public static TaskPhase fromValue(String raw) {
    if (raw != null) {
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      for (TaskPhase phase : values()) {
        if (phase.value.equals(normalized) || phase.shortName.equals(normalized)) {
          return phase;
        }
      }
    }
    throw new InvalidStateException(
        "Invalid phase",
        "Phase must be one of "
            + Arrays.stream(values()).map(TaskPhase::value).toList()
            + ", but got: '"
            + raw
            + "'");
  }
}
