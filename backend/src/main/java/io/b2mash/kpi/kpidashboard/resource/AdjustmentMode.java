package io.b2mash.kpi.kpidashboard.resource;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import java.util.Locale;

/** A lead's standing answer to "where do extra work hours go?". */
public enum AdjustmentMode {
  ASK,
  TARGETED_PHASE,
  PROPORTIONAL;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static AdjustmentMode fromValue(String raw) {
    for (AdjustmentMode mode : values()) {
      if (mode.value().equalsIgnoreCase(raw)) {
        return mode;
      }
    }
    throw new InvalidStateException(
        "Invalid adjustment mode",
        "Adjustment mode must be one of [ask, targeted_phase, proportional], but got: '"
            + raw
            + "'");
  }
}
