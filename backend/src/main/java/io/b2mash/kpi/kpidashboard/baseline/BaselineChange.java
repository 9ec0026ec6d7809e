package io.b2mash.kpi.kpidashboard.baseline;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum BaselineChange {
  CHANGED,
  UNCHANGED,
  ADDED,
  REMOVED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
