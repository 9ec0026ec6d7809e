package io.b2mash.kpi.kpidashboard.baseline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import java.util.Locale;

public enum BaselineType {
  INITIAL,
  MONTHLY,
  MANUAL;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static BaselineType fromValue(String raw) {
    for (BaselineType type : values()) {
      if (type.value().equalsIgnoreCase(raw)) {
        return type;
      }
    }
    throw new InvalidStateException(
        "Invalid baseline type",
        "Baseline type must be one of [initial, monthly, manual], but got: '" + raw + "'");
  }
}
