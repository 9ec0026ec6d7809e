package io.b2mash.kpi.kpidashboard.baseline;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** Named, immutable capture of every task at one instant. */
public record BaselineSnapshot(
    UUID id, String name, BaselineType type, Instant capturedAt, Map<UUID, TaskCapture> tasks) {

  public BaselineSnapshot {
    tasks = Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
  }
}
