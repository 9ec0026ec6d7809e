package io.b2mash.kpi.kpidashboard.dependency;

import java.time.Instant;
import java.util.UUID;

public record Dependency(
    UUID id,
    UUID predecessorId,
    UUID successorId,
    DependencyType type,
    int lagDays,
    Instant createdAt) {}
