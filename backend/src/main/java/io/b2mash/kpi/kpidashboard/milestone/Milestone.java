package io.b2mash.kpi.kpidashboard.milestone;

import java.time.LocalDate;
import java.util.UUID;

public record Milestone(UUID id, String name, LocalDate date, String color, String description) {}
