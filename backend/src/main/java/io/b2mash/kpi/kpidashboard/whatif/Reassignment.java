package io.b2mash.kpi.kpidashboard.whatif;

import java.math.BigDecimal;
import java.util.UUID;

/** One orphaned task placed on another resource by a removal simulation. */
public record Reassignment(UUID taskId, String task, String from, String to, BigDecimal hours) {}
