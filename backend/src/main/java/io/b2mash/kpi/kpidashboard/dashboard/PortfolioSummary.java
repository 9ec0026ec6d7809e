package io.b2mash.kpi.kpidashboard.dashboard;

import java.math.BigDecimal;

/**
 * Headline KPIs over the leaf tasks of the portfolio.
 *
 * @param averagePercentComplete unweighted mean of leaf percent complete, one decimal
 */
public record PortfolioSummary(
    int taskCount,
    BigDecimal totalWorkHours,
    BigDecimal totalBaselineHours,
    BigDecimal totalVariance,
    double averagePercentComplete,
    BigDecimal hoursCompleted,
    BigDecimal hoursRemaining,
    BigDecimal earnedValue) {}
