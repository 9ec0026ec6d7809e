package io.b2mash.kpi.kpidashboard.config;

import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tunables for the derived-metrics engine.
 *
 * @param developmentRatio default share of new work hours given to development
 * @param testingRatio default share of new work hours given to testing
 * @param reviewRatio default share of new work hours given to review
 * @param sCurveBinDays width of one S-curve date bin in calendar days
 * @param defaultWeeklyCapacityHours capacity assigned to resources created without one
 * @param defaultLoadPeriods number of periods in the resource load window when none is requested
 */
@ConfigurationProperties(prefix = "kpi.engine")
public record EngineProperties(
    @DefaultValue("0.65") BigDecimal developmentRatio,
    @DefaultValue("0.25") BigDecimal testingRatio,
    @DefaultValue("0.10") BigDecimal reviewRatio,
    @DefaultValue("7") int sCurveBinDays,
    @DefaultValue("40") BigDecimal defaultWeeklyCapacityHours,
    @DefaultValue("8") int defaultLoadPeriods) {}
