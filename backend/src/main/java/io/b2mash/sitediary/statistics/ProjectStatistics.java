package io.b2mash.sitediary.statistics;

import java.math.BigDecimal;

/**
 * Summary figures for one project.
 *
 * @param completionPercent configured placeholder, not derived from project data
 */
public record ProjectStatistics(
    long totalEntries,
    long totalPhotos,
    long projectDays,
    BigDecimal totalCosts,
    BigDecimal totalHours,
    int completionPercent) {}
