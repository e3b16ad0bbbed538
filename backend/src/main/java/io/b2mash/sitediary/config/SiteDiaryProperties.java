package io.b2mash.sitediary.config;

import java.util.UUID;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Application settings under {@code sitediary.*}.
 *
 * @param defaultProjectId project served by {@code GET /api/project}; optional
 * @param currencySymbol suffix for cost amounts in reports
 * @param completionPlaceholder completion percentage reported in statistics; not derived
 * @param projectDefaults values used for fields omitted when a project is created
 */
@ConfigurationProperties("sitediary")
public record SiteDiaryProperties(
    UUID defaultProjectId,
    @DefaultValue("€") String currencySymbol,
    @DefaultValue("65") int completionPlaceholder,
    @DefaultValue ProjectDefaults projectDefaults) {

  public record ProjectDefaults(
      @DefaultValue("My construction project") String name,
      @DefaultValue("Unknown builder") String builderName,
      @DefaultValue("In progress") String status) {}
}
