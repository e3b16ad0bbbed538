package io.b2mash.sitediary.export;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/** Portable JSON snapshot of a project without database identifiers. */
public record ProjectExport(
    ProjectData project, List<EntryData> entries, List<PhotoData> photos) {

  public record ProjectData(
      String name, String builderName, LocalDate startDate, String status, String description) {}

  public record EntryData(
      LocalDate date,
      String weather,
      BigDecimal temperature,
      String content,
      Integer workersCount,
      String materials,
      BigDecimal workHours,
      BigDecimal costs,
      String notes) {}

  /** Photos are exported by their original filename; image files are not included. */
  public record PhotoData(String filename, String description, LocalDate dateTaken) {}
}
