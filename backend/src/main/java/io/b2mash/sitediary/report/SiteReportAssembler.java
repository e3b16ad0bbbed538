package io.b2mash.sitediary.report;

import io.b2mash.sitediary.config.SiteDiaryProperties;
import io.b2mash.sitediary.entry.DiaryEntry;
import io.b2mash.sitediary.photo.Photo;
import io.b2mash.sitediary.project.Project;
import io.b2mash.sitediary.report.SiteReport.EntrySection;
import io.b2mash.sitediary.report.SiteReport.PhotoCaption;
import io.b2mash.sitediary.report.SiteReport.PhotoSection;
import io.b2mash.sitediary.report.SiteReport.ReportRow;
import io.b2mash.sitediary.statistics.ProjectStatistics;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link SiteReport} model from loaded records. Decides every block, row and page
 * break; rendering only turns the model into markup.
 */
@Component
public class SiteReportAssembler {

  static final String TITLE = "Construction Site Diary";
  static final String NO_DESCRIPTION = "No description";
  static final int ENTRIES_PER_PAGE = 3;
  static final int PHOTOS_PER_PAGE = 4;

  private final String currencySymbol;

  public SiteReportAssembler(SiteDiaryProperties properties) {
    this.currencySymbol = properties.currencySymbol();
  }

  /**
   * Full project report.
   *
   * @param entries in ascending date order
   * @param photos in ascending date-taken order
   */
  public SiteReport assembleFullReport(
      Project project,
      ProjectStatistics statistics,
      List<DiaryEntry> entries,
      List<ResolvedPhoto> photos) {
    var entrySections = new ArrayList<EntrySection>(entries.size());
    for (int i = 0; i < entries.size(); i++) {
      int number = i + 1;
      var entry = entries.get(i);
      entrySections.add(
          entrySection(
              "Entry " + number + ": " + ReportFormats.date(entry.getDate()),
              entry,
              breakAfter(number, ENTRIES_PER_PAGE, entries.size())));
    }

    var photoSections = new ArrayList<PhotoSection>(photos.size());
    for (int i = 0; i < photos.size(); i++) {
      int number = i + 1;
      var resolved = photos.get(i);
      photoSections.add(
          new PhotoSection(
              caption(resolved.photo()),
              resolved.outcome(),
              breakAfter(number, PHOTOS_PER_PAGE, photos.size())));
    }

    return new SiteReport(
        TITLE,
        project.getName(),
        projectInfo(project),
        statisticsRows(statistics),
        List.copyOf(entrySections),
        List.copyOf(photoSections));
  }

  /** Standalone report for one entry: no project table, statistics, numbering or photos. */
  public SiteReport assembleEntryReport(Project project, DiaryEntry entry) {
    var section = entrySection("Entry: " + ReportFormats.date(entry.getDate()), entry, false);
    return new SiteReport(
        TITLE, project.getName(), List.of(), List.of(), List.of(section), List.of());
  }

  /** A break follows every {@code perPage}-th item except the last one. */
  static boolean breakAfter(int number, int perPage, int total) {
    return number % perPage == 0 && number < total;
  }

  private List<ReportRow> projectInfo(Project project) {
    String description = project.getDescription();
    return List.of(
        new ReportRow("Project name", project.getName()),
        new ReportRow("Builder", project.getBuilderName()),
        new ReportRow("Start date", ReportFormats.date(project.getStartDate())),
        new ReportRow("Status", project.getStatus()),
        new ReportRow(
            "Description",
            description == null || description.isBlank() ? NO_DESCRIPTION : description));
  }

  private List<ReportRow> statisticsRows(ProjectStatistics statistics) {
    return List.of(
        new ReportRow("Entries", String.valueOf(statistics.totalEntries())),
        new ReportRow("Photos", String.valueOf(statistics.totalPhotos())),
        new ReportRow("Project days", String.valueOf(statistics.projectDays())),
        new ReportRow("Total costs", ReportFormats.money(statistics.totalCosts(), currencySymbol)),
        new ReportRow("Total hours", ReportFormats.hours(statistics.totalHours())),
        new ReportRow("Completion", statistics.completionPercent() + " %"));
  }

  private EntrySection entrySection(String heading, DiaryEntry entry, boolean pageBreakAfter) {
    var details = new ArrayList<ReportRow>();
    if (hasText(entry.getWeather())) {
      details.add(new ReportRow("Weather", entry.getWeather()));
    }
    if (entry.getTemperature() != null) {
      details.add(new ReportRow("Temperature", ReportFormats.temperature(entry.getTemperature())));
    }
    if (entry.getWorkersCount() != null) {
      details.add(new ReportRow("Workers", String.valueOf(entry.getWorkersCount())));
    }
    if (entry.getWorkHours() != null) {
      details.add(new ReportRow("Work hours", ReportFormats.hours(entry.getWorkHours())));
    }
    if (entry.getCosts() != null) {
      details.add(new ReportRow("Costs", ReportFormats.money(entry.getCosts(), currencySymbol)));
    }
    return new EntrySection(
        heading,
        List.copyOf(details),
        entry.getContent(),
        hasText(entry.getMaterials()) ? entry.getMaterials() : null,
        hasText(entry.getNotes()) ? entry.getNotes() : null,
        pageBreakAfter);
  }

  private static PhotoCaption caption(Photo photo) {
    return new PhotoCaption(
        photo.getOriginalFilename(),
        ReportFormats.date(photo.getDateTaken()),
        hasText(photo.getDescription()) ? photo.getDescription() : null);
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
