package io.b2mash.sitediary.report;

import java.util.List;

/**
 * Structural model of a rendered report: every text, table row and page break of the document,
 * independent of HTML or PDF. Two renders of the same data produce equal models.
 *
 * @param projectInfo project label/value rows; empty for single-entry reports
 * @param statistics statistics label/value rows; empty for single-entry reports. A page break
 *     always follows a non-empty statistics block
 * @param photos photo blocks; when non-empty, a page break precedes the section
 */
public record SiteReport(
    String title,
    String projectName,
    List<ReportRow> projectInfo,
    List<ReportRow> statistics,
    List<EntrySection> entries,
    List<PhotoSection> photos) {

  public boolean hasProjectInfo() {
    return !projectInfo.isEmpty();
  }

  public boolean hasStatistics() {
    return !statistics.isEmpty();
  }

  public boolean hasEntries() {
    return !entries.isEmpty();
  }

  public boolean hasPhotos() {
    return !photos.isEmpty();
  }

  /** One row of a two-column label/value table. */
  public record ReportRow(String label, String value) {}

  /**
   * One diary entry.
   *
   * @param details rows for the optional fields that are present, in display order
   * @param materials {@code null} when the entry has none
   * @param notes {@code null} when the entry has none
   */
  public record EntrySection(
      String heading,
      List<ReportRow> details,
      String content,
      String materials,
      String notes,
      boolean pageBreakAfter) {

    public boolean hasDetails() {
      return !details.isEmpty();
    }
  }

  /** Caption shown next to a photo, or in place of it when the image is unavailable. */
  public record PhotoCaption(String filename, String dateTaken, String description) {}

  public record PhotoSection(PhotoCaption caption, PhotoOutcome outcome, boolean pageBreakAfter) {}
}
