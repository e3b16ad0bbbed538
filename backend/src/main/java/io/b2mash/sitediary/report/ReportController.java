package io.b2mash.sitediary.report;

import java.util.UUID;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ReportController {

  private final SiteReportService siteReportService;

  public ReportController(SiteReportService siteReportService) {
    this.siteReportService = siteReportService;
  }

  @GetMapping("/api/projects/{projectId}/report/pdf")
  public ResponseEntity<byte[]> exportProjectReport(@PathVariable UUID projectId) {
    return pdfAttachment(siteReportService.renderFullReport(projectId));
  }

  @GetMapping("/api/projects/{projectId}/report/preview")
  public ResponseEntity<String> previewProjectReport(@PathVariable UUID projectId) {
    String html = siteReportService.renderFullReportHtml(projectId);
    return ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body(html);
  }

  @GetMapping("/api/projects/{projectId}/entries/{entryId}/report/pdf")
  public ResponseEntity<byte[]> exportEntryReport(
      @PathVariable UUID projectId, @PathVariable UUID entryId) {
    return pdfAttachment(siteReportService.renderEntryReport(projectId, entryId));
  }

  private static ResponseEntity<byte[]> pdfAttachment(PdfResult result) {
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_PDF)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(result.fileName()).build().toString())
        .body(result.pdfBytes());
  }
}
