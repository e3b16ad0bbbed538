package io.b2mash.sitediary.report;

import io.b2mash.sitediary.entry.DiaryEntryRepository;
import io.b2mash.sitediary.entry.DiaryEntryService;
import io.b2mash.sitediary.photo.PhotoRepository;
import io.b2mash.sitediary.project.Project;
import io.b2mash.sitediary.project.ProjectService;
import io.b2mash.sitediary.statistics.StatisticsService;
import java.text.Normalizer;
import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.thymeleaf.exceptions.TemplateEngineException;

/**
 * Orchestrates report generation: reads a consistent snapshot of the project, resolves photo
 * images, assembles the report model, renders HTML via Thymeleaf and converts it to PDF.
 */
@Service
public class SiteReportService {

  private static final Logger log = LoggerFactory.getLogger(SiteReportService.class);

  private final ProjectService projectService;
  private final DiaryEntryService diaryEntryService;
  private final DiaryEntryRepository diaryEntryRepository;
  private final PhotoRepository photoRepository;
  private final StatisticsService statisticsService;
  private final PhotoImageLoader photoImageLoader;
  private final SiteReportAssembler assembler;
  private final ReportHtmlRenderer htmlRenderer;
  private final PdfRenderingService pdfRenderingService;
  private final Clock clock;

  public SiteReportService(
      ProjectService projectService,
      DiaryEntryService diaryEntryService,
      DiaryEntryRepository diaryEntryRepository,
      PhotoRepository photoRepository,
      StatisticsService statisticsService,
      PhotoImageLoader photoImageLoader,
      SiteReportAssembler assembler,
      ReportHtmlRenderer htmlRenderer,
      PdfRenderingService pdfRenderingService,
      Clock clock) {
    this.projectService = projectService;
    this.diaryEntryService = diaryEntryService;
    this.diaryEntryRepository = diaryEntryRepository;
    this.photoRepository = photoRepository;
    this.statisticsService = statisticsService;
    this.photoImageLoader = photoImageLoader;
    this.assembler = assembler;
    this.htmlRenderer = htmlRenderer;
    this.pdfRenderingService = pdfRenderingService;
    this.clock = clock;
  }

  /** Model of the full project report. */
  @Transactional(readOnly = true)
  public SiteReport buildFullReport(UUID projectId) {
    var project = projectService.getProject(projectId);
    var entries = diaryEntryRepository.findByProjectIdOrderByDateAscCreatedAtAsc(projectId);
    var photos = photoRepository.findByProjectIdOrderByDateTakenAscCreatedAtAsc(projectId);
    var statistics = statisticsService.computeStatistics(project, entries, photos.size());
    return assembler.assembleFullReport(
        project, statistics, entries, photoImageLoader.resolveAll(photos));
  }

  @Transactional(readOnly = true)
  public String renderFullReportHtml(UUID projectId) {
    return htmlRenderer.render(buildFullReport(projectId));
  }

  /**
   * Renders the full project report as PDF.
   *
   * @throws io.b2mash.sitediary.exception.ResourceNotFoundException if the project is absent
   * @throws PdfGenerationException if the document cannot be produced
   */
  @Transactional(readOnly = true)
  public PdfResult renderFullReport(UUID projectId) {
    var report = buildFullReport(projectId);
    String html = renderForPdf(report);
    byte[] pdfBytes = pdfRenderingService.htmlToPdf(html);
    String fileName = fullReportFilename(report.projectName(), LocalDate.now(clock));

    log.info(
        "Generated PDF: report=full, project={}, entries={}, photos={}, size={}bytes",
        projectId,
        report.entries().size(),
        report.photos().size(),
        pdfBytes.length);
    return new PdfResult(pdfBytes, fileName, html);
  }

  /** Renders one entry as a standalone PDF. */
  @Transactional(readOnly = true)
  public PdfResult renderEntryReport(UUID projectId, UUID entryId) {
    var entry = diaryEntryService.getEntry(projectId, entryId);
    Project project = projectService.getProject(projectId);
    String html = renderForPdf(assembler.assembleEntryReport(project, entry));
    byte[] pdfBytes = pdfRenderingService.htmlToPdf(html);
    String fileName = entryReportFilename(project.getName(), entry.getDate());

    log.info(
        "Generated PDF: report=entry, project={}, entry={}, size={}bytes",
        projectId,
        entryId,
        pdfBytes.length);
    return new PdfResult(pdfBytes, fileName, html);
  }

  private String renderForPdf(SiteReport report) {
    try {
      return htmlRenderer.render(report);
    } catch (TemplateEngineException e) {
      throw new PdfGenerationException("Failed to render report template", e);
    }
  }

  static String fullReportFilename(String projectName, LocalDate today) {
    return safeName(projectName)
        + "_site_diary_"
        + today.format(ReportFormats.COMPACT_DATE)
        + ".pdf";
  }

  static String entryReportFilename(String projectName, LocalDate entryDate) {
    return safeName(projectName)
        + "_entry_"
        + entryDate.format(ReportFormats.COMPACT_DATE)
        + ".pdf";
  }

  private static String safeName(String name) {
    if (name == null || name.isBlank()) {
      return "project";
    }
    String ascii =
        Normalizer.normalize(name, Normalizer.Form.NFKD).replaceAll("[^\\p{ASCII}]", "");
    String safe = ascii.trim().replaceAll("\\s+", "_").replaceAll("[^A-Za-z0-9._-]", "");
    return safe.isEmpty() ? "project" : safe;
  }
}
