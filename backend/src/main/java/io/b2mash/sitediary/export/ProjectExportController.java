package io.b2mash.sitediary.export;

import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProjectExportController {

  private final ProjectExportService projectExportService;

  public ProjectExportController(ProjectExportService projectExportService) {
    this.projectExportService = projectExportService;
  }

  @GetMapping("/api/projects/{projectId}/export")
  public ResponseEntity<ProjectExport> exportProject(@PathVariable UUID projectId) {
    return ResponseEntity.ok(projectExportService.exportProject(projectId));
  }
}
