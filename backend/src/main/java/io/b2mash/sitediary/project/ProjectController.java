package io.b2mash.sitediary.project;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProjectController {

  private final ProjectService projectService;

  public ProjectController(ProjectService projectService) {
    this.projectService = projectService;
  }

  @PostMapping("/api/projects")
  public ResponseEntity<ProjectResponse> createProject(
      @Valid @RequestBody ProjectRequest request) {
    var project =
        projectService.createProject(
            request.name(),
            request.builderName(),
            request.startDate(),
            request.status(),
            request.description());
    return ResponseEntity.created(URI.create("/api/projects/" + project.getId()))
        .body(ProjectResponse.from(project));
  }

  @GetMapping("/api/projects")
  public ResponseEntity<List<ProjectResponse>> listProjects() {
    return ResponseEntity.ok(
        projectService.listProjects().stream().map(ProjectResponse::from).toList());
  }

  @GetMapping("/api/projects/{projectId}")
  public ResponseEntity<ProjectResponse> getProject(@PathVariable UUID projectId) {
    return ResponseEntity.ok(ProjectResponse.from(projectService.getProject(projectId)));
  }

  @GetMapping("/api/project")
  public ResponseEntity<ProjectResponse> getDefaultProject() {
    return ResponseEntity.ok(ProjectResponse.from(projectService.getDefaultProject()));
  }

  @PutMapping("/api/projects/{projectId}")
  public ResponseEntity<ProjectResponse> updateProject(
      @PathVariable UUID projectId, @Valid @RequestBody ProjectRequest request) {
    var project =
        projectService.updateProject(
            projectId,
            request.name(),
            request.builderName(),
            request.startDate(),
            request.status(),
            request.description());
    return ResponseEntity.ok(ProjectResponse.from(project));
  }

  @DeleteMapping("/api/projects/{projectId}")
  public ResponseEntity<Void> deleteProject(@PathVariable UUID projectId) {
    projectService.deleteProject(projectId);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  /** Used for create and update; every field is optional. */
  public record ProjectRequest(
      @Size(max = 200, message = "name must not exceed 200 characters") String name,
      @Size(max = 200, message = "builder_name must not exceed 200 characters")
          String builderName,
      LocalDate startDate,
      @Size(max = 50, message = "status must not exceed 50 characters") String status,
      String description) {}

  public record ProjectResponse(
      UUID id,
      String name,
      String builderName,
      LocalDate startDate,
      String status,
      String description,
      Instant createdAt,
      Instant updatedAt) {

    public static ProjectResponse from(Project project) {
      return new ProjectResponse(
          project.getId(),
          project.getName(),
          project.getBuilderName(),
          project.getStartDate(),
          project.getStatus(),
          project.getDescription(),
          project.getCreatedAt(),
          project.getUpdatedAt());
    }
  }
}
