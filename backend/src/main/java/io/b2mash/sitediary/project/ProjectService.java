package io.b2mash.sitediary.project;

import io.b2mash.sitediary.config.SiteDiaryProperties;
import io.b2mash.sitediary.entry.DiaryEntryRepository;
import io.b2mash.sitediary.exception.ResourceNotFoundException;
import io.b2mash.sitediary.photo.PhotoService;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {

  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private final ProjectRepository projectRepository;
  private final DiaryEntryRepository diaryEntryRepository;
  private final PhotoService photoService;
  private final SiteDiaryProperties properties;
  private final Clock clock;

  public ProjectService(
      ProjectRepository projectRepository,
      DiaryEntryRepository diaryEntryRepository,
      PhotoService photoService,
      SiteDiaryProperties properties,
      Clock clock) {
    this.projectRepository = projectRepository;
    this.diaryEntryRepository = diaryEntryRepository;
    this.photoService = photoService;
    this.properties = properties;
    this.clock = clock;
  }

  /** Creates a project. Omitted (null or blank) fields fall back to the configured defaults. */
  @Transactional
  public Project createProject(
      String name, String builderName, LocalDate startDate, String status, String description) {
    var defaults = properties.projectDefaults();
    var project =
        new Project(
            orDefault(name, defaults.name()),
            orDefault(builderName, defaults.builderName()),
            startDate != null ? startDate : LocalDate.now(clock),
            orDefault(status, defaults.status()),
            description);
    var saved = projectRepository.save(project);
    log.info("Created project {} ({})", saved.getId(), saved.getName());
    return saved;
  }

  @Transactional(readOnly = true)
  public Project getProject(UUID projectId) {
    return projectRepository
        .findById(projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
  }

  @Transactional(readOnly = true)
  public List<Project> listProjects() {
    return projectRepository.findAllByOrderByCreatedAtAsc();
  }

  /**
   * Returns the project configured as {@code sitediary.default-project-id}.
   *
   * @throws ResourceNotFoundException if no default is configured or it does not exist
   */
  @Transactional(readOnly = true)
  public Project getDefaultProject() {
    var defaultId = properties.defaultProjectId();
    if (defaultId == null) {
      throw ResourceNotFoundException.withDetail(
          "Default project not configured", "Set sitediary.default-project-id to a project id");
    }
    return getProject(defaultId);
  }

  @Transactional
  public Project updateProject(
      UUID projectId,
      String name,
      String builderName,
      LocalDate startDate,
      String status,
      String description) {
    var project = getProject(projectId);
    project.update(name, builderName, startDate, status, description);
    log.info("Updated project {}", projectId);
    return projectRepository.save(project);
  }

  /**
   * Deletes a project with everything it owns, children first: photos (records, then stored
   * files), then entries, then the project row. Photos are deleted one by one in their own
   * transactions; if any stored file cannot be removed the entries and the project are kept
   * together with the photos that still have their files.
   */
  @Transactional
  public void deleteProject(UUID projectId) {
    var project = getProject(projectId);
    int photos = photoService.deleteAllForProject(projectId);
    int entries = diaryEntryRepository.deleteAllByProjectId(projectId);
    projectRepository.delete(project);
    log.info("Deleted project {} with {} entries and {} photos", projectId, entries, photos);
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }
}
