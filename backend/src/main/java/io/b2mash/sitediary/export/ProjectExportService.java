package io.b2mash.sitediary.export;

import io.b2mash.sitediary.entry.DiaryEntryRepository;
import io.b2mash.sitediary.export.ProjectExport.EntryData;
import io.b2mash.sitediary.export.ProjectExport.PhotoData;
import io.b2mash.sitediary.export.ProjectExport.ProjectData;
import io.b2mash.sitediary.photo.PhotoRepository;
import io.b2mash.sitediary.project.ProjectService;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectExportService {

  private final ProjectService projectService;
  private final DiaryEntryRepository diaryEntryRepository;
  private final PhotoRepository photoRepository;

  public ProjectExportService(
      ProjectService projectService,
      DiaryEntryRepository diaryEntryRepository,
      PhotoRepository photoRepository) {
    this.projectService = projectService;
    this.diaryEntryRepository = diaryEntryRepository;
    this.photoRepository = photoRepository;
  }

  @Transactional(readOnly = true)
  public ProjectExport exportProject(UUID projectId) {
    var project = projectService.getProject(projectId);
    var entries =
        diaryEntryRepository.findByProjectIdOrderByDateAscCreatedAtAsc(projectId).stream()
            .map(
                e ->
                    new EntryData(
                        e.getDate(),
                        e.getWeather(),
                        e.getTemperature(),
                        e.getContent(),
                        e.getWorkersCount(),
                        e.getMaterials(),
                        e.getWorkHours(),
                        e.getCosts(),
                        e.getNotes()))
            .toList();
    var photos =
        photoRepository.findByProjectIdOrderByDateTakenAscCreatedAtAsc(projectId).stream()
            .map(p -> new PhotoData(p.getOriginalFilename(), p.getDescription(), p.getDateTaken()))
            .toList();
    return new ProjectExport(
        new ProjectData(
            project.getName(),
            project.getBuilderName(),
            project.getStartDate(),
            project.getStatus(),
            project.getDescription()),
        entries,
        photos);
  }
}
