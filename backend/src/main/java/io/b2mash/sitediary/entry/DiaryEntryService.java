package io.b2mash.sitediary.entry;

import io.b2mash.sitediary.exception.InvalidStateException;
import io.b2mash.sitediary.exception.ResourceNotFoundException;
import io.b2mash.sitediary.project.ProjectRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DiaryEntryService {

  private static final Logger log = LoggerFactory.getLogger(DiaryEntryService.class);

  private final DiaryEntryRepository diaryEntryRepository;
  private final ProjectRepository projectRepository;

  public DiaryEntryService(
      DiaryEntryRepository diaryEntryRepository, ProjectRepository projectRepository) {
    this.diaryEntryRepository = diaryEntryRepository;
    this.projectRepository = projectRepository;
  }

  @Transactional
  public DiaryEntry createEntry(
      UUID projectId,
      LocalDate date,
      String weather,
      BigDecimal temperature,
      String content,
      Integer workersCount,
      String materials,
      BigDecimal workHours,
      BigDecimal costs,
      String notes) {
    requireProject(projectId);

    if (date == null) {
      throw new InvalidStateException("Invalid entry", "Entry date is required");
    }
    if (content == null || content.isBlank()) {
      throw new InvalidStateException("Invalid entry", "Work content is required");
    }
    if (workersCount != null && workersCount < 0) {
      throw new InvalidStateException("Invalid entry", "Workers count must be non-negative");
    }
    if (workHours != null && workHours.signum() < 0) {
      throw new InvalidStateException("Invalid entry", "Work hours must be non-negative");
    }
    if (costs != null && costs.signum() < 0) {
      throw new InvalidStateException("Invalid entry", "Costs must be non-negative");
    }

    var entry =
        new DiaryEntry(
            projectId,
            date,
            blankToNull(weather),
            temperature,
            content,
            workersCount,
            blankToNull(materials),
            workHours,
            costs,
            blankToNull(notes));
    var saved = diaryEntryRepository.save(entry);
    log.info("Created entry {} for project {} on {}", saved.getId(), projectId, date);
    return saved;
  }

  /** Entries of a project, newest first. */
  @Transactional(readOnly = true)
  public List<DiaryEntry> listEntries(UUID projectId) {
    requireProject(projectId);
    return diaryEntryRepository.findByProjectIdOrderByDateDescCreatedAtDesc(projectId);
  }

  @Transactional(readOnly = true)
  public DiaryEntry getEntry(UUID projectId, UUID entryId) {
    return diaryEntryRepository
        .findByIdAndProjectId(entryId, projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Entry", entryId));
  }

  @Transactional
  public void deleteEntry(UUID projectId, UUID entryId) {
    var entry = getEntry(projectId, entryId);
    diaryEntryRepository.delete(entry);
    log.info("Deleted entry {} from project {}", entryId, projectId);
  }

  private void requireProject(UUID projectId) {
    if (!projectRepository.existsById(projectId)) {
      throw new ResourceNotFoundException("Project", projectId);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
