package io.b2mash.sitediary.statistics;

import io.b2mash.sitediary.config.SiteDiaryProperties;
import io.b2mash.sitediary.entry.DiaryEntry;
import io.b2mash.sitediary.entry.DiaryEntryRepository;
import io.b2mash.sitediary.photo.PhotoRepository;
import io.b2mash.sitediary.project.Project;
import io.b2mash.sitediary.project.ProjectService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class StatisticsService {

  private final ProjectService projectService;
  private final DiaryEntryRepository diaryEntryRepository;
  private final PhotoRepository photoRepository;
  private final SiteDiaryProperties properties;
  private final Clock clock;

  public StatisticsService(
      ProjectService projectService,
      DiaryEntryRepository diaryEntryRepository,
      PhotoRepository photoRepository,
      SiteDiaryProperties properties,
      Clock clock) {
    this.projectService = projectService;
    this.diaryEntryRepository = diaryEntryRepository;
    this.photoRepository = photoRepository;
    this.properties = properties;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public ProjectStatistics computeStatistics(UUID projectId) {
    var project = projectService.getProject(projectId);
    var entries = diaryEntryRepository.findByProjectIdOrderByDateAscCreatedAtAsc(projectId);
    long photoCount = photoRepository.countByProjectId(projectId);
    return computeStatistics(project, entries, photoCount);
  }

  /** Derives the statistics from already loaded records. No side effects. */
  public ProjectStatistics computeStatistics(
      Project project, List<DiaryEntry> entries, long photoCount) {
    return new ProjectStatistics(
        entries.size(),
        photoCount,
        projectDays(project.getStartDate(), LocalDate.now(clock)),
        sum(entries, DiaryEntry::getCosts),
        sum(entries, DiaryEntry::getWorkHours),
        properties.completionPlaceholder());
  }

  /** Days since the start date, counting the start day itself. */
  static long projectDays(LocalDate startDate, LocalDate today) {
    return ChronoUnit.DAYS.between(startDate, today) + 1;
  }

  private static BigDecimal sum(List<DiaryEntry> entries, Function<DiaryEntry, BigDecimal> field) {
    return entries.stream()
        .map(field)
        .filter(Objects::nonNull)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }
}
