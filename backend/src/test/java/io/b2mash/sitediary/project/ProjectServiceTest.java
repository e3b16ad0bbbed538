package io.b2mash.sitediary.project;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.sitediary.entry.DiaryEntryRepository;
import io.b2mash.sitediary.exception.ResourceNotFoundException;
import io.b2mash.sitediary.photo.PhotoService;
import io.b2mash.sitediary.photo.StorageCleanupException;
import io.b2mash.sitediary.storage.StorageException;
import io.b2mash.sitediary.testutil.TestData;
import io.b2mash.sitediary.testutil.TestProperties;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProjectServiceTest {

  private static final LocalDate TODAY = LocalDate.of(2024, 2, 20);
  private static final Clock CLOCK =
      Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

  @Mock private ProjectRepository projectRepository;
  @Mock private DiaryEntryRepository diaryEntryRepository;
  @Mock private PhotoService photoService;

  private ProjectService service(UUID defaultProjectId) {
    return new ProjectService(
        projectRepository,
        diaryEntryRepository,
        photoService,
        TestProperties.withDefaultProject(defaultProjectId),
        CLOCK);
  }

  @Test
  void create_fillsOmittedFieldsFromDefaults() {
    when(projectRepository.save(any(Project.class))).thenAnswer(inv -> inv.getArgument(0));

    var project = service(null).createProject(null, " ", null, null, null);

    assertThat(project.getName()).isEqualTo("My construction project");
    assertThat(project.getBuilderName()).isEqualTo("Unknown builder");
    assertThat(project.getStatus()).isEqualTo("In progress");
    assertThat(project.getStartDate()).isEqualTo(TODAY);
    assertThat(project.getDescription()).isNull();
  }

  @Test
  void create_keepsGivenValues() {
    when(projectRepository.save(any(Project.class))).thenAnswer(inv -> inv.getArgument(0));
    var start = LocalDate.of(2023, 9, 1);

    var project = service(null).createProject("Villa", "Kim", start, "Planned", "Two floors");

    assertThat(project.getName()).isEqualTo("Villa");
    assertThat(project.getBuilderName()).isEqualTo("Kim");
    assertThat(project.getStartDate()).isEqualTo(start);
    assertThat(project.getStatus()).isEqualTo("Planned");
    assertThat(project.getDescription()).isEqualTo("Two floors");
  }

  @Test
  void update_changesOnlyGivenFields() {
    var project = TestData.project("Villa", LocalDate.of(2023, 9, 1));
    when(projectRepository.findById(project.getId())).thenReturn(Optional.of(project));
    when(projectRepository.save(project)).thenReturn(project);

    var updated = service(null).updateProject(project.getId(), null, null, null, "Done", null);

    assertThat(updated.getStatus()).isEqualTo("Done");
    assertThat(updated.getName()).isEqualTo("Villa");
    assertThat(updated.getStartDate()).isEqualTo(LocalDate.of(2023, 9, 1));
  }

  @Test
  void defaultProject_notConfigured_throwsNotFound() {
    assertThatThrownBy(() -> service(null).getDefaultProject())
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void defaultProject_returnsConfiguredProject() {
    var project = TestData.project("Villa", TODAY);
    when(projectRepository.findById(project.getId())).thenReturn(Optional.of(project));

    assertThat(service(project.getId()).getDefaultProject()).isSameAs(project);
  }

  @Test
  void delete_removesPhotosThenEntriesThenProject() {
    var project = TestData.project("Villa", TODAY);
    var id = project.getId();
    when(projectRepository.findById(id)).thenReturn(Optional.of(project));
    when(photoService.deleteAllForProject(id)).thenReturn(2);
    when(diaryEntryRepository.deleteAllByProjectId(id)).thenReturn(5);

    service(null).deleteProject(id);

    var order = inOrder(photoService, diaryEntryRepository, projectRepository);
    order.verify(photoService).deleteAllForProject(id);
    order.verify(diaryEntryRepository).deleteAllByProjectId(id);
    order.verify(projectRepository).delete(project);
  }

  @Test
  void delete_photoCleanupFailure_stopsBeforeProjectRow() {
    var project = TestData.project("Villa", TODAY);
    var id = project.getId();
    when(projectRepository.findById(id)).thenReturn(Optional.of(project));
    when(photoService.deleteAllForProject(id))
        .thenThrow(new StorageCleanupException(List.of("a.png"), new StorageException("io")));

    assertThatThrownBy(() -> service(null).deleteProject(id))
        .isInstanceOf(StorageCleanupException.class);
    verify(diaryEntryRepository, never()).deleteAllByProjectId(id);
    verify(projectRepository, never()).delete(any(Project.class));
  }

  @Test
  void delete_unknownProject_throwsNotFound() {
    var id = UUID.randomUUID();
    when(projectRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service(null).deleteProject(id))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(photoService, never()).deleteAllForProject(id);
  }
}
