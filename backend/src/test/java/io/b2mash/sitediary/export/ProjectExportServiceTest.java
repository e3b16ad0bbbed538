package io.b2mash.sitediary.export;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.b2mash.sitediary.entry.DiaryEntryRepository;
import io.b2mash.sitediary.export.ProjectExport.PhotoData;
import io.b2mash.sitediary.photo.PhotoRepository;
import io.b2mash.sitediary.project.ProjectService;
import io.b2mash.sitediary.testutil.TestData;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProjectExportServiceTest {

  @Mock private ProjectService projectService;
  @Mock private DiaryEntryRepository diaryEntryRepository;
  @Mock private PhotoRepository photoRepository;

  @InjectMocks private ProjectExportService service;

  @Test
  void export_containsProjectEntriesAndPhotoMetadata() {
    var start = LocalDate.of(2024, 1, 1);
    var project = TestData.project("Villa", start);
    var id = project.getId();
    var entry = TestData.entry(id, start, "Excavation", new BigDecimal("250.00"), null);
    var photo = TestData.photo(id, "0f3a.png", "pit.png", start);
    when(projectService.getProject(id)).thenReturn(project);
    when(diaryEntryRepository.findByProjectIdOrderByDateAscCreatedAtAsc(id))
        .thenReturn(List.of(entry));
    when(photoRepository.findByProjectIdOrderByDateTakenAscCreatedAtAsc(id))
        .thenReturn(List.of(photo));

    var export = service.exportProject(id);

    assertThat(export.project().name()).isEqualTo("Villa");
    assertThat(export.project().startDate()).isEqualTo(start);
    assertThat(export.entries())
        .singleElement()
        .satisfies(
            e -> {
              assertThat(e.content()).isEqualTo("Excavation");
              assertThat(e.costs()).isEqualByComparingTo("250.00");
            });
    assertThat(export.photos()).containsExactly(new PhotoData("pit.png", null, start));
  }
}
