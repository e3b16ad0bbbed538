package io.b2mash.sitediary.entry;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
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
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DiaryEntryController {

  private final DiaryEntryService diaryEntryService;

  public DiaryEntryController(DiaryEntryService diaryEntryService) {
    this.diaryEntryService = diaryEntryService;
  }

  @PostMapping("/api/projects/{projectId}/entries")
  public ResponseEntity<EntryResponse> createEntry(
      @PathVariable UUID projectId, @Valid @RequestBody CreateEntryRequest request) {
    var entry =
        diaryEntryService.createEntry(
            projectId,
            request.date(),
            request.weather(),
            request.temperature(),
            request.content(),
            request.workersCount(),
            request.materials(),
            request.workHours(),
            request.costs(),
            request.notes());
    return ResponseEntity.created(
            URI.create("/api/projects/" + projectId + "/entries/" + entry.getId()))
        .body(EntryResponse.from(entry));
  }

  @GetMapping("/api/projects/{projectId}/entries")
  public ResponseEntity<List<EntryResponse>> listEntries(@PathVariable UUID projectId) {
    return ResponseEntity.ok(
        diaryEntryService.listEntries(projectId).stream().map(EntryResponse::from).toList());
  }

  @GetMapping("/api/projects/{projectId}/entries/{entryId}")
  public ResponseEntity<EntryResponse> getEntry(
      @PathVariable UUID projectId, @PathVariable UUID entryId) {
    return ResponseEntity.ok(EntryResponse.from(diaryEntryService.getEntry(projectId, entryId)));
  }

  @DeleteMapping("/api/projects/{projectId}/entries/{entryId}")
  public ResponseEntity<Void> deleteEntry(
      @PathVariable UUID projectId, @PathVariable UUID entryId) {
    diaryEntryService.deleteEntry(projectId, entryId);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record CreateEntryRequest(
      @NotNull(message = "date is required") LocalDate date,
      @Size(max = 50, message = "weather must not exceed 50 characters") String weather,
      @Digits(
              integer = 4,
              fraction = 1,
              message = "temperature must have at most 4 integer digits and 1 decimal")
          BigDecimal temperature,
      @NotBlank(message = "content is required") String content,
      @PositiveOrZero(message = "workers_count must not be negative") Integer workersCount,
      String materials,
      @PositiveOrZero(message = "work_hours must not be negative")
          @Digits(
              integer = 6,
              fraction = 2,
              message = "work_hours must have at most 6 integer digits and 2 decimals")
          BigDecimal workHours,
      @PositiveOrZero(message = "costs must not be negative")
          @Digits(
              integer = 12,
              fraction = 2,
              message = "costs must have at most 12 integer digits and 2 decimals")
          BigDecimal costs,
      String notes) {}

  public record EntryResponse(
      UUID id,
      UUID projectId,
      LocalDate date,
      String weather,
      BigDecimal temperature,
      String content,
      Integer workersCount,
      String materials,
      BigDecimal workHours,
      BigDecimal costs,
      String notes,
      Instant createdAt) {

    public static EntryResponse from(DiaryEntry entry) {
      return new EntryResponse(
          entry.getId(),
          entry.getProjectId(),
          entry.getDate(),
          entry.getWeather(),
          entry.getTemperature(),
          entry.getContent(),
          entry.getWorkersCount(),
          entry.getMaterials(),
          entry.getWorkHours(),
          entry.getCosts(),
          entry.getNotes(),
          entry.getCreatedAt());
    }
  }
}
