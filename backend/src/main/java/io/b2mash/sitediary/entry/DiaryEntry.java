package io.b2mash.sitediary.entry;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One day of work on a project. Entries have no update path: they are created once and can only
 * be deleted.
 */
@Entity
@Table(name = "diary_entries")
public class DiaryEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "date", nullable = false, updatable = false)
  private LocalDate date;

  @Column(name = "weather", length = 50, updatable = false)
  private String weather;

  @Column(name = "temperature", precision = 5, scale = 1, updatable = false)
  private BigDecimal temperature;

  @Column(name = "content", nullable = false, columnDefinition = "TEXT", updatable = false)
  private String content;

  @Column(name = "workers_count", updatable = false)
  private Integer workersCount;

  @Column(name = "materials", columnDefinition = "TEXT", updatable = false)
  private String materials;

  @Column(name = "work_hours", precision = 8, scale = 2, updatable = false)
  private BigDecimal workHours;

  @Column(name = "costs", precision = 14, scale = 2, updatable = false)
  private BigDecimal costs;

  @Column(name = "notes", columnDefinition = "TEXT", updatable = false)
  private String notes;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected DiaryEntry() {}

  public DiaryEntry(
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
    this.projectId = projectId;
    this.date = date;
    this.weather = weather;
    this.temperature = temperature;
    this.content = content;
    this.workersCount = workersCount;
    this.materials = materials;
    this.workHours = workHours;
    this.costs = costs;
    this.notes = notes;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public LocalDate getDate() {
    return date;
  }

  public String getWeather() {
    return weather;
  }

  public BigDecimal getTemperature() {
    return temperature;
  }

  public String getContent() {
    return content;
  }

  public Integer getWorkersCount() {
    return workersCount;
  }

  public String getMaterials() {
    return materials;
  }

  public BigDecimal getWorkHours() {
    return workHours;
  }

  public BigDecimal getCosts() {
    return costs;
  }

  public String getNotes() {
    return notes;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
