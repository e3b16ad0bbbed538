package io.b2mash.sitediary.project;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "projects")
public class Project {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "builder_name", nullable = false, length = 200)
  private String builderName;

  @Column(name = "start_date", nullable = false)
  private LocalDate startDate;

  @Column(name = "status", nullable = false, length = 50)
  private String status;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Project() {}

  public Project(
      String name, String builderName, LocalDate startDate, String status, String description) {
    this.name = name;
    this.builderName = builderName;
    this.startDate = startDate;
    this.status = status;
    this.description = description;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Applies a partial update: {@code null} arguments keep the current value. */
  public void update(
      String name, String builderName, LocalDate startDate, String status, String description) {
    if (name != null) this.name = name;
    if (builderName != null) this.builderName = builderName;
    if (startDate != null) this.startDate = startDate;
    if (status != null) this.status = status;
    if (description != null) this.description = description;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getBuilderName() {
    return builderName;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public String getStatus() {
    return status;
  }

  public String getDescription() {
    return description;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
