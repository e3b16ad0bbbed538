package io.b2mash.sitediary.photo;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Metadata for an uploaded image. The image itself lives in the file store under {@link
 * #getFilename()}; record and file are created and deleted together by {@link PhotoService}.
 */
@Entity
@Table(name = "photos")
public class Photo {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "filename", nullable = false, length = 255, unique = true, updatable = false)
  private String filename;

  @Column(name = "original_filename", nullable = false, length = 255)
  private String originalFilename;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "date_taken", nullable = false)
  private LocalDate dateTaken;

  @Column(name = "file_size", nullable = false)
  private long fileSize;

  @Column(name = "content_type", length = 100)
  private String contentType;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Photo() {}

  public Photo(
      UUID projectId,
      String filename,
      String originalFilename,
      String description,
      LocalDate dateTaken,
      long fileSize,
      String contentType) {
    this.projectId = projectId;
    this.filename = filename;
    this.originalFilename = originalFilename;
    this.description = description;
    this.dateTaken = dateTaken;
    this.fileSize = fileSize;
    this.contentType = contentType;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getFilename() {
    return filename;
  }

  public String getOriginalFilename() {
    return originalFilename;
  }

  public String getDescription() {
    return description;
  }

  public LocalDate getDateTaken() {
    return dateTaken;
  }

  public long getFileSize() {
    return fileSize;
  }

  public String getContentType() {
    return contentType;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
