package io.b2mash.sitediary.photo;

import io.b2mash.sitediary.exception.InvalidStateException;
import io.b2mash.sitediary.exception.ResourceNotFoundException;
import io.b2mash.sitediary.project.ProjectRepository;
import io.b2mash.sitediary.storage.StorageException;
import io.b2mash.sitediary.storage.StorageService;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.multipart.MultipartFile;

/**
 * Owns the photo record together with its stored file. Creation writes the file first and the
 * record second; deletion removes the record first and the file second.
 */
@Service
public class PhotoService {

  private static final Logger log = LoggerFactory.getLogger(PhotoService.class);

  private final PhotoRepository photoRepository;
  private final ProjectRepository projectRepository;
  private final StorageService storageService;
  private final Clock clock;
  private final TransactionTemplate photoTxTemplate;

  public PhotoService(
      PhotoRepository photoRepository,
      ProjectRepository projectRepository,
      StorageService storageService,
      Clock clock,
      PlatformTransactionManager txManager) {
    this.photoRepository = photoRepository;
    this.projectRepository = projectRepository;
    this.storageService = storageService;
    this.clock = clock;
    this.photoTxTemplate = new TransactionTemplate(txManager);
    this.photoTxTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /**
   * Stores an uploaded image and records it. Runs without a surrounding transaction: the record
   * is committed by the repository call, and if that fails the written file is removed again.
   */
  public Photo uploadPhoto(
      UUID projectId, MultipartFile file, String description, LocalDate dateTaken) {
    if (!projectRepository.existsById(projectId)) {
      throw new ResourceNotFoundException("Project", projectId);
    }
    if (file == null || file.isEmpty()) {
      throw new InvalidStateException("No file selected", "The upload contains no file");
    }
    String originalName = file.getOriginalFilename();
    String extension =
        PhotoFilenames.allowedExtension(originalName)
            .orElseThrow(
                () -> {
                  log.warn("Rejected upload with unsupported name '{}'", originalName);
                  return new InvalidStateException(
                      "Invalid file type", "Allowed types: png, jpg, jpeg, gif, bmp, webp");
                });

    String storedName = PhotoFilenames.generateStoredName(extension);
    String contentType = PhotoFilenames.contentTypeFor(extension);
    try (var content = file.getInputStream()) {
      storageService.store(storedName, content, file.getSize(), contentType);
    } catch (IOException e) {
      var failure = new StorageException("Failed to read uploaded file", e);
      rollbackStoredFile(storedName, failure);
      throw failure;
    } catch (StorageException e) {
      rollbackStoredFile(storedName, e);
      throw e;
    }

    var photo =
        new Photo(
            projectId,
            storedName,
            PhotoFilenames.sanitize(originalName),
            description == null || description.isBlank() ? null : description,
            dateTaken != null ? dateTaken : LocalDate.now(clock),
            file.getSize(),
            contentType);
    try {
      var saved = photoRepository.saveAndFlush(photo);
      log.info(
          "Stored photo {} as {} for project {} ({} bytes)",
          saved.getId(),
          storedName,
          projectId,
          saved.getFileSize());
      return saved;
    } catch (RuntimeException e) {
      rollbackStoredFile(storedName, e);
      throw e;
    }
  }

  /** Photos of a project, newest first. */
  @Transactional(readOnly = true)
  public List<Photo> listPhotos(UUID projectId) {
    if (!projectRepository.existsById(projectId)) {
      throw new ResourceNotFoundException("Project", projectId);
    }
    return photoRepository.findByProjectIdOrderByDateTakenDescCreatedAtDesc(projectId);
  }

  @Transactional(readOnly = true)
  public Photo getPhoto(UUID projectId, UUID photoId) {
    return photoRepository
        .findByIdAndProjectId(photoId, projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Photo", photoId));
  }

  @Transactional(readOnly = true)
  public byte[] loadContent(Photo photo) {
    return storageService.load(photo.getFilename());
  }

  /**
   * Deletes the record, then the stored file. A file that is already gone counts as deleted. If
   * an existing file cannot be removed, {@link StorageCleanupException} rolls the record deletion
   * back.
   */
  @Transactional
  public void deletePhoto(UUID projectId, UUID photoId) {
    var photo = getPhoto(projectId, photoId);
    try {
      removeRecordAndFile(photo);
    } catch (StorageException e) {
      throw new StorageCleanupException(List.of(photo.getFilename()), e);
    }
    log.info("Deleted photo {} ({}) from project {}", photoId, photo.getFilename(), projectId);
  }

  /**
   * Deletes every photo of a project. Each record and its file are removed in their own
   * transaction, so a photo whose file cannot be removed keeps its record while the others stay
   * deleted. Any such failure is reported as a {@link StorageCleanupException} after all photos
   * were attempted.
   *
   * @return number of photos deleted
   */
  @Transactional
  public int deleteAllForProject(UUID projectId) {
    var photos = photoRepository.findByProjectIdOrderByDateTakenAscCreatedAtAsc(projectId);
    var failed = new ArrayList<String>();
    StorageException firstFailure = null;
    for (var photo : photos) {
      try {
        photoTxTemplate.executeWithoutResult(status -> removeRecordAndFile(photo));
      } catch (StorageException e) {
        failed.add(photo.getFilename());
        if (firstFailure == null) {
          firstFailure = e;
        } else {
          firstFailure.addSuppressed(e);
        }
      }
    }
    if (!failed.isEmpty()) {
      log.error(
          "Photo file cleanup failed for {} of project {}; their records were kept",
          failed,
          projectId);
      throw new StorageCleanupException(failed, firstFailure);
    }
    return photos.size();
  }

  private void removeRecordAndFile(Photo photo) {
    photoRepository.delete(photo);
    photoRepository.flush();
    if (!storageService.delete(photo.getFilename())) {
      log.info("Stored file {} was already absent", photo.getFilename());
    }
  }

  private void rollbackStoredFile(String storedName, RuntimeException cause) {
    try {
      storageService.delete(storedName);
    } catch (StorageException e) {
      log.error("Could not remove orphaned file {} after failed record write", storedName, e);
      cause.addSuppressed(e);
    }
  }
}
