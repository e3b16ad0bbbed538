package io.b2mash.sitediary.photo;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
public class PhotoController {

  private final PhotoService photoService;

  public PhotoController(PhotoService photoService) {
    this.photoService = photoService;
  }

  @PostMapping(
      value = "/api/projects/{projectId}/photos",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<PhotoResponse> uploadPhoto(
      @PathVariable UUID projectId,
      @RequestPart(value = "file", required = false) MultipartFile file,
      @RequestParam(required = false) String description,
      @RequestParam(name = "date_taken", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate dateTaken) {
    var photo = photoService.uploadPhoto(projectId, file, description, dateTaken);
    return ResponseEntity.created(
            URI.create("/api/projects/" + projectId + "/photos/" + photo.getId()))
        .body(PhotoResponse.from(photo));
  }

  @GetMapping("/api/projects/{projectId}/photos")
  public ResponseEntity<List<PhotoResponse>> listPhotos(@PathVariable UUID projectId) {
    return ResponseEntity.ok(
        photoService.listPhotos(projectId).stream().map(PhotoResponse::from).toList());
  }

  @GetMapping("/api/projects/{projectId}/photos/{photoId}")
  public ResponseEntity<PhotoResponse> getPhoto(
      @PathVariable UUID projectId, @PathVariable UUID photoId) {
    return ResponseEntity.ok(PhotoResponse.from(photoService.getPhoto(projectId, photoId)));
  }

  @GetMapping("/api/projects/{projectId}/photos/{photoId}/content")
  public ResponseEntity<byte[]> getPhotoContent(
      @PathVariable UUID projectId, @PathVariable UUID photoId) {
    var photo = photoService.getPhoto(projectId, photoId);
    byte[] content = photoService.loadContent(photo);
    var contentType =
        photo.getContentType() != null
            ? MediaType.parseMediaType(photo.getContentType())
            : MediaType.APPLICATION_OCTET_STREAM;
    return ResponseEntity.ok()
        .contentType(contentType)
        .cacheControl(CacheControl.noCache())
        .body(content);
  }

  @DeleteMapping("/api/projects/{projectId}/photos/{photoId}")
  public ResponseEntity<Void> deletePhoto(
      @PathVariable UUID projectId, @PathVariable UUID photoId) {
    photoService.deletePhoto(projectId, photoId);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record PhotoResponse(
      UUID id,
      UUID projectId,
      String filename,
      String originalFilename,
      String description,
      LocalDate dateTaken,
      long fileSize,
      String url,
      Instant createdAt) {

    public static PhotoResponse from(Photo photo) {
      return new PhotoResponse(
          photo.getId(),
          photo.getProjectId(),
          photo.getFilename(),
          photo.getOriginalFilename(),
          photo.getDescription(),
          photo.getDateTaken(),
          photo.getFileSize(),
          "/api/projects/" + photo.getProjectId() + "/photos/" + photo.getId() + "/content",
          photo.getCreatedAt());
    }
  }
}
