package io.b2mash.sitediary.report;

import io.b2mash.sitediary.photo.Photo;
import io.b2mash.sitediary.photo.PhotoFilenames;
import io.b2mash.sitediary.storage.StorageException;
import io.b2mash.sitediary.storage.StorageService;
import io.b2mash.sitediary.storage.StoredFileNotFoundException;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.List;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads photo files for report rendering. Never throws for a single bad photo: missing or
 * undecodable files become {@link PhotoOutcome.Unavailable}.
 */
@Component
public class PhotoImageLoader {

  private static final Logger log = LoggerFactory.getLogger(PhotoImageLoader.class);

  private final StorageService storageService;

  public PhotoImageLoader(StorageService storageService) {
    this.storageService = storageService;
  }

  public List<ResolvedPhoto> resolveAll(List<Photo> photos) {
    return photos.stream().map(this::resolve).toList();
  }

  public ResolvedPhoto resolve(Photo photo) {
    return new ResolvedPhoto(photo, load(photo));
  }

  private PhotoOutcome load(Photo photo) {
    byte[] bytes;
    try {
      bytes = storageService.load(photo.getFilename());
    } catch (StoredFileNotFoundException e) {
      log.warn("Photo {} has no stored file {}", photo.getId(), photo.getFilename());
      return new PhotoOutcome.Unavailable("File not found");
    } catch (StorageException e) {
      log.warn("Photo {} could not be read: {}", photo.getId(), e.getMessage());
      return new PhotoOutcome.Unavailable("File could not be read");
    }

    try {
      BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
      if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
        log.warn("Photo {} ({}) is not a decodable image", photo.getId(), photo.getFilename());
        return new PhotoOutcome.Unavailable("Unsupported or corrupt image");
      }
      var size = ImageScaler.fitPhotoBox(image.getWidth(), image.getHeight());
      return new PhotoOutcome.Loaded(toDataUri(photo, bytes, image), size);
    } catch (IOException | RuntimeException e) {
      log.warn(
          "Photo {} ({}) failed to decode: {}", photo.getId(), photo.getFilename(), e.toString());
      return new PhotoOutcome.Unavailable("Unsupported or corrupt image");
    }
  }

  /** JPEG and PNG are embedded as stored; other formats are re-encoded to PNG. */
  private static String toDataUri(Photo photo, byte[] bytes, BufferedImage image)
      throws IOException {
    String contentType = contentTypeOf(photo);
    if ("image/jpeg".equals(contentType) || "image/png".equals(contentType)) {
      return dataUri(contentType, bytes);
    }
    var png = new ByteArrayOutputStream();
    if (!ImageIO.write(image, "png", png)) {
      throw new IOException("No PNG writer available");
    }
    return dataUri("image/png", png.toByteArray());
  }

  private static String contentTypeOf(Photo photo) {
    if (photo.getContentType() != null) {
      return photo.getContentType();
    }
    return PhotoFilenames.allowedExtension(photo.getFilename())
        .map(PhotoFilenames::contentTypeFor)
        .orElse("application/octet-stream");
  }

  private static String dataUri(String contentType, byte[] bytes) {
    return "data:" + contentType + ";base64," + Base64.getEncoder().encodeToString(bytes);
  }
}
