package io.b2mash.sitediary.photo;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/** Filename rules for uploaded photos: allowed types, sanitizing and stored-name generation. */
public final class PhotoFilenames {

  private static final Map<String, String> CONTENT_TYPES =
      Map.of(
          "png", "image/png",
          "jpg", "image/jpeg",
          "jpeg", "image/jpeg",
          "gif", "image/gif",
          "bmp", "image/bmp",
          "webp", "image/webp");

  private static final String FALLBACK_NAME = "upload";

  /** Column width of {@code photos.original_filename}. */
  static final int MAX_NAME_LENGTH = 255;

  private PhotoFilenames() {}

  /**
   * Returns the lower-cased extension if it is an accepted image type, empty otherwise. A name
   * without a dot has no extension.
   */
  public static Optional<String> allowedExtension(String filename) {
    if (filename == null) {
      return Optional.empty();
    }
    int dot = filename.lastIndexOf('.');
    if (dot < 0 || dot == filename.length() - 1) {
      return Optional.empty();
    }
    String extension = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    return CONTENT_TYPES.containsKey(extension) ? Optional.of(extension) : Optional.empty();
  }

  public static String contentTypeFor(String extension) {
    return CONTENT_TYPES.getOrDefault(
        extension.toLowerCase(Locale.ROOT), "application/octet-stream");
  }

  /** Collision-resistant stored name: a random 128-bit hex token plus the original extension. */
  public static String generateStoredName(String extension) {
    return UUID.randomUUID().toString().replace("-", "") + "." + extension;
  }

  /**
   * Makes a user-supplied filename safe to keep and display: directory parts are dropped,
   * accents are folded to ASCII, whitespace becomes {@code _} and anything outside {@code
   * [A-Za-z0-9._-]} is removed. Names longer than {@value #MAX_NAME_LENGTH} characters are
   * shortened before the extension.
   */
  public static String sanitize(String originalFilename) {
    if (originalFilename == null) {
      return FALLBACK_NAME;
    }
    String name = originalFilename.replace('\\', '/');
    name = name.substring(name.lastIndexOf('/') + 1);
    name = Normalizer.normalize(name, Normalizer.Form.NFKD).replaceAll("[^\\p{ASCII}]", "");
    name =
        name.trim()
            .replaceAll("\\s+", "_")
            .replaceAll("[^A-Za-z0-9._-]", "")
            .replaceAll("^[._]+|[._]+$", "");
    return name.isEmpty() ? FALLBACK_NAME : truncate(name);
  }

  private static String truncate(String name) {
    if (name.length() <= MAX_NAME_LENGTH) {
      return name;
    }
    int dot = name.lastIndexOf('.');
    String extension = dot > 0 && name.length() - dot <= 16 ? name.substring(dot) : "";
    return name.substring(0, MAX_NAME_LENGTH - extension.length()) + extension;
  }
}
