package io.b2mash.sitediary.storage;

import java.io.InputStream;

/**
 * Abstraction for the photo file store. Domain services inject this interface instead of touching
 * the filesystem or a vendor client directly.
 *
 * <p>System-wide: selected via {@code storage.provider}, either {@code local} (default) or {@code
 * s3}.
 */
public interface StorageService {

  /** Stores the content under the given key and returns the key. */
  String store(String key, InputStream content, long contentLength, String contentType);

  /**
   * Loads a stored file's content.
   *
   * @throws StoredFileNotFoundException if nothing is stored under the key
   */
  byte[] load(String key);

  /**
   * Deletes a stored file.
   *
   * @return {@code true} if a file was removed, {@code false} if it was already absent
   * @throws StorageException if an existing file could not be removed
   */
  boolean delete(String key);
}
