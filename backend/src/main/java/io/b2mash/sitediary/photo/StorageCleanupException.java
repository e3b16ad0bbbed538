package io.b2mash.sitediary.photo;

import io.b2mash.sitediary.storage.StorageException;
import java.util.List;

/**
 * Stored photo files could not be removed. The records of those photos are kept, so each
 * remaining record still has its file.
 */
public class StorageCleanupException extends StorageException {

  private final List<String> failedKeys;

  public StorageCleanupException(List<String> failedKeys, Throwable cause) {
    super("Could not remove stored photo files " + failedKeys, cause);
    this.failedKeys = List.copyOf(failedKeys);
  }

  public List<String> getFailedKeys() {
    return failedKeys;
  }
}
