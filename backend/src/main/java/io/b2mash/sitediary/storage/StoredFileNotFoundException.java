package io.b2mash.sitediary.storage;

public class StoredFileNotFoundException extends StorageException {

  private final String key;

  public StoredFileNotFoundException(String key) {
    super("No stored file for key: " + key);
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
