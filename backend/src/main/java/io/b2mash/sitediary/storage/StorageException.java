package io.b2mash.sitediary.storage;

/** Thrown when the file store fails to read, write or delete a file. */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
