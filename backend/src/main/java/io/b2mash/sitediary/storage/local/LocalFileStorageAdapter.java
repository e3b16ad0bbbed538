package io.b2mash.sitediary.storage.local;

import io.b2mash.sitediary.storage.StorageException;
import io.b2mash.sitediary.storage.StorageService;
import io.b2mash.sitediary.storage.StoredFileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Stores photo files in a single directory on the local filesystem. */
@Component
@ConditionalOnProperty(name = "storage.provider", havingValue = "local", matchIfMissing = true)
public class LocalFileStorageAdapter implements StorageService {

  private static final Logger log = LoggerFactory.getLogger(LocalFileStorageAdapter.class);

  /** Keys are flat file names; no separators or parent references. */
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");

  private final Path rootDir;

  public LocalFileStorageAdapter(LocalStorageProperties properties) {
    this.rootDir = Path.of(properties.rootDir()).toAbsolutePath().normalize();
    try {
      Files.createDirectories(this.rootDir);
    } catch (IOException e) {
      throw new StorageException("Could not create upload directory " + this.rootDir, e);
    }
    log.info("Local photo storage at {}", this.rootDir);
  }

  @Override
  public String store(String key, InputStream content, long contentLength, String contentType) {
    var target = resolve(key);
    Path temp = null;
    try {
      temp = Files.createTempFile(rootDir, ".upload-", ".tmp");
      Files.copy(content, temp, StandardCopyOption.REPLACE_EXISTING);
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
      return key;
    } catch (IOException e) {
      var failure = new StorageException("Failed to store file " + key, e);
      discardTempFile(temp, failure);
      throw failure;
    }
  }

  // Partial writes only ever exist under a temp name, never under a storage key.
  private void discardTempFile(Path temp, StorageException failure) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.error("Could not remove partial upload {}", temp, e);
      failure.addSuppressed(e);
    }
  }

  @Override
  public byte[] load(String key) {
    var source = resolve(key);
    try {
      return Files.readAllBytes(source);
    } catch (NoSuchFileException e) {
      throw new StoredFileNotFoundException(key);
    } catch (IOException e) {
      throw new StorageException("Failed to read file " + key, e);
    }
  }

  @Override
  public boolean delete(String key) {
    var target = resolve(key);
    try {
      return Files.deleteIfExists(target);
    } catch (IOException e) {
      throw new StorageException("Failed to delete file " + key, e);
    }
  }

  Path resolve(String key) {
    if (key == null || !KEY_PATTERN.matcher(key).matches()) {
      throw new StorageException("Invalid storage key: " + key);
    }
    var resolved = rootDir.resolve(key).normalize();
    if (!resolved.startsWith(rootDir)) {
      throw new StorageException("Storage key escapes the upload directory: " + key);
    }
    return resolved;
  }
}
