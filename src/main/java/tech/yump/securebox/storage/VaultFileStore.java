package tech.yump.securebox.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the vault file. Every write goes to a temporary file in the target directory,
 * is forced to disk and then atomically moved over the target, so a crash mid-write leaves the
 * previous file untouched. The directory is flushed after the move so the rename itself survives a
 * crash.
 */
@Slf4j
@Component
public class VaultFileStore {

  private static final String TEMP_SUFFIX = ".tmp";

  private final ObjectMapper objectMapper;
  private final ObjectReader strictReader;

  public VaultFileStore(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.strictReader = objectMapper.readerFor(VaultFile.class)
        .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .with(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
        .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  public boolean exists(Path path) {
    return Files.isRegularFile(path);
  }

  /**
   * Reads and structurally validates the vault file.
   *
   * @return The parsed file, or empty if no file exists at the path.
   * @throws CorruptFormatException if the file cannot be parsed into the vault schema.
   * @throws StorageException       if the file exists but cannot be read.
   */
  public Optional<VaultFile> read(Path path) {
    log.debug("Reading vault file from path: {}", path);
    if (!Files.isRegularFile(path)) {
      log.debug("No vault file found at {}", path);
      return Optional.empty();
    }

    byte[] content;
    try {
      content = Files.readAllBytes(path);
    } catch (NoSuchFileException e) {
      log.warn("Vault file disappeared during read attempt: {}", path);
      return Optional.empty();
    } catch (AccessDeniedException e) {
      log.error("Permission denied reading vault file {}", path);
      throw new StorageException("Could not open save file: permission denied.", e);
    } catch (IOException e) {
      log.error("Failed to read vault file {}: {}", path, e.getMessage(), e);
      throw new StorageException("Failed to read vault file: " + path, e);
    }

    VaultFile vaultFile;
    try {
      vaultFile = strictReader.readValue(content);
    } catch (IOException e) {
      log.error("Vault file {} could not be parsed: {}", path, e.getMessage());
      throw new CorruptFormatException("Could not load vault: invalid JSON (file may be corrupted or empty).", e);
    }
    if (vaultFile == null) {
      throw new CorruptFormatException("Could not load vault: file is empty.");
    }
    vaultFile.validate();
    log.debug("Parsed vault file {} with {} container records.", path, vaultFile.getContainers().size());
    return Optional.of(vaultFile);
  }

  /**
   * Serializes the vault file and atomically replaces whatever is at the path.
   *
   * @throws StorageException if the file cannot be written. The previous file is left intact.
   */
  public void write(Path path, VaultFile vaultFile) {
    byte[] content;
    try {
      content = objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsBytes(vaultFile);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize vault file for {}: {}", path, e.getMessage(), e);
      throw new StorageException("Failed to serialize vault file.", e);
    }
    writeAtomically(path, content);
    log.info("Vault file written to {} ({} container records).", path, vaultFile.getContainers().size());
  }

  /**
   * Replaces the target with the source file, keeping the previous target as {@code previousCopy}.
   * Used to promote a verified backup download to the live vault.
   */
  public void promote(Path source, Path target, Path previousCopy) {
    try {
      if (Files.isRegularFile(target)) {
        Files.copy(target, previousCopy, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Kept previous vault file as {}", previousCopy);
      }
      move(source, target);
      log.info("Promoted {} to {}", source, target);
    } catch (IOException e) {
      log.error("Failed to replace {} with {}: {}", target, source, e.getMessage(), e);
      throw new StorageException("Failed to replace vault file: " + target, e);
    }
  }

  public void deleteIfExists(Path path) {
    try {
      if (Files.deleteIfExists(path)) {
        log.debug("Deleted {}", path);
      }
    } catch (IOException e) {
      log.error("Failed to delete {}: {}", path, e.getMessage(), e);
      throw new StorageException("Failed to delete file: " + path, e);
    }
  }

  private void writeAtomically(Path target, byte[] content) {
    Path absoluteTarget = target.toAbsolutePath().normalize();
    Path directory = absoluteTarget.getParent();
    Path temp = null;
    try {
      Files.createDirectories(directory);
      temp = Files.createTempFile(directory, "." + absoluteTarget.getFileName(), TEMP_SUFFIX);
      restrictPermissions(temp);
      try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
        ByteBuffer buffer = ByteBuffer.wrap(content);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(true);
      }
      move(temp, absoluteTarget);
      temp = null;
    } catch (AccessDeniedException e) {
      log.error("Permission denied writing vault file {}", absoluteTarget);
      throw new StorageException("Could not save: permission denied.", e);
    } catch (IOException e) {
      log.error("Failed to write vault file {}: {}", absoluteTarget, e.getMessage(), e);
      throw new StorageException("Failed to write vault file: " + absoluteTarget, e);
    } finally {
      if (temp != null) {
        try {
          Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
          log.warn("Could not remove temporary file {}: {}", temp, cleanup.getMessage());
        }
      }
    }
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.warn("Atomic move not supported for {}, falling back to a plain replace.", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
    syncDirectory(target.toAbsolutePath().getParent());
  }

  /**
   * Forces the directory entry of a completed rename to disk. Platforms that cannot open a
   * directory as a channel keep the rename without the flush.
   *
   * @return true if the directory was flushed.
   */
  static boolean syncDirectory(Path directory) {
    try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
      channel.force(true);
      return true;
    } catch (IOException e) {
      log.debug("Could not flush directory {}: {}", directory, e.getMessage());
      return false;
    }
  }

  private static void restrictPermissions(Path file) throws IOException {
    PosixFileAttributeView view = Files.getFileAttributeView(file, PosixFileAttributeView.class);
    if (view != null) {
      view.setPermissions(PosixFilePermissions.fromString("rw-------"));
    }
  }
}
