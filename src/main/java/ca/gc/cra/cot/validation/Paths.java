package ca.gc.cra.cot.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for report inputs and the archive directory.
 * <p><strong>Why:</strong> Rejects unusable paths with a clear message before any report is decoded or any archive
 * is rewritten.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between a check and its use.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a writable archive directory, optionally creating it.
   *
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing whether to create the directory and its parents when absent
   * @return absolute normalized directory path
   * @throws IllegalArgumentException if the path is malformed, not a directory, not writable, or cannot be created
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    Path normalized = normalize(path);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          throw new IllegalArgumentException("directory does not exist: " + normalized);
        }
        Files.createDirectories(normalized);
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create directory " + normalized + ": " + ex.getMessage(), ex);
    }
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("path is not a directory: " + normalized);
    }
    if (!Files.isWritable(normalized)) {
      throw new IllegalArgumentException("directory is not writable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates that a path names a readable regular file or directory.
   *
   * @param path candidate input; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is malformed, missing, or unreadable
   */
  public static Path requireReadable(Path path) {
    Path normalized = normalize(path);
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException("input does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("input is not readable: " + normalized);
    }
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.isBlank()) {
      throw new IllegalArgumentException("path must not be blank");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
