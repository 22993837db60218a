package ca.gc.eccc.sentinel.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Filesystem checks for the directories and files named in configuration.
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Ensures {@code path} is a writable directory, creating it when requested.
   *
   * @param name key used in error messages
   * @param path candidate directory
   * @param createIfMissing whether to create missing directories
   * @return normalized absolute path
   */
  public static Path validateWritableDir(String name, Path path, boolean createIfMissing) {
    Path normalized = normalize(name, path);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          throw new IllegalArgumentException(name + " does not exist: " + normalized);
        }
        Files.createDirectories(normalized);
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create " + name + " " + normalized + ": " + ex.getMessage(), ex);
    }
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " is not a directory: " + normalized);
    }
    if (!Files.isWritable(normalized)) {
      throw new IllegalArgumentException(name + " is not writable: " + normalized);
    }
    return normalized;
  }

  /**
   * Ensures {@code path} is a regular, readable directory.
   *
   * @param name key used in error messages
   * @param path candidate directory
   * @return normalized absolute path
   */
  public static Path validateReadableDir(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isDirectory(normalized) || !Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not a readable directory: " + normalized);
    }
    return normalized;
  }

  /**
   * Ensures the file can be created or appended to; its parent directory is created when missing.
   *
   * @param name key used in error messages
   * @param path candidate file
   * @return normalized absolute path
   */
  public static Path validateWritableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " is a directory: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent != null) {
      validateWritableDir(name + " parent", parent, true);
    }
    if (Files.exists(normalized) && !Files.isWritable(normalized)) {
      throw new IllegalArgumentException(name + " is not writable: " + normalized);
    }
    return normalized;
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
