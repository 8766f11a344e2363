package com.gentoro.thinkmcp.utility;

import com.gentoro.thinkmcp.exception.IoException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

public class FileUtility {

  /**
   * Write {@code content} to {@code target} so that readers observe either the previous file or
   * the complete new one. Content goes to a sibling temp file first and is then renamed over the
   * target.
   */
  public static void writeAtomically(Path target, String content) {
    Path parent = target.toAbsolutePath().getParent();
    Path tmp = parent.resolve(target.getFileName() + ".tmp." + UUID.randomUUID());
    try {
      Files.createDirectories(parent);
      Files.writeString(tmp, content, StandardCharsets.UTF_8);
      try {
        Files.move(
            tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      deleteQuietly(tmp);
      throw new IoException("Failed to write file: " + target, e);
    }
  }

  /** Returns the file content, or {@code null} when the file does not exist. */
  public static String readIfExists(Path file) {
    try {
      if (!Files.isRegularFile(file)) {
        return null;
      }
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to read file: " + file, e);
    }
  }

  public static boolean deleteQuietly(Path file) {
    try {
      return Files.deleteIfExists(file);
    } catch (IOException e) {
      return false;
    }
  }

  /** Expand a leading {@code ~} to the current user's home directory. */
  public static Path expandHome(String location) {
    if (location == null) {
      return null;
    }
    String trimmed = location.trim();
    if (trimmed.equals("~")) {
      return Paths.get(System.getProperty("user.home"));
    }
    if (trimmed.startsWith("~/") || trimmed.startsWith("~\\")) {
      return Paths.get(System.getProperty("user.home"), trimmed.substring(2));
    }
    return Paths.get(trimmed);
  }
}
