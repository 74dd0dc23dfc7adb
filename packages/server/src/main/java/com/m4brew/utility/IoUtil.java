package com.m4brew.utility;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Small collection of I/O helpers for safe file operations. */
public final class IoUtil {

  private IoUtil() {}

  /**
   * Replace {@code target} with {@code content} so that concurrent readers see either the old or
   * the new file, never a partial one.
   *
   * <p>Content is written to a temporary sibling and renamed over the target. File systems without
   * atomic rename fall back to a plain replace.
   */
  public static void writeAtomically(Path target, byte[] content) throws IOException {
    Path dir = target.toAbsolutePath().getParent();
    Files.createDirectories(dir);
    Path tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
    try {
      Files.write(tmp, content);
      try {
        Files.move(
            tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  /** Delete a file quietly, returning whether something was removed. */
  public static boolean silentDelete(Path file) {
    if (file == null) return false;
    try {
      return Files.deleteIfExists(file);
    } catch (IOException ignored) {
      return false;
    }
  }
}
