package com.m4brew.management.scan;

import com.m4brew.logging.LoggingService;
import com.m4brew.management.jobs.JobMode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import org.slf4j.Logger;

/**
 * Cheap, advisory count of the work items a run will touch, used only as a progress denominator.
 *
 * <p>The library is laid out as {@code ROOT/<Author>/<Book>/}. Author folders named {@code
 * #recycle} are ignored. Any failure yields 0.
 */
public final class ScanEstimator {
  private static final Logger log = LoggingService.getLogger(ScanEstimator.class);

  static final String BACKUP_DIR = "_backup_files";
  static final String RECYCLE_DIR = "#recycle";

  public int estimate(JobMode mode, Path root) {
    if (mode == null || root == null || !Files.isDirectory(root)) {
      return 0;
    }
    try {
      return switch (mode) {
        case CLEANUP -> countBackupDirs(root);
        case CORRECT -> countMisnamed(root);
        case CONVERT -> countConvertible(root);
      };
    } catch (Exception e) {
      log.debug("Estimate for {} under {} failed: {}", mode, root, e.toString());
      return 0;
    }
  }

  private int countBackupDirs(Path root) throws IOException {
    try (Stream<Path> s = Files.walk(root)) {
      return (int)
          s.filter(Files::isDirectory)
              .filter(p -> p.getFileName() != null)
              .filter(p -> BACKUP_DIR.equalsIgnoreCase(p.getFileName().toString()))
              .count();
    }
  }

  private int countMisnamed(Path root) throws IOException {
    int count = 0;
    for (Path bookDir : bookDirs(root)) {
      List<Path> m4bs = filesWithExtension(bookDir, ".m4b");
      if (m4bs.size() != 1) continue;
      String author = bookDir.getParent().getFileName().toString();
      String book = bookDir.getFileName().toString();
      String desired = book + " - " + author + ".m4b";
      if (!m4bs.get(0).getFileName().toString().equals(desired)) {
        count++;
      }
    }
    return count;
  }

  private int countConvertible(Path root) throws IOException {
    int count = 0;
    for (Path bookDir : bookDirs(root)) {
      boolean hasOutput =
          filesWithExtension(bookDir, ".m4b").stream()
              .map(p -> p.getFileName().toString().toLowerCase(Locale.ROOT))
              .anyMatch(n -> !n.startsWith(".tmp_") && !n.startsWith("tmp_"));
      if (hasOutput) continue;
      if (!filesWithExtension(bookDir, ".mp3").isEmpty()
          || !filesWithExtension(bookDir, ".m4a").isEmpty()) {
        count++;
      }
    }
    return count;
  }

  /** Directories exactly two levels below root, skipping recycle-bin authors. */
  private static List<Path> bookDirs(Path root) throws IOException {
    List<Path> out = new ArrayList<>();
    try (Stream<Path> authors = Files.list(root)) {
      for (Path author : (Iterable<Path>) authors::iterator) {
        if (!Files.isDirectory(author)) continue;
        if (RECYCLE_DIR.equals(author.getFileName().toString())) continue;
        try (Stream<Path> books = Files.list(author)) {
          books.filter(Files::isDirectory).sorted().forEach(out::add);
        }
      }
    }
    return out;
  }

  private static List<Path> filesWithExtension(Path dir, String extension) throws IOException {
    try (Stream<Path> s = Files.list(dir)) {
      return s.filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension))
          .toList();
    }
  }
}
