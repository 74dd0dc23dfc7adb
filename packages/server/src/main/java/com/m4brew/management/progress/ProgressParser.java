package com.m4brew.management.progress;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateful classifier for the task's output lines.
 *
 * <p>An optional bracketed prefix such as {@code "[2026-01-02 10:00:00] "} is stripped, then the
 * first matching rule applies:
 *
 * <ol>
 *   <li>a run of at least {@value #DIVIDER_MIN_LENGTH} {@code '-'} characters completes one work
 *       item;
 *   <li>{@code BOOK:} sets the current label;
 *   <li>{@code PATH:} sets the current path;
 *   <li>anything else leaves the state alone.
 * </ol>
 *
 * <p>Not thread-safe; owned by the background execution.
 */
public final class ProgressParser {
  public static final int DIVIDER_MIN_LENGTH = 20;
  public static final String LABEL_SENTINEL = "BOOK:";
  public static final String PATH_SENTINEL = "PATH:";

  private static final Pattern LOG_PREFIX = Pattern.compile("^\\[[^\\]]*\\]\\s*");
  private static final Pattern DIVIDER = Pattern.compile("^-{" + DIVIDER_MIN_LENGTH + ",}$");

  private int current;
  private String currentLabel;
  private String currentPath;

  /**
   * Feed one line of output.
   *
   * @return {@code true} if the line changed the parser state
   */
  public boolean accept(String line) {
    if (line == null) return false;
    String body = stripLogPrefix(line).strip();

    if (DIVIDER.matcher(body).matches()) {
      current++;
      return true;
    }
    if (body.startsWith(LABEL_SENTINEL)) {
      return updateLabel(body.substring(LABEL_SENTINEL.length()).strip());
    }
    if (body.startsWith(PATH_SENTINEL)) {
      return updatePath(body.substring(PATH_SENTINEL.length()).strip());
    }
    return false;
  }

  public int current() {
    return current;
  }

  public String currentLabel() {
    return currentLabel;
  }

  public String currentPath() {
    return currentPath;
  }

  /** Remove one leading {@code "[...] "} log prefix, if present. */
  public static String stripLogPrefix(String line) {
    Matcher m = LOG_PREFIX.matcher(line);
    return m.find() ? line.substring(m.end()) : line;
  }

  private boolean updateLabel(String value) {
    boolean changed = !value.equals(currentLabel);
    currentLabel = value;
    return changed;
  }

  private boolean updatePath(String value) {
    boolean changed = !value.equals(currentPath);
    currentPath = value;
    return changed;
  }
}
