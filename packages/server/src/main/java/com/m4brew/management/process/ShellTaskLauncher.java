package com.m4brew.management.process;

import com.m4brew.logging.LoggingService;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Launches the task script through a shell. With process groups enabled the shell is started via
 * {@code setsid}, so the task leads a new group whose id equals its pid and the whole descendant
 * tree can be signaled at once.
 */
public final class ShellTaskLauncher implements TaskLauncher {
  private static final Logger log = LoggingService.getLogger(ShellTaskLauncher.class);

  private final List<String> command;

  public ShellTaskLauncher(String shell, String script, boolean newProcessGroup) {
    List<String> cmd = new ArrayList<>();
    if (newProcessGroup) cmd.add("setsid");
    cmd.add(shell);
    cmd.add(script);
    this.command = List.copyOf(cmd);
  }

  public List<String> command() {
    return command;
  }

  @Override
  public Process launch(Map<String, String> environment) throws IOException {
    ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(true);
    pb.environment().putAll(environment);
    Process process = pb.start();
    log.info("Launched {} as pid {}", String.join(" ", command), process.pid());
    return process;
  }
}
