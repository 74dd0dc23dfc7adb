package com.m4brew.management.process;

import com.m4brew.exception.ProcessException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/** Runs short helper commands ({@code kill}, {@code docker}) with a hard deadline. */
final class CommandRunner {

  record Result(int exitCode, String output) {
    boolean ok() {
      return exitCode == 0;
    }
  }

  private final Duration timeout;

  CommandRunner(Duration timeout) {
    this.timeout = timeout;
  }

  Result run(List<String> command) {
    Process p;
    try {
      p = new ProcessBuilder(command).redirectErrorStream(true).start();
    } catch (IOException e) {
      throw new ProcessException("Could not start " + command.get(0), e);
    }
    try {
      boolean done = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!done) {
        p.destroyForcibly();
        throw new ProcessException(
            "%s did not finish within %d ms".formatted(command.get(0), timeout.toMillis()));
      }
      String out = new String(p.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
      return new Result(p.exitValue(), out.strip());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      p.destroyForcibly();
      throw new ProcessException("Interrupted while running " + command.get(0), e);
    } catch (IOException e) {
      throw new ProcessException("Could not read output of " + command.get(0), e);
    }
  }
}
