package com.m4brew.management.process;

import com.m4brew.exception.ProcessException;
import com.m4brew.logging.LoggingService;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;

/**
 * Signals process groups through the {@code kill} utility.
 *
 * <p>With group signaling disabled (task not started through {@code setsid}) only the leader pid
 * is signaled.
 */
public final class PosixProcessGroupSignaller implements ProcessGroupSignaller {
  private static final Logger log = LoggingService.getLogger(PosixProcessGroupSignaller.class);

  private final boolean groupSignals;
  private final CommandRunner runner;

  public PosixProcessGroupSignaller(boolean groupSignals) {
    this.groupSignals = groupSignals;
    this.runner = new CommandRunner(Duration.ofSeconds(2));
  }

  @Override
  public void signal(long pgid, Signal signal) {
    String target = groupSignals ? "-" + pgid : Long.toString(pgid);
    CommandRunner.Result r = runner.run(List.of("kill", "-" + signal.name(), "--", target));
    if (!r.ok()) {
      throw new ProcessException(
          "kill -%s %s failed (%d): %s".formatted(signal.name(), target, r.exitCode(), r.output()));
    }
    log.debug("Sent SIG{} to {}", signal.name(), target);
  }

  @Override
  public boolean isAlive(long pgid) {
    if (ProcessHandle.of(pgid).map(ProcessHandle::isAlive).orElse(false)) {
      return true;
    }
    if (!groupSignals) {
      return false;
    }
    // leader gone; other members of the group may still be running
    try {
      return runner.run(List.of("kill", "-0", "--", "-" + pgid)).ok();
    } catch (ProcessException e) {
      log.debug("Liveness check for group {} failed: {}", pgid, e.getMessage());
      return false;
    }
  }
}
