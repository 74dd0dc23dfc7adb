package com.m4brew.management.process;

import com.m4brew.logging.LoggingService;
import java.time.Duration;
import org.slf4j.Logger;

/**
 * Best-effort termination of a task and everything it spawned.
 *
 * <ol>
 *   <li>tear down sub-resources labeled with the job id;
 *   <li>SIGINT the process group and wait;
 *   <li>SIGTERM if still alive and wait;
 *   <li>SIGKILL if still alive and wait.
 * </ol>
 *
 * Failures of any step are logged and swallowed; SIGKILL is the backstop. Safe to call more than
 * once: signals to a group that is gone are no-ops.
 */
public final class ProcessTerminator {
  private static final Logger log = LoggingService.getLogger(ProcessTerminator.class);
  private static final long POLL_MILLIS = 50;

  private final ProcessGroupSignaller signaller;
  private final SubResourceReaper reaper;
  private final Duration interruptWait;
  private final Duration terminateWait;

  public ProcessTerminator(
      ProcessGroupSignaller signaller,
      SubResourceReaper reaper,
      Duration interruptWait,
      Duration terminateWait) {
    this.signaller = signaller;
    this.reaper = reaper;
    this.interruptWait = interruptWait;
    this.terminateWait = terminateWait;
  }

  public ProcessGroupSignaller signaller() {
    return signaller;
  }

  /**
   * Run the termination sequence.
   *
   * @param jobId job whose sub-resources should be removed
   * @param pgid process group of the task, or {@code null} when no process is attached
   * @return {@code true} if the group is gone afterwards
   */
  public boolean terminate(String jobId, Long pgid) {
    try {
      reaper.killSubResources(jobId);
    } catch (Exception e) {
      log.debug("Sub-resource cleanup for job {} failed: {}", jobId, e.getMessage());
    }
    if (pgid == null) {
      return true;
    }

    if (!isAlive(pgid)) return true;
    if (sendAndWait(pgid, Signal.INT, interruptWait)) return true;
    if (sendAndWait(pgid, Signal.TERM, terminateWait)) return true;

    send(pgid, Signal.KILL);
    log.warn("Job {}: process group {} force-killed", jobId, pgid);
    return awaitExit(pgid, terminateWait);
  }

  /** Single forceful kill, used once the bounded exit wait has elapsed. */
  public void kill(long pgid) {
    send(pgid, Signal.KILL);
  }

  private boolean sendAndWait(long pgid, Signal signal, Duration wait) {
    send(pgid, signal);
    return awaitExit(pgid, wait);
  }

  private void send(long pgid, Signal signal) {
    try {
      signaller.signal(pgid, signal);
      log.info("Sent SIG{} to process group {}", signal, pgid);
    } catch (Exception e) {
      log.debug("SIG{} to process group {} failed: {}", signal, pgid, e.getMessage());
    }
  }

  private boolean awaitExit(long pgid, Duration wait) {
    long deadline = System.nanoTime() + wait.toNanos();
    while (isAlive(pgid)) {
      if (System.nanoTime() - deadline >= 0) {
        return false;
      }
      try {
        Thread.sleep(POLL_MILLIS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    }
    return true;
  }

  private boolean isAlive(long pgid) {
    try {
      return signaller.isAlive(pgid);
    } catch (Exception e) {
      log.debug("Liveness check for {} failed: {}", pgid, e.getMessage());
      return true;
    }
  }
}
