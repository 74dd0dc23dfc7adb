package com.m4brew.management.jobs;

import com.m4brew.logging.LoggingService;
import com.m4brew.management.process.ProcessTerminator;
import com.m4brew.management.progress.ProgressParser;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;

/**
 * Background execution of one attached task: streams its output into the capture file, drives the
 * progress parser, polls for cancellation between lines and waits (bounded) for the exit code.
 *
 * <p>{@link #record} is owned by this run; it is only mutated while holding the manager's lock.
 */
final class JobRun implements Runnable {
  private static final Logger log = LoggingService.getLogger(JobRun.class);

  final JobRecord record;

  private final JobManager manager;
  private final Process process;
  private final Long pgid;
  private final ProcessTerminator terminator;
  private final Duration exitWait;
  private final Path outputFile;
  private final ProgressParser parser = new ProgressParser();
  private final StringBuilder output = new StringBuilder();
  private final AtomicBoolean cancelRequested = new AtomicBoolean();
  private final AtomicBoolean terminating = new AtomicBoolean();

  JobRun(
      JobManager manager,
      JobRecord record,
      Process process,
      ProcessTerminator terminator,
      Duration exitWait,
      Path outputFile,
      String header) {
    this.manager = manager;
    this.record = record;
    this.process = process;
    this.pgid = record.pid;
    this.terminator = terminator;
    this.exitWait = exitWait;
    this.outputFile = outputFile;
    this.output.append(header);
  }

  String jobId() {
    return record.id;
  }

  ProgressParser parser() {
    return parser;
  }

  void requestCancel() {
    cancelRequested.set(true);
  }

  boolean isCancelRequested() {
    return cancelRequested.get();
  }

  /** Run the termination sequence once, whichever trigger gets here first. */
  void terminateOnce() {
    if (terminating.compareAndSet(false, true)) {
      log.info("Job {}: terminating process group {}", record.id, pgid);
      terminator.terminate(record.id, pgid);
      if (pgid == null) {
        process.destroyForcibly();
      }
    }
  }

  String output() {
    synchronized (output) {
      return output.toString();
    }
  }

  @Override
  public void run() {
    Integer exitCode = null;
    Exception failure = null;
    boolean interrupted = false;
    try (BufferedReader reader =
            new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        BufferedWriter capture =
            Files.newBufferedWriter(
                outputFile,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND)) {
      String line;
      while ((line = reader.readLine()) != null) {
        capture.write(line);
        capture.newLine();
        capture.flush();
        synchronized (output) {
          output.append(line).append('\n');
        }
        if (parser.accept(line)) {
          manager.persistProgress(this);
        }
        if (cancelRequested.get()) {
          terminateOnce();
        }
      }
      exitCode = awaitExit();
    } catch (InterruptedException e) {
      log.error("Job {}: interrupted while waiting for the task", record.id);
      interrupted = true;
      failure = e;
      terminateOnce();
    } catch (Exception e) {
      log.error("Job {}: background execution failed", record.id, e);
      failure = e;
      terminateOnce();
    } finally {
      manager.finishRun(this, exitCode, failure);
      // after the completion is written: interruptible file channels refuse writes otherwise
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** @return the exit code, or {@code null} if the task could not be reaped */
  private Integer awaitExit() throws InterruptedException {
    if (process.waitFor(exitWait.toMillis(), TimeUnit.MILLISECONDS)) {
      return process.exitValue();
    }
    log.warn("Job {}: task did not exit within {} ms, killing", record.id, exitWait.toMillis());
    if (pgid != null) {
      terminator.kill(pgid);
    }
    process.destroyForcibly();
    if (process.waitFor(exitWait.toMillis(), TimeUnit.MILLISECONDS)) {
      return process.exitValue();
    }
    return null;
  }
}
