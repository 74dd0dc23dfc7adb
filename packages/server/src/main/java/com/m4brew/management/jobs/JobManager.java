package com.m4brew.management.jobs;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.m4brew.M4BrewConfig;
import com.m4brew.exception.ExceptionUtil;
import com.m4brew.exception.ValidationException;
import com.m4brew.logging.LoggingService;
import com.m4brew.management.history.HistoryEntry;
import com.m4brew.management.history.HistoryLedger;
import com.m4brew.management.process.DockerSubResourceReaper;
import com.m4brew.management.process.PosixProcessGroupSignaller;
import com.m4brew.management.process.ProcessGroupSignaller;
import com.m4brew.management.process.ProcessTerminator;
import com.m4brew.management.process.ShellTaskLauncher;
import com.m4brew.management.process.SubResourceReaper;
import com.m4brew.management.process.TaskLauncher;
import com.m4brew.management.progress.ProgressParser;
import com.m4brew.management.progress.SummaryExtractor;
import com.m4brew.management.scan.ScanEstimator;
import com.m4brew.utility.IoUtil;
import com.m4brew.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Orchestrates the controller's single job: starts the external task, tracks its progress in the
 * {@link JobStore}, cancels it on request and records completed runs in the {@link
 * HistoryLedger}.
 *
 * <p>At most one job is active at a time. The decision is always taken against the persisted
 * record, so it stays correct across controller restarts. The task is streamed on a
 * single-threaded executor; reads ({@link #status()}) never take the manager's lock and never
 * write.
 */
public final class JobManager implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(JobManager.class);

  /** Exit code recorded for every canceled job. */
  public static final int CANCEL_EXIT_CODE = 130;

  /** How long a liveness answer for a process left by a previous controller is reused. */
  static final Duration LIVENESS_TTL = Duration.ofSeconds(1);

  private static final DateTimeFormatter ID_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneId.of("UTC"));
  private static final DateTimeFormatter HEADER_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

  private final JobStore store;
  private final HistoryLedger history;
  private final Path outputFile;
  private final TaskLauncher launcher;
  private final ProcessTerminator terminator;
  private final ScanEstimator estimator;
  private final SummaryExtractor summaryExtractor;
  private final Duration exitWait;
  private final Clock clock;
  private final ExecutorService executor;

  private final Object lock = new Object();
  private volatile JobRun active;
  private volatile String ownedJobId;
  private volatile Liveness lastLiveness;
  private long lastIdMillis;

  private record Liveness(long pid, boolean alive, long checkedAtNanos) {}

  public JobManager(
      JobStore store,
      HistoryLedger history,
      Path outputFile,
      TaskLauncher launcher,
      ProcessTerminator terminator,
      ScanEstimator estimator,
      Duration exitWait,
      Clock clock) {
    this.store = store;
    this.history = history;
    this.outputFile = outputFile;
    this.launcher = launcher;
    this.terminator = terminator;
    this.estimator = estimator;
    this.summaryExtractor = new SummaryExtractor(JacksonUtility.getJsonMapper());
    this.exitWait = exitWait;
    this.clock = clock;
    this.executor =
        Executors.newSingleThreadExecutor(
            r -> {
              Thread t = new Thread(r, "m4brew-job");
              t.setDaemon(true);
              return t;
            });
  }

  /** Wire a manager with the production collaborators described by {@code config}. */
  public static JobManager create(M4BrewConfig config) {
    ProcessGroupSignaller signaller = new PosixProcessGroupSignaller(config.processGroup());
    SubResourceReaper reaper =
        config.dockerEnabled()
            ? new DockerSubResourceReaper(config.dockerBinary(), config.dockerLabel())
            : SubResourceReaper.NONE;
    return new JobManager(
        new FileJobStore(config.jobFile()),
        new HistoryLedger(
            config.historyFile(), config.historyMaxEntries(), JacksonUtility.getJsonMapper()),
        config.outputFile(),
        new ShellTaskLauncher(config.taskShell(), config.taskScript(), config.processGroup()),
        new ProcessTerminator(signaller, reaper, config.interruptWait(), config.terminateWait()),
        new ScanEstimator(),
        config.exitWait(),
        Clock.systemUTC());
  }

  // --------------------------------------------------------------------
  // Control surface
  // --------------------------------------------------------------------

  /**
   * Start a new job unless one is active.
   *
   * @throws ValidationException if the root folder is missing; nothing is persisted in that case
   */
  public StartResult start(JobMode mode, boolean dryRun, JobParameters parameters) {
    Objects.requireNonNull(mode, "mode");
    synchronized (lock) {
      Optional<JobRecord> existing = store.load();
      if (existing.isPresent() && effectiveView(existing.get()).isActive()) {
        log.info("Start rejected: job {} is {}", existing.get().id, existing.get().status);
        return new StartResult(existing.get(), false);
      }
      if (parameters == null || StringUtils.isBlank(parameters.rootFolder())) {
        throw new ValidationException("root_folder is required to start a job")
            .withContext("mode", mode.wireName());
      }

      Instant now = clock.instant();
      JobRecord r = new JobRecord();
      r.id = nextJobId(now);
      r.status = JobStatus.RUNNING;
      r.started = now;
      r.updated = now;
      r.mode = mode;
      r.dryRun = dryRun;
      r.parameters = parameters;
      r.total = estimateTotal(mode, parameters.rootFolder());

      ownedJobId = r.id;
      String header = header(r);
      writeOutput(header, false);
      store.save(r);
      log.info("Job {} starting: mode={} dryRun={} total={}", r.id, mode, dryRun, r.total);

      Process process;
      try {
        process = launcher.launch(environment(r));
      } catch (Exception e) {
        log.error("Job {}: could not launch task", r.id, e);
        finalizeFailed(r, header, e);
        return new StartResult(r.copy(), true);
      }

      r.pid = pidOf(process);
      r.updated = clock.instant();
      store.save(r);

      JobRun run = new JobRun(this, r, process, terminator, exitWait, outputFile, header);
      active = run;
      try {
        executor.submit(run);
      } catch (RejectedExecutionException e) {
        log.error("Job {}: executor rejected the run", r.id, e);
        active = null;
        run.terminateOnce();
        r.pid = null;
        finalizeFailed(r, header, e);
      }
      return new StartResult(r.copy(), true);
    }
  }

  /**
   * Read-only view of the job. A record still marked active whose process is gone and that no
   * execution of this controller owns (left behind by a restart) is reported with a derived
   * terminal status. The derived view is never written back.
   */
  public Optional<JobRecord> status() {
    try {
      return store.load().map(this::effectiveView);
    } catch (Exception e) {
      log.warn("Could not read job status: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Ask the active job to stop. Marks it canceling, persists that, then terminates the task
   * synchronously.
   *
   * @return {@code false} if no job was running or canceling
   */
  public boolean requestCancel() {
    JobRun run;
    String jobId;
    Long pgid;
    synchronized (lock) {
      Optional<JobRecord> persisted = store.load();
      if (persisted.isEmpty() || !effectiveView(persisted.get()).isActive()) {
        return false;
      }
      JobRun current = active;
      run = current != null && current.jobId().equals(persisted.get().id) ? current : null;
      JobRecord target = run != null ? run.record : persisted.get();
      if (run != null) {
        run.requestCancel();
      }
      target.cancelRequested = true;
      target.status = JobStatus.CANCELING;
      target.updated = clock.instant();
      store.save(target);
      jobId = target.id;
      pgid = target.pid;
    }

    log.info("Job {}: cancel requested", jobId);
    if (run != null) {
      run.terminateOnce();
    } else {
      if (!terminator.terminate(jobId, pgid)) {
        log.warn("Job {}: process group {} may have survived the kill", jobId, pgid);
      }
      lastLiveness = null;
      finalizeOrphanCancel(jobId);
    }
    return true;
  }

  /**
   * Remove the job record and its output capture.
   *
   * @return {@code false} if the job is still running or canceling
   */
  public boolean clear() {
    synchronized (lock) {
      Optional<JobRecord> persisted = store.load();
      if (persisted.isPresent() && effectiveView(persisted.get()).isActive()) {
        log.info("Clear rejected: job {} is {}", persisted.get().id, persisted.get().status);
        return false;
      }
      store.delete();
      IoUtil.silentDelete(outputFile);
      return true;
    }
  }

  /** Raw output captured for the current job, empty if none. */
  public String output() {
    try {
      return Files.isRegularFile(outputFile) ? Files.readString(outputFile) : "";
    } catch (IOException e) {
      log.warn("Could not read {}: {}", outputFile, e.getMessage());
      return "";
    }
  }

  /** @return up to {@code limit} completed runs, newest first */
  public List<HistoryEntry> history(int limit) {
    return history.recent(limit);
  }

  public void clearHistory() {
    history.clear();
  }

  /**
   * Stop accepting work and give a run that is finishing up (bounded by twice the exit wait) the
   * chance to record its completion. A task still running keeps running and is picked up by
   * status().
   */
  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(exitWait.toMillis() * 2, TimeUnit.MILLISECONDS)) {
        log.info("Job execution still in progress at shutdown");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  // --------------------------------------------------------------------
  // Background execution callbacks
  // --------------------------------------------------------------------

  void persistProgress(JobRun run) {
    boolean cancel;
    synchronized (lock) {
      JobRecord r = run.record;
      reconcileCancel(run);
      ProgressParser p = run.parser();
      r.current = p.current();
      r.currentLabel = p.currentLabel();
      r.currentPath = p.currentPath();
      r.updated = clock.instant();
      try {
        store.save(r);
      } catch (RuntimeException e) {
        log.warn("Job {}: progress not persisted: {}", r.id, e.getMessage());
      }
      cancel = run.isCancelRequested();
    }
    if (cancel) {
      run.terminateOnce();
    }
  }

  void finishRun(JobRun run, Integer exitCode, Exception failure) {
    synchronized (lock) {
      try {
        JobRecord r = run.record;
        reconcileCancel(run);
        ProgressParser p = run.parser();
        r.current = p.current();
        r.currentLabel = p.currentLabel();
        r.currentPath = p.currentPath();

        String output = run.output();
        if (failure != null && !run.isCancelRequested()) {
          output += appendDiagnostic(failure);
        }
        complete(r, exitCode, run.isCancelRequested(), output);
      } catch (Exception e) {
        log.error("Job {}: could not record completion", run.jobId(), e);
      } finally {
        if (active == run) active = null;
        if (run.jobId().equals(ownedJobId)) ownedJobId = null;
      }
    }
  }

  // --------------------------------------------------------------------
  // Internals
  // --------------------------------------------------------------------

  /** Pick up a cancellation recorded in the store since the run last looked. */
  private void reconcileCancel(JobRun run) {
    Optional<JobRecord> persisted = store.load();
    if (persisted.isPresent()
        && run.jobId().equals(persisted.get().id)
        && persisted.get().cancelRequested) {
      run.requestCancel();
    }
    if (run.isCancelRequested()) {
      run.record.cancelRequested = true;
      run.record.status = JobStatus.CANCELING;
    }
  }

  /** Write the terminal state, then the history entry. Caller holds the lock. */
  private void complete(JobRecord r, Integer exitCode, boolean canceled, String output) {
    Instant now = clock.instant();
    int runtime = runtimeSeconds(r, now);
    ObjectNode summary = summaryExtractor.extract(output).orElse(null);
    if (summary != null) {
      summary.put("runtime_s", runtime);
    }

    if (canceled) {
      r.cancelRequested = true;
      r.status = JobStatus.CANCELED;
      r.exitCode = CANCEL_EXIT_CODE;
      r.summary = markCanceled(summary, runtime);
    } else {
      r.status = exitCode != null && exitCode == 0 ? JobStatus.FINISHED : JobStatus.FAILED;
      r.exitCode = exitCode;
      r.summary = summary;
      if (r.total > 0) {
        r.current = r.total;
      }
    }
    r.runtimeSeconds = runtime;
    r.pid = null;
    r.updated = now;
    store.save(r);
    log.info("Job {} {} (exit {}, {}s)", r.id, r.status.wireName(), r.exitCode, runtime);

    try {
      history.append(
          new HistoryEntry(
              now,
              r.id,
              r.mode,
              r.dryRun,
              r.status,
              r.parameters,
              r.exitCode,
              r.runtimeSeconds,
              r.summary,
              output));
    } catch (RuntimeException e) {
      log.warn("Job {}: history entry not written: {}", r.id, e.getMessage());
    }
  }

  private void finalizeFailed(JobRecord r, String header, Exception cause) {
    String output = header + appendDiagnostic(cause);
    complete(r, null, false, output);
    if (r.id.equals(ownedJobId)) ownedJobId = null;
  }

  /** Cancellation of a task that no execution of this controller is attached to. */
  private void finalizeOrphanCancel(String jobId) {
    synchronized (lock) {
      Optional<JobRecord> persisted = store.load();
      if (persisted.isEmpty() || !jobId.equals(persisted.get().id) || !persisted.get().isActive()) {
        return;
      }
      log.info("Job {}: finalizing canceled task left by a previous controller", jobId);
      complete(persisted.get(), null, true, output());
    }
  }

  private ObjectNode markCanceled(ObjectNode summary, int runtime) {
    ObjectNode s = summary != null ? summary : JacksonUtility.getJsonMapper().createObjectNode();
    s.put("success", false);
    s.put("reason", "canceled");
    s.put("runtime_s", runtime);
    return s;
  }

  JobRecord effectiveView(JobRecord persisted) {
    JobRecord view = persisted.copy();
    if (!view.isActive()) {
      return view;
    }
    if (isAttached(view)) {
      if (view.started != null) {
        view.runtimeSeconds = runtimeSeconds(view, clock.instant());
      }
      return view;
    }
    if (view.cancelRequested) {
      view.status = JobStatus.CANCELED;
      view.exitCode = CANCEL_EXIT_CODE;
    } else {
      view.status =
          view.exitCode != null && view.exitCode == 0 ? JobStatus.FINISHED : JobStatus.FAILED;
    }
    view.pid = null;
    return view;
  }

  private boolean isAttached(JobRecord r) {
    if (r.id != null && r.id.equals(ownedJobId)) {
      return true;
    }
    if (r.pid == null) {
      return false;
    }
    long now = System.nanoTime();
    Liveness cached = lastLiveness;
    if (cached != null
        && cached.pid() == r.pid
        && now - cached.checkedAtNanos() < LIVENESS_TTL.toNanos()) {
      return cached.alive();
    }
    boolean alive;
    try {
      alive = terminator.signaller().isAlive(r.pid);
    } catch (Exception e) {
      log.debug("Liveness check for {} failed: {}", r.pid, e.getMessage());
      alive = false;
    }
    lastLiveness = new Liveness(r.pid, alive, now);
    return alive;
  }

  private String nextJobId(Instant now) {
    long millis = Math.max(now.toEpochMilli(), lastIdMillis + 1);
    lastIdMillis = millis;
    return ID_FORMAT.format(Instant.ofEpochMilli(millis));
  }

  private int estimateTotal(JobMode mode, String root) {
    try {
      return estimator.estimate(mode, Path.of(root));
    } catch (Exception e) {
      log.debug("No estimate for {}: {}", root, e.getMessage());
      return 0;
    }
  }

  private static Map<String, String> environment(JobRecord r) {
    Map<String, String> env = new LinkedHashMap<>();
    env.put("MODE", r.mode.wireName());
    env.put("DRY_RUN", Boolean.toString(r.dryRun));
    env.put("ROOT_FOLDER", r.parameters.rootFolder());
    env.put("AUDIO_MODE", Objects.requireNonNullElse(r.parameters.audioMode(), "match"));
    // the task appends the "k" unit itself
    env.put("BITRATE", r.parameters.bitrate() == null ? "64" : r.parameters.bitrate().toString());
    env.put("JOB_ID", r.id);
    return env;
  }

  private String header(JobRecord r) {
    return "[%s] Running MODE=%s DRY_RUN=%s JOB_ID=%s%nROOT_FOLDER=%s%nAUDIO_MODE=%s%nBITRATE=%s%n%n"
        .formatted(
            HEADER_TIME.format(r.started),
            r.mode.wireName(),
            r.dryRun,
            r.id,
            r.parameters.rootFolder(),
            Objects.requireNonNullElse(r.parameters.audioMode(), "match"),
            r.parameters.bitrate() == null ? "64" : r.parameters.bitrate());
  }

  /** Append a one-line diagnostic to the capture file and return it. */
  private String appendDiagnostic(Throwable t) {
    String line =
        "ERROR: controller failure: %s [%s]%n"
            .formatted(ExceptionUtil.describe(t), ExceptionUtil.formatCompactStackTrace(t, 5));
    writeOutput(line, true);
    return line;
  }

  private void writeOutput(String text, boolean append) {
    try {
      Files.createDirectories(outputFile.toAbsolutePath().getParent());
      if (append) {
        Files.writeString(
            outputFile,
            text,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND);
      } else {
        Files.writeString(outputFile, text, StandardCharsets.UTF_8);
      }
    } catch (IOException e) {
      log.warn("Could not write {}: {}", outputFile, e.getMessage());
    }
  }

  private static int runtimeSeconds(JobRecord r, Instant now) {
    if (r.started == null) return 0;
    return (int) Math.max(0, Duration.between(r.started, now).toSeconds());
  }

  private static Long pidOf(Process process) {
    try {
      return process.pid();
    } catch (UnsupportedOperationException e) {
      return null;
    }
  }
}
