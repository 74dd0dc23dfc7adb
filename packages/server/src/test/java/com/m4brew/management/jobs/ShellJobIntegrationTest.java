package com.m4brew.management.jobs;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.*;

import com.m4brew.management.history.HistoryLedger;
import com.m4brew.management.process.PosixProcessGroupSignaller;
import com.m4brew.management.process.ProcessTerminator;
import com.m4brew.management.process.ShellTaskLauncher;
import com.m4brew.management.process.SubResourceReaper;
import com.m4brew.management.scan.ScanEstimator;
import com.m4brew.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

/** Drives a real shell task in its own process group. Skipped where setsid is unavailable. */
class ShellJobIntegrationTest {

  @TempDir Path temp;

  private JobManager manager;

  @BeforeEach
  void requirePosix() {
    assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "needs /bin/sh");
    assumeTrue(
        Files.isExecutable(Path.of("/usr/bin/setsid")) || Files.isExecutable(Path.of("/bin/setsid")),
        "needs setsid");
  }

  @AfterEach
  void tearDown() {
    if (manager != null) manager.close();
  }

  private JobManager manager(Path script) {
    PosixProcessGroupSignaller signaller = new PosixProcessGroupSignaller(true);
    return new JobManager(
        new FileJobStore(temp.resolve("job.json")),
        new HistoryLedger(temp.resolve("history.jsonl"), 10, JacksonUtility.getJsonMapper()),
        temp.resolve("job_output.log"),
        new ShellTaskLauncher("/bin/sh", script.toString(), true),
        new ProcessTerminator(
            signaller, SubResourceReaper.NONE, Duration.ofSeconds(1), Duration.ofSeconds(1)),
        new ScanEstimator(),
        Duration.ofSeconds(5),
        Clock.systemUTC());
  }

  @Test
  void completedScriptIsFinishedWithSummary() throws Exception {
    Path script = temp.resolve("task.sh");
    Files.writeString(
        script,
        String.join(
            "\n",
            "echo \"[00:00:01] BOOK: $MODE\"",
            "echo \"[00:00:01] PATH: $ROOT_FOLDER\"",
            "echo '----------------------------------------'",
            "echo '__M4B_SUMMARY_JSON__ {\"success\":true}'",
            "exit 0",
            ""));
    manager = manager(script);

    manager.start(JobMode.CLEANUP, true, new JobParameters(temp.toString(), "match", 64));
    JobRecord done = awaitTerminal();

    assertEquals(JobStatus.FINISHED, done.status);
    assertEquals(0, done.exitCode);
    assertEquals("cleanup", done.currentLabel);
    assertEquals(temp.toString(), done.currentPath);
    assertTrue(done.summary.get("success").asBoolean());
  }

  @Test
  void canceledScriptAndItsChildrenAreStopped() throws Exception {
    Path script = temp.resolve("task.sh");
    Files.writeString(
        script,
        String.join(
            "\n",
            "trap 'echo \"__M4B_SUMMARY_JSON__ {\\\"success\\\":true}\"; exit 0' INT",
            "echo 'BOOK: Looping'",
            "while true; do sleep 0.1; done",
            ""));
    manager = manager(script);

    JobRecord started =
        manager.start(JobMode.CONVERT, false, new JobParameters(temp.toString(), "match", 64)).job();
    long pgid = started.pid;
    awaitLabel("Looping");

    assertTrue(manager.requestCancel());
    JobRecord done = awaitTerminal();

    assertEquals(JobStatus.CANCELED, done.status);
    assertEquals(JobManager.CANCEL_EXIT_CODE, done.exitCode);
    assertFalse(new PosixProcessGroupSignaller(true).isAlive(pgid));
  }

  private void awaitLabel(String label) throws Exception {
    long end = System.currentTimeMillis() + 5000;
    while (System.currentTimeMillis() < end) {
      var v = manager.status();
      if (v.isPresent() && label.equals(v.get().currentLabel)) return;
      Thread.sleep(20);
    }
    fail("Timeout waiting for label " + label);
  }

  private JobRecord awaitTerminal() throws Exception {
    long end = System.currentTimeMillis() + 10000;
    while (System.currentTimeMillis() < end) {
      var v = manager.status();
      if (v.isPresent() && v.get().status.isTerminal()) return v.get();
      Thread.sleep(20);
    }
    fail("Timeout waiting for a terminal status");
    return null; // Unreachable
  }
}
