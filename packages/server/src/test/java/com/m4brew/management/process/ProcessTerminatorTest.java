package com.m4brew.management.process;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.*;

class ProcessTerminatorTest {

  /** Records signals; the group dies after receiving {@code fatal}. */
  static final class RecordingSignaller implements ProcessGroupSignaller {
    final List<Signal> sent = new ArrayList<>();
    private final Signal fatal;
    private boolean alive = true;

    RecordingSignaller(Signal fatal) {
      this.fatal = fatal;
    }

    @Override
    public synchronized void signal(long pgid, Signal signal) {
      sent.add(signal);
      if (signal == fatal) alive = false;
    }

    @Override
    public synchronized boolean isAlive(long pgid) {
      return alive;
    }
  }

  private static ProcessTerminator terminator(ProcessGroupSignaller s, SubResourceReaper r) {
    return new ProcessTerminator(s, r, Duration.ofMillis(100), Duration.ofMillis(100));
  }

  @Test
  void stopsAtInterruptWhenTheGroupExits() {
    RecordingSignaller s = new RecordingSignaller(Signal.INT);
    assertTrue(terminator(s, SubResourceReaper.NONE).terminate("job", 42L));
    assertEquals(List.of(Signal.INT), s.sent);
  }

  @Test
  void escalatesToKillWhenSignalsAreIgnored() {
    RecordingSignaller s = new RecordingSignaller(Signal.KILL);
    assertTrue(terminator(s, SubResourceReaper.NONE).terminate("job", 42L));
    assertEquals(List.of(Signal.INT, Signal.TERM, Signal.KILL), s.sent);
  }

  @Test
  void waitsForTheGroupToGoAwayAfterKill() {
    ProcessGroupSignaller slowToDie =
        new ProcessGroupSignaller() {
          private volatile long killedAt;

          @Override
          public void signal(long pgid, Signal signal) {
            if (signal == Signal.KILL) killedAt = System.nanoTime();
          }

          @Override
          public boolean isAlive(long pgid) {
            return killedAt == 0 || System.nanoTime() - killedAt < Duration.ofMillis(30).toNanos();
          }
        };
    assertTrue(terminator(slowToDie, SubResourceReaper.NONE).terminate("job", 42L));
  }

  @Test
  void deadGroupIsNotSignalled() {
    RecordingSignaller s = new RecordingSignaller(Signal.INT);
    s.signal(42L, Signal.INT);
    s.sent.clear();

    assertTrue(terminator(s, SubResourceReaper.NONE).terminate("job", 42L));
    assertTrue(s.sent.isEmpty());
  }

  @Test
  void reaperAndSignalFailuresAreSwallowed() {
    List<String> reaped = new ArrayList<>();
    ProcessGroupSignaller failing =
        new ProcessGroupSignaller() {
          @Override
          public void signal(long pgid, Signal signal) {
            throw new IllegalStateException("no permission");
          }

          @Override
          public boolean isAlive(long pgid) {
            return true;
          }
        };
    SubResourceReaper reaper =
        jobId -> {
          reaped.add(jobId);
          throw new IllegalStateException("docker missing");
        };

    assertFalse(terminator(failing, reaper).terminate("job-1", 7L));
    assertEquals(List.of("job-1"), reaped);
  }

  @Test
  void withoutProcessOnlySubResourcesAreReaped() {
    List<String> reaped = new ArrayList<>();
    RecordingSignaller s = new RecordingSignaller(Signal.INT);
    assertTrue(terminator(s, reaped::add).terminate("job-2", null));
    assertEquals(List.of("job-2"), reaped);
    assertTrue(s.sent.isEmpty());
  }
}
