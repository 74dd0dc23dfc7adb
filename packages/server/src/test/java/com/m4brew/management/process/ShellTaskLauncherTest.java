package com.m4brew.management.process;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.*;

class ShellTaskLauncherTest {

  @Test
  void startsInNewProcessGroupThroughSetsid() {
    assertEquals(
        List.of("setsid", "/bin/bash", "/scripts/m4brew.sh"),
        new ShellTaskLauncher("/bin/bash", "/scripts/m4brew.sh", true).command());
  }

  @Test
  void runsShellDirectlyWithoutProcessGroup() {
    assertEquals(
        List.of("/bin/sh", "task.sh"), new ShellTaskLauncher("/bin/sh", "task.sh", false).command());
  }
}
