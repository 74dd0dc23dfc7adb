package com.m4brew.management.process;

import java.io.IOException;
import java.util.Map;

/** Starts the external task with the given environment, stdout and stderr merged. */
@FunctionalInterface
public interface TaskLauncher {
  Process launch(Map<String, String> environment) throws IOException;
}
