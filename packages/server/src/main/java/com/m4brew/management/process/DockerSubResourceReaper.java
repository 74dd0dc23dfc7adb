package com.m4brew.management.process;

import com.m4brew.logging.LoggingService;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;

/** Removes helper containers the task started with {@code --label <label>=<jobId>}. */
public final class DockerSubResourceReaper implements SubResourceReaper {
  private static final Logger log = LoggingService.getLogger(DockerSubResourceReaper.class);

  private final String dockerBinary;
  private final String label;
  private final CommandRunner runner;

  public DockerSubResourceReaper(String dockerBinary, String label) {
    this.dockerBinary = dockerBinary;
    this.label = label;
    this.runner = new CommandRunner(Duration.ofSeconds(10));
  }

  @Override
  public void killSubResources(String jobId) {
    CommandRunner.Result ps =
        runner.run(
            List.of(dockerBinary, "ps", "-q", "--filter", "label=%s=%s".formatted(label, jobId)));
    if (!ps.ok()) {
      log.debug("docker ps for job {} exited with {}: {}", jobId, ps.exitCode(), ps.output());
      return;
    }
    List<String> ids =
        Arrays.stream(ps.output().split("\\s+")).filter(s -> !s.isBlank()).toList();
    if (ids.isEmpty()) {
      return;
    }

    List<String> rm = new ArrayList<>(List.of(dockerBinary, "rm", "-f"));
    rm.addAll(ids);
    CommandRunner.Result result = runner.run(rm);
    log.info("Removed {} container(s) of job {} (exit {})", ids.size(), jobId, result.exitCode());
  }
}
