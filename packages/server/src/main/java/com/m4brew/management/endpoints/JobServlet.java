package com.m4brew.management.endpoints;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.m4brew.exception.ValidationException;
import com.m4brew.logging.LoggingService;
import com.m4brew.management.jobs.JobManager;
import com.m4brew.management.jobs.JobMode;
import com.m4brew.management.jobs.JobParameters;
import com.m4brew.management.jobs.StartResult;
import com.m4brew.settings.Settings;
import com.m4brew.settings.SettingsService;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;

/**
 * {@code /api/job}: GET returns the job view, POST starts a job, DELETE clears a finished one.
 *
 * <p>Start parameters are the saved settings with any {@code root_folder}, {@code audio_mode} or
 * {@code bitrate} from the request body laid over them.
 */
public final class JobServlet extends HttpServlet {
  private static final Logger log = LoggingService.getLogger(JobServlet.class);

  private final JobManager jobs;
  private final SettingsService settings;

  public JobServlet(JobManager jobs, SettingsService settings) {
    this.jobs = jobs;
    this.settings = settings;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    var view = jobs.status();
    if (view.isEmpty()) {
      ObjectNode none = JsonResponses.MAPPER.createObjectNode();
      none.put("status", "none");
      JsonResponses.write(resp, 200, none);
      return;
    }
    JsonResponses.write(resp, 200, view.get());
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    ObjectNode body;
    try {
      body = JsonResponses.readObject(req);
    } catch (IOException e) {
      JsonResponses.error(resp, 400, "Malformed request body");
      return;
    }

    JobMode mode = JobMode.parseOrDefault(text(body, "mode"));
    boolean dryRun = body.path("dry_run").asBoolean(false);

    Settings saved = settings.load();
    JobParameters parameters =
        new JobParameters(
            firstNonBlank(text(body, "root_folder"), saved.rootFolder()),
            audioMode(text(body, "audio_mode"), saved.audioMode()),
            bitrate(body, saved.bitrate()));

    StartResult result;
    try {
      result = jobs.start(mode, dryRun, parameters);
    } catch (ValidationException e) {
      JsonResponses.error(resp, 400, e);
      return;
    }
    if (!result.accepted()) {
      JsonResponses.write(resp, 409, result.job());
      return;
    }
    try {
      settings.update(new Settings(null, null, null, mode, dryRun));
    } catch (RuntimeException e) {
      log.warn("Could not remember last run settings: {}", e.getMessage());
    }
    JsonResponses.write(resp, 202, result.job());
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    if (!jobs.clear()) {
      JsonResponses.error(resp, 409, "A job is still running");
      return;
    }
    resp.setStatus(204);
  }

  private static String text(JsonNode body, String field) {
    JsonNode node = body.get(field);
    return node == null || node.isNull() ? null : node.asText();
  }

  private static String audioMode(String requested, String fallback) {
    return SettingsService.isAllowedAudioMode(requested) ? requested : fallback;
  }

  private static Integer bitrate(JsonNode body, Integer fallback) {
    JsonNode node = body.get("bitrate");
    if (node == null || node.isNull()) return fallback;
    int requested = node.asInt(-1);
    return SettingsService.isAllowedBitrate(requested) ? requested : fallback;
  }

  private static String firstNonBlank(String preferred, String fallback) {
    return preferred != null && !preferred.isBlank() ? preferred.strip() : fallback;
  }
}
