package com.m4brew.management.endpoints;

import com.m4brew.management.jobs.JobManager;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** {@code /api/history}: GET lists completed runs newest first, DELETE empties the ledger. */
public final class HistoryServlet extends HttpServlet {
  static final int DEFAULT_LIMIT = 50;

  private final JobManager jobs;

  public HistoryServlet(JobManager jobs) {
    this.jobs = jobs;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    int limit = DEFAULT_LIMIT;
    String raw = req.getParameter("limit");
    if (raw != null && !raw.isBlank()) {
      try {
        limit = Integer.parseInt(raw.trim());
      } catch (NumberFormatException e) {
        JsonResponses.error(resp, 400, "limit must be a number");
        return;
      }
      if (limit < 0) {
        JsonResponses.error(resp, 400, "limit must not be negative");
        return;
      }
    }
    JsonResponses.write(resp, 200, jobs.history(limit));
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    jobs.clearHistory();
    resp.setStatus(204);
  }
}
