package com.m4brew.management.endpoints;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.m4brew.management.jobs.JobManager;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** POST /api/job/cancel: asks the active job to stop. Idempotent. */
public final class JobCancelServlet extends HttpServlet {
  private final JobManager jobs;

  public JobCancelServlet(JobManager jobs) {
    this.jobs = jobs;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    ObjectNode node = JsonResponses.MAPPER.createObjectNode();
    node.put("canceled", jobs.requestCancel());
    JsonResponses.write(resp, 202, node);
  }
}
