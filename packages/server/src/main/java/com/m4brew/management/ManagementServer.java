package com.m4brew.management;

import com.m4brew.management.endpoints.HistoryServlet;
import com.m4brew.management.endpoints.JobCancelServlet;
import com.m4brew.management.endpoints.JobOutputServlet;
import com.m4brew.management.endpoints.JobServlet;
import com.m4brew.management.endpoints.SettingsServlet;
import com.m4brew.management.jobs.JobManager;
import com.m4brew.settings.SettingsService;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/** Registers the control endpoints on a servlet context. */
public final class ManagementServer {

  private final JobManager jobs;
  private final SettingsService settings;

  public ManagementServer(JobManager jobs, SettingsService settings) {
    this.jobs = jobs;
    this.settings = settings;
  }

  public void register(ServletContextHandler ctx) {
    ctx.addServlet(new ServletHolder(new JobServlet(jobs, settings)), "/api/job");
    ctx.addServlet(new ServletHolder(new JobCancelServlet(jobs)), "/api/job/cancel");
    ctx.addServlet(new ServletHolder(new JobOutputServlet(jobs)), "/job/output");
    ctx.addServlet(new ServletHolder(new HistoryServlet(jobs)), "/api/history");
    ctx.addServlet(new ServletHolder(new SettingsServlet(settings)), "/api/settings");
  }
}
