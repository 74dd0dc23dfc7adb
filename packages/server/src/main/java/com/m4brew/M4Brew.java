package com.m4brew;

import com.m4brew.exception.ExceptionUtil;
import com.m4brew.exception.IoException;
import com.m4brew.exception.NetworkException;
import com.m4brew.exception.StateException;
import com.m4brew.http.EmbeddedJettyServer;
import com.m4brew.logging.LoggingService;
import com.m4brew.management.ManagementServer;
import com.m4brew.management.jobs.JobManager;
import com.m4brew.settings.SettingsService;
import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/** Composition root: reads configuration, wires the job manager and serves the control endpoints. */
public class M4Brew {
  private static final org.slf4j.Logger log = LoggingService.getLogger(M4Brew.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private M4BrewConfig config;
  private SettingsService settings;
  private JobManager jobManager;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public M4Brew(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    // Silence java.util.logging (used by some transitive dependencies).
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider =
        new ConfigurationProvider(startupParameters.configFile(), startupParameters.overrides());
    LoggingService.applyConfiguration(configurationProvider.config());
    this.config = M4BrewConfig.from(configurationProvider.config());

    try {
      Files.createDirectories(config.dataDir());
    } catch (IOException e) {
      throw new IoException("Cannot create data directory " + config.dataDir(), e);
    }

    this.settings = SettingsService.create(config);
    settings.load();
    this.jobManager = JobManager.create(config);
    jobManager
        .status()
        .ifPresent(job -> log.info("Last job {} is {}", job.id, job.status.wireName()));

    this.httpServer = new EmbeddedJettyServer(config.httpHostname(), config.httpPort());
    httpServer.prepare();
    try {
      new ManagementServer(jobManager, settings).register(httpServer.getContextHandler());
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new NetworkException("Could not start http server", ex));
    }
    log.info("m4brew controller ready, data in {}", config.dataDir());
  }

  /** Block until the JVM is asked to stop, then release resources. */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "m4brew-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        if (httpServer != null) httpServer.stop();
        if (jobManager != null) jobManager.close();
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  public M4BrewConfig config() {
    if (config == null) {
      throw new StateException("M4Brew not initialized. Call initialize() first.");
    }
    return config;
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public SettingsService settings() {
    return settings;
  }

  public JobManager jobManager() {
    return jobManager;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
