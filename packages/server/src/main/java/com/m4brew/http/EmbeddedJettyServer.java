package com.m4brew.http;

import com.m4brew.exception.ExceptionUtil;
import com.m4brew.exception.NetworkException;
import com.m4brew.logging.LoggingService;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>Owns the Jetty lifecycle and exposes the context handler so the control endpoints can be
 * registered before {@link #start()}.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(EmbeddedJettyServer.class);
  private static final long STOP_TIMEOUT_MILLIS = 2000;

  private final String hostname;
  private final int port;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  /**
   * @param hostname interface to bind, {@code 0.0.0.0} for all
   * @param port port to bind, {@code 0} for an ephemeral one
   */
  public EmbeddedJettyServer(String hostname, int port) {
    this.hostname = hostname;
    this.port = port;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }
      try {
        QueuedThreadPool threadPool = new QueuedThreadPool();
        threadPool.setDaemon(true);
        threadPool.setName("m4brew-http");
        server = new Server(threadPool);

        ServerConnector connector = new ServerConnector(server);
        if (!"0.0.0.0".equals(hostname)) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        throw new NetworkException("Failed to initialize the http server", e);
      }
    }
  }

  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return;
      }
      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }
      try {
        server.start();
        log.info("Listening on http://{}:{}", hostname, getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            ex ->
                new NetworkException(
                    "Could not start the http server on %s:%d, check that the port is free"
                        .formatted(hostname, port),
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) return;
      Server s = server;
      try {
        if (s.isStarted() || s.isStarting()) {
          s.setStopTimeout(STOP_TIMEOUT_MILLIS);
          s.stop();
        }
      } catch (Exception e) {
        log.error("Error stopping the http server", e);
      } finally {
        server = null;
        contextHandler = null;
      }
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return server.getURI().getPort();
      }
      return port;
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
