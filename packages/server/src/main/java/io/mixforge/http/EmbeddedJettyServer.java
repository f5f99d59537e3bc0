package io.mixforge.http;

import io.mixforge.exception.ConfigException;
import io.mixforge.exception.ExceptionUtil;
import io.mixforge.exception.NetworkException;
import io.mixforge.logging.LoggingService;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;

/**
 * Jetty 12 server hosting the MixForge API under a single root {@link ServletContextHandler}.
 *
 * <p>Event streams hold a request thread for as long as the client stays connected, so the pool
 * size bounds the number of concurrent SSE subscribers plus regular requests. The connector idle
 * timeout has to stay above the event heartbeat or quiet streams get dropped by Jetty.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(EmbeddedJettyServer.class);

  /** Connector and pool settings read from the {@code http.*} keys. */
  public record Settings(String hostname, int port, int maxThreads, Duration idleTimeout) {
    public Settings {
      if (hostname == null || hostname.isBlank()) {
        throw new ConfigException("http.hostname must not be blank");
      }
      if (port < 0 || port > 65535) {
        throw new ConfigException("http.port must be between 0 and 65535, got " + port);
      }
      if (maxThreads < 8) {
        throw new ConfigException("http.max-threads must be at least 8, got " + maxThreads);
      }
      if (idleTimeout == null || idleTimeout.isNegative() || idleTimeout.isZero()) {
        throw new ConfigException("http.idle-timeout-seconds must be positive");
      }
      hostname = hostname.trim();
    }

    public static Settings from(Configuration config) {
      try {
        return new Settings(
            config.getString("http.hostname", "0.0.0.0"),
            config.getInt("http.port", 8080),
            config.getInt("http.max-threads", 200),
            Duration.ofSeconds(config.getLong("http.idle-timeout-seconds", 60L)));
      } catch (ConfigException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new ConfigException("Invalid http configuration", e);
      }
    }

    boolean bindsAllInterfaces() {
      return hostname.equals("0.0.0.0");
    }
  }

  private final Settings settings;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Settings settings) {
    this.settings = settings;
  }

  public EmbeddedJettyServer(Configuration configuration) {
    this(Settings.from(configuration));
  }

  /** Create the server and its root context; servlets are registered before {@link #start()}. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) return;
      try {
        QueuedThreadPool pool = new QueuedThreadPool(settings.maxThreads());
        pool.setDaemon(true);
        pool.setName("mixforge-http");
        Server s = new Server(pool);

        ServerConnector connector = new ServerConnector(s);
        if (!settings.bindsAllInterfaces()) {
          connector.setHost(settings.hostname());
        }
        connector.setPort(settings.port());
        connector.setIdleTimeout(settings.idleTimeout().toMillis());
        s.addConnector(connector);

        ServletContextHandler ctx = new ServletContextHandler();
        ctx.setContextPath("/");
        s.setHandler(ctx);

        server = s;
        contextHandler = ctx;
        log.debug(
            "HTTP server prepared for {}:{} ({} threads)",
            settings.hostname(),
            settings.port(),
            settings.maxThreads());
      } catch (RuntimeException e) {
        throw new NetworkException("Failed to initialize the HTTP server", e);
      }
    }
  }

  public void start() throws Exception {
    synchronized (lifecycleLock) {
      if (server == null) prepare();
      if (server.isStarted()) return;
      try {
        server.start();
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            ex ->
                new NetworkException(
                    "Failed to bind %s:%d".formatted(settings.hostname(), settings.port()), ex));
      }
      log.info("MixForge API listening on port {}", getPort());
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) return;
      try {
        server.setStopTimeout(2000);
        server.stop();
      } catch (Exception e) {
        // remaining services still have to stop
        log.error("Error stopping HTTP server", e);
      } finally {
        server = null;
        contextHandler = null;
      }
    }
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  /** The bound port once started, which differs from the configured one when that is 0. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
      }
      return settings.port();
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
