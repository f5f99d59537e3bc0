package io.mixforge;

import io.mixforge.api.ApiServer;
import io.mixforge.events.InMemoryProgressPublisher;
import io.mixforge.exception.ConfigException;
import io.mixforge.exception.NetworkException;
import io.mixforge.exception.StateException;
import io.mixforge.http.EmbeddedJettyServer;
import io.mixforge.jobs.JobManager;
import io.mixforge.jobs.JobRegistry;
import io.mixforge.jobs.JobRunner;
import io.mixforge.lifecycle.CleanupSweeper;
import io.mixforge.logging.LoggingService;
import io.mixforge.security.SecurePathValidator;
import io.mixforge.track.EntityStore;
import io.mixforge.track.InMemoryEntityStore;
import io.mixforge.transform.ProcessTransformationExecutor;
import io.mixforge.transform.SampledAudioDurationProbe;
import io.mixforge.upload.UploadLimits;
import io.mixforge.upload.UploadProgressTracker;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/** Wires the services together, starts the HTTP server and coordinates shutdown. */
public class MixForge {
  private static final Logger log = LoggingService.getLogger(MixForge.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private EmbeddedJettyServer httpServer;
  private EntityStore tracks;
  private InMemoryProgressPublisher publisher;
  private JobManager jobManager;
  private UploadProgressTracker uploads;
  private CleanupSweeper sweeper;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public MixForge(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from application.yaml as early as possible
    LoggingService.applyConfiguration(configuration());
    Configuration config = configuration();

    Path uploadsDir = directory(config, "paths.uploads", "uploads");
    Path resultsDir = directory(config, "paths.results", "results");
    SecurePathValidator pathValidator = new SecurePathValidator(List.of(uploadsDir, resultsDir));
    Clock clock = Clock.systemUTC();

    this.tracks = new InMemoryEntityStore();
    this.publisher = new InMemoryProgressPublisher();
    JobRegistry registry = new JobRegistry(tracks, publisher, pathValidator, clock);
    ProcessTransformationExecutor executor =
        new ProcessTransformationExecutor(
            config.getString("transform.python-executable", "python"),
            Path.of(config.getString("transform.script", "scripts/audioProcessor.py")),
            Path.of(config.getString("transform.working-dir", ".")));
    JobRunner runner =
        new JobRunner(registry, tracks, executor, new SampledAudioDurationProbe(), clock);
    this.jobManager =
        new JobManager(
            registry,
            runner,
            publisher,
            Duration.ofSeconds(config.getLong("jobs.deadline-seconds", 0L)));

    UploadLimits limits =
        new UploadLimits(
            config.getLong("upload.max-bytes", UploadLimits.DEFAULT_MAX_BYTES),
            config.getInt("upload.chunk-size", UploadLimits.DEFAULT_CHUNK_SIZE),
            new HashSet<>(
                config.getList(
                    String.class,
                    "upload.allowed-extensions",
                    List.copyOf(UploadLimits.DEFAULT_EXTENSIONS))));
    this.uploads = new UploadProgressTracker(limits, pathValidator, uploadsDir, clock);

    this.sweeper =
        new CleanupSweeper(
            registry,
            uploads,
            publisher,
            Duration.ofMinutes(config.getLong("jobs.cleanup.interval-minutes", 30L)),
            Duration.ofMinutes(config.getLong("jobs.cleanup.retention-minutes", 60L)),
            clock);
    sweeper.start();

    this.httpServer = new EmbeddedJettyServer(config);
    httpServer.prepare();
    try {
      new ApiServer(
              jobManager,
              tracks,
              uploads,
              sweeper,
              new ApiServer.Settings(
                  resultsDir,
                  config.getInt("jobs.max-versions", 3),
                  config.getString("events.admin-token", ""),
                  Duration.ofSeconds(config.getLong("events.heartbeat-seconds", 15L))))
          .register(httpServer.getContextHandler());
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw new NetworkException("Could not start http server", e);
    }
    log.info("MixForge ready (uploads: {}, results: {})", uploadsDir, resultsDir);
  }

  private static Path directory(Configuration config, String key, String fallback) {
    Path dir = Path.of(config.getString(key, fallback)).toAbsolutePath().normalize();
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      throw new ConfigException("Cannot create directory " + dir + " for " + key, e);
    }
    return dir;
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "mixforge-shutdown-hook");
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
    if (!shuttingDown.compareAndSet(false, true)) return;
    log.info("Shutting down");
    try {
      // live jobs are failed before their workers are interrupted
      closeAndLog("cleanup sweeper", sweeper);
      closeAndLog("job manager", jobManager);
      closeAndLog("progress publisher", publisher);
      closeAndLog("http server", httpServer);
    } finally {
      shutdownLatch.countDown();
    }
  }

  private static void closeAndLog(String name, AutoCloseable closeable) {
    if (closeable == null) return;
    try {
      closeable.close();
    } catch (Exception e) {
      log.warn("Error while closing {}", name, e);
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("MixForge not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public JobManager jobManager() {
    return jobManager;
  }

  public UploadProgressTracker uploads() {
    return uploads;
  }

  public EntityStore tracks() {
    return tracks;
  }
}
