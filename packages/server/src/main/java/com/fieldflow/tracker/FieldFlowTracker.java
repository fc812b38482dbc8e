package com.fieldflow.tracker;

import com.fieldflow.tracker.exception.ExceptionUtil;
import com.fieldflow.tracker.exception.NetworkException;
import com.fieldflow.tracker.exception.StateException;
import com.fieldflow.tracker.http.EmbeddedJettyServer;
import com.fieldflow.tracker.http.OkHttpFactory;
import com.fieldflow.tracker.lifecycle.LifecycleController;
import com.fieldflow.tracker.logging.LoggingService;
import com.fieldflow.tracker.management.JobViews;
import com.fieldflow.tracker.management.ManagementServer;
import com.fieldflow.tracker.polling.JobRegistry;
import com.fieldflow.tracker.polling.PollingSettings;
import com.fieldflow.tracker.progress.CompositeProgressExtractor;
import com.fieldflow.tracker.progress.KeywordActivityDetector;
import com.fieldflow.tracker.remote.AutomationClient;
import com.fieldflow.tracker.remote.AutomationEndpoints;
import com.fieldflow.tracker.remote.OkHttpAutomationClient;
import com.fieldflow.tracker.scheduling.ExecutorTaskScheduler;
import com.fieldflow.tracker.store.DurableStateStore;
import com.fieldflow.tracker.store.FileKeyValueStore;
import com.fieldflow.tracker.store.InMemoryKeyValueStore;
import com.fieldflow.tracker.store.KeyValueStore;
import com.fieldflow.tracker.store.TrackerStateRepository;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Composition root. Wires configuration, logging, the state store, the automation client, the
 * scheduler, the registry, the lifecycle controller and the management API, then reconciles any
 * job left outstanding by the previous run.
 */
public class FieldFlowTracker {
  private static final Logger log = LoggingService.getLogger(FieldFlowTracker.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private ExecutorTaskScheduler scheduler;
  private OkHttpClient httpClient;
  private JobRegistry registry;
  private LifecycleController controller;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public FieldFlowTracker(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from application.yaml as early as possible
    LoggingService.applyConfiguration(configuration());
    Configuration config = configuration();

    this.scheduler = new ExecutorTaskScheduler("job-poller");

    AutomationEndpoints endpoints = AutomationEndpoints.fromConfiguration(config);
    this.httpClient = OkHttpFactory.create(endpoints.connectTimeout(), endpoints.readTimeout());
    AutomationClient client = new OkHttpAutomationClient(httpClient, endpoints);
    log.info("Automation service at {}", endpoints.baseUrl());

    this.registry =
        new JobRegistry(
            scheduler,
            client,
            PollingSettings.fromConfiguration(config),
            KeywordActivityDetector.fromConfiguration(config));

    TrackerStateRepository repository =
        new TrackerStateRepository(new DurableStateStore(createStore(config)));
    Duration retention = Duration.ofMillis(config.getLong("store.retention-ms", 86_400_000L));
    this.controller = new LifecycleController(scheduler, client, registry, repository, retention);

    if (config.getBoolean("http.enabled", true)) {
      this.httpServer = new EmbeddedJettyServer(config);
      httpServer.prepare();
      try {
        JobViews views = new JobViews(CompositeProgressExtractor.defaults(), registry, scheduler);
        new ManagementServer(
                httpServer,
                controller,
                views,
                Duration.ofMillis(config.getLong("http.request-timeout-ms", 15_000L)))
            .register();
        httpServer.start();
      } catch (Exception e) {
        shutdown();
        throw ExceptionUtil.rethrowIfUnchecked(
            e, ex -> new NetworkException("Could not start http server", ex));
      }
    }

    controller
        .reconcileOnResume()
        .whenComplete(
            (outcome, error) -> {
              if (error != null) {
                log.error("Reconciliation of the previous run failed", error);
              } else {
                log.info("Reconciliation finished: {}", outcome);
              }
            });
    controller.startHousekeeping(
        Duration.ofMillis(config.getLong("store.prune-interval-ms", 3_600_000L)));
  }

  private KeyValueStore createStore(Configuration config) {
    String type = config.getString("store.type", "file");
    if ("memory".equalsIgnoreCase(type)) {
      log.warn("Using in-memory state store, jobs will not survive a restart");
      return new InMemoryKeyValueStore();
    }
    Path path = Path.of(config.getString("store.path", "data/tracker-state.json"));
    log.info("Persisting tracker state to {}", path.toAbsolutePath());
    return new FileKeyValueStore(path);
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "fieldflow-shutdown-hook");
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

  /**
   * Release resources. Safe to call multiple times; executed only once. Running jobs are paused,
   * not stopped, so the next start picks them up again.
   */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    try {
      if (controller != null) {
        try {
          controller.suspend().get(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        } catch (Exception e) {
          log.warn("Could not suspend job tracking cleanly", e);
        }
      }
      if (httpServer != null) {
        httpServer.close();
      }
      if (scheduler != null) {
        scheduler.close();
      }
      if (httpClient != null) {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
      }
      log.info("FieldFlow tracker stopped");
    } finally {
      shutdownLatch.countDown();
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("FieldFlowTracker not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public LifecycleController controller() {
    return controller;
  }

  public JobRegistry registry() {
    return registry;
  }
}
