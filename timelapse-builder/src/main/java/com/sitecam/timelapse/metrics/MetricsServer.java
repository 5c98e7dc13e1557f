package com.sitecam.timelapse.metrics;

import static com.sitecam.timelapse.constants.MetricsConstants.PROMETHEUS_METRICS_SCRAPING_DISABLED;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.HTTPServer;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class MetricsServer {
  private final HTTPServer server;
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  public MetricsServer(CollectorRegistry registry, int port) {
    if (port == PROMETHEUS_METRICS_SCRAPING_DISABLED) {
      log.info("Metrics scraping is disabled");
      server = null;
      return;
    }
    try {
      server = initHttpServer(port, registry);
    } catch (IOException e) {
      throw new RuntimeException("Failed to start metrics server on port " + port, e);
    }
    log.info("Serving build metrics on port {}", server.getPort());
    Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown));
  }

  // daemon threads, so a single build run exits without waiting for the scrape endpoint
  static HTTPServer initHttpServer(int port, CollectorRegistry registry) throws IOException {
    return new HTTPServer.Builder()
        .withPort(port)
        .withRegistry(registry)
        .withDaemonThreads(true)
        .build();
  }

  public boolean isRunning() {
    return server != null && !stopped.get();
  }

  /** Stops the scrape endpoint. Safe to call from both the job and the shutdown hook. */
  public void shutdown() {
    if (server != null && stopped.compareAndSet(false, true)) {
      log.info("Shutting down metrics server");
      server.close();
    }
  }
}
