package com.sitecam.timelapse.artifact_builder;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import com.sitecam.timelapse.RuntimeModule.ArtifactObjectStorageAsyncClient;
import com.sitecam.timelapse.artifact_builder.models.RunOptions;
import com.sitecam.timelapse.artifact_builder.models.RunReport;
import com.sitecam.timelapse.config.Config;
import com.sitecam.timelapse.metrics.TimelapseBuilderMetrics;
import com.sitecam.timelapse.storage.AsyncStorageClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class TimelapseBuildJob {
  private final TimelapseBuildEngine timelapseBuildEngine;
  private final TimelapseBuilderMetrics timelapseBuilderMetrics;
  private final AsyncStorageClient artifactStorageClient;
  private final Clock clock;
  private final Config config;
  private final ScheduledExecutorService scheduler;

  @Inject
  public TimelapseBuildJob(
      @Nonnull TimelapseBuildEngine timelapseBuildEngine,
      @Nonnull TimelapseBuilderMetrics timelapseBuilderMetrics,
      @Nonnull @ArtifactObjectStorageAsyncClient AsyncStorageClient artifactStorageClient,
      @Nonnull Clock clock,
      @Nonnull Config config) {
    this.timelapseBuildEngine = timelapseBuildEngine;
    this.timelapseBuilderMetrics = timelapseBuilderMetrics;
    this.artifactStorageClient = artifactStorageClient;
    this.clock = clock;
    this.config = config;
    this.scheduler = getScheduler();
  }

  /*
   * runs an incremental build periodically at fixed intervals until shutdown
   */
  public void runInContinuousMode() {
    log.debug("Running timelapse builder in continuous mode");
    scheduler.scheduleAtFixedRate(
        this::runScheduled,
        0,
        config.getBuildConfig().getRunIntervalMinutes(),
        TimeUnit.MINUTES);
  }

  /*
   * Runs a single incremental build and blocks until it finishes
   */
  public RunReport runOnce() {
    Instant runStartTime = clock.instant();
    log.info("Running timelapse build starting at: {}", runStartTime);
    try {
      RunReport report =
          timelapseBuildEngine
              .runIncrementalBuild(RunOptions.fromBuildConfig(config.getBuildConfig()))
              .join();
      logReport(report);
      if (report.isSuccessful()) {
        log.info("Run Completed");
        timelapseBuilderMetrics.incrementRunSuccessCounter();
      } else {
        log.error("Run finished with {} failures", report.getFailures().size());
        timelapseBuilderMetrics.incrementRunFailureCounter();
        // expired sessions and throttling surface as failed uploads, a fresh client clears them
        artifactStorageClient.refreshClient();
      }
      return report;
    } catch (RuntimeException e) {
      log.error("Run aborted", ArtifactBuilderUtils.unwrap(e));
      timelapseBuilderMetrics.incrementRunFailureCounter();
      throw e;
    } finally {
      timelapseBuilderMetrics.recordRunDuration(Duration.between(runStartTime, clock.instant()));
    }
  }

  private void runScheduled() {
    if (timelapseBuildEngine.isCancelled()) {
      return;
    }
    try {
      runOnce();
    } catch (Exception e) {
      // a failed run must not cancel the schedule
      log.error("Scheduled run failed: {}", ArtifactBuilderUtils.describe(e));
    }
  }

  private static void logReport(RunReport report) {
    log.info(
        "Built {}, skipped {}, evicted {}, out of bound {}",
        report.getBuiltKeys().size(),
        report.getSkippedKeys().size(),
        report.getEvictedKeys().size(),
        report.getOutOfBoundKeys().size());
    log.debug("Built artifacts: {}", report.getBuiltKeys());
    report
        .getFailures()
        .forEach(
            (key, failure) ->
                log.warn("{} failed ({}): {}", key, failure.getReason(), failure.getMessage()));
    if (report.isCancelled()) {
      log.warn("Run was cancelled before all artifacts were scheduled");
    }
  }

  public void shutdown() {
    timelapseBuildEngine.cancel();
    scheduler.shutdown();
  }

  @VisibleForTesting
  ScheduledExecutorService getScheduler() {
    return Executors.newSingleThreadScheduledExecutor();
  }
}
