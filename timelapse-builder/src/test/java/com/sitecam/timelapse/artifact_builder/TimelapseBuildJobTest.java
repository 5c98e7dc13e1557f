package com.sitecam.timelapse.artifact_builder;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.sitecam.timelapse.artifact_builder.models.RunOptions;
import com.sitecam.timelapse.artifact_builder.models.RunReport;
import com.sitecam.timelapse.config.Config;
import com.sitecam.timelapse.config.models.configv1.BuildConfig;
import com.sitecam.timelapse.constants.MetricsConstants.BuildFailureReasons;
import com.sitecam.timelapse.exceptions.ProcessingStateException;
import com.sitecam.timelapse.metrics.TimelapseBuilderMetrics;
import com.sitecam.timelapse.storage.AsyncStorageClient;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TimelapseBuildJobTest {
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2025-07-23T12:00:00Z"), ZoneOffset.UTC);

  @Mock private TimelapseBuildEngine mockEngine;
  @Mock private TimelapseBuilderMetrics mockMetrics;
  @Mock private AsyncStorageClient mockArtifactStorageClient;
  @Mock private ScheduledExecutorService mockScheduler;
  @Mock private Config config;
  @Captor private ArgumentCaptor<Runnable> runnableCaptor;
  @Captor private ArgumentCaptor<RunOptions> runOptionsCaptor;

  private TimelapseBuildJob job;

  @BeforeEach
  void setUp() {
    job =
        new TimelapseBuildJob(mockEngine, mockMetrics, mockArtifactStorageClient, CLOCK, config) {
          @Override
          ScheduledExecutorService getScheduler() {
            return mockScheduler;
          }
        };
  }

  private static RunReport.Collector successfulRun() {
    RunReport.Collector collector = new RunReport.Collector();
    collector.recordBuilt(ArtifactKeys.dailyKey("TLST04A00879_250723_0600"));
    return collector;
  }

  private static RunReport.Collector failedRun() {
    RunReport.Collector collector = successfulRun();
    collector.recordFailure(
        ArtifactKeys.dailyKey("TLST04A00879_250722_0600"),
        BuildFailureReasons.TIER_UNAVAILABLE,
        "upload failed");
    return collector;
  }

  @Test
  void testRunOncePassesRunOptions() {
    when(config.getBuildConfig())
        .thenReturn(
            BuildConfig.builder()
                .recencyBoundDays(Optional.of(3))
                .buildFull(true)
                .reprocessPartitionNames(
                    Collections.singletonList("TLST04A00879_250702_0600"))
                .build());
    when(mockEngine.runIncrementalBuild(runOptionsCaptor.capture()))
        .thenReturn(CompletableFuture.completedFuture(successfulRun().build()));

    RunReport report = job.runOnce();

    assertTrue(report.isSuccessful());
    RunOptions runOptions = runOptionsCaptor.getValue();
    assertEquals(Optional.of(3), runOptions.getRecencyBoundDays());
    assertTrue(runOptions.isBuildFull());
    assertFalse(runOptions.isForceFullWeekSet());
    assertEquals(
        Collections.singleton("TLST04A00879_250702_0600"), runOptions.getReprocessPartitionNames());
    verify(mockMetrics).incrementRunSuccessCounter();
    verify(mockMetrics).recordRunDuration(Duration.ZERO);
    verify(mockArtifactStorageClient, never()).refreshClient();
  }

  @Test
  void testRunWithFailuresRefreshesTheStorageClient() {
    when(config.getBuildConfig()).thenReturn(BuildConfig.builder().build());
    when(mockEngine.runIncrementalBuild(any()))
        .thenReturn(CompletableFuture.completedFuture(failedRun().build()));

    RunReport report = job.runOnce();

    assertFalse(report.isSuccessful());
    assertEquals(
        BuildFailureReasons.TIER_UNAVAILABLE,
        report.getFailures().get("daily/TLST04A00879_250722_0600").getReason());
    verify(mockMetrics).incrementRunFailureCounter();
    verify(mockMetrics, never()).incrementRunSuccessCounter();
    verify(mockArtifactStorageClient).refreshClient();
  }

  @Test
  void testCancelledRunIsNotSuccessful() {
    RunReport.Collector collector = successfulRun();
    collector.markCancelled();
    when(config.getBuildConfig()).thenReturn(BuildConfig.builder().build());
    when(mockEngine.runIncrementalBuild(any()))
        .thenReturn(CompletableFuture.completedFuture(collector.build()));

    assertFalse(job.runOnce().isSuccessful());

    verify(mockMetrics).incrementRunFailureCounter();
  }

  @Test
  void testAbortedRunIsRethrown() {
    CompletableFuture<RunReport> aborted = new CompletableFuture<>();
    aborted.completeExceptionally(
        new ProcessingStateException("state unreadable", new IOException("timeout")));
    when(config.getBuildConfig()).thenReturn(BuildConfig.builder().build());
    when(mockEngine.runIncrementalBuild(any())).thenReturn(aborted);

    CompletionException exception = assertThrows(CompletionException.class, () -> job.runOnce());

    assertInstanceOf(ProcessingStateException.class, exception.getCause());
    verify(mockMetrics).incrementRunFailureCounter();
    verify(mockMetrics).recordRunDuration(Duration.ZERO);
  }

  @Test
  void testRunInContinuousMode() {
    when(config.getBuildConfig())
        .thenReturn(
            BuildConfig.builder()
                .jobRunMode(BuildConfig.JobRunMode.CONTINUOUS)
                .runIntervalMinutes(30)
                .build());
    CompletableFuture<RunReport> aborted = new CompletableFuture<>();
    aborted.completeExceptionally(
        new ProcessingStateException("state unreadable", new IOException("timeout")));
    when(mockEngine.runIncrementalBuild(any()))
        .thenReturn(aborted)
        .thenReturn(CompletableFuture.completedFuture(successfulRun().build()));

    job.runInContinuousMode();

    verify(mockScheduler)
        .scheduleAtFixedRate(runnableCaptor.capture(), eq(0L), eq(30L), eq(TimeUnit.MINUTES));
    Runnable scheduledRun = runnableCaptor.getValue();
    // a failed run must leave the schedule in place
    assertDoesNotThrow(scheduledRun::run);
    scheduledRun.run();
    verify(mockEngine, times(2)).runIncrementalBuild(any());
    verify(mockMetrics).incrementRunFailureCounter();
    verify(mockMetrics).incrementRunSuccessCounter();
  }

  @Test
  void testScheduledRunIsSkippedOnceCancelled() {
    when(config.getBuildConfig()).thenReturn(BuildConfig.builder().build());
    when(mockEngine.isCancelled()).thenReturn(true);

    job.runInContinuousMode();
    verify(mockScheduler)
        .scheduleAtFixedRate(runnableCaptor.capture(), eq(0L), eq(60L), eq(TimeUnit.MINUTES));
    runnableCaptor.getValue().run();

    verify(mockEngine, never()).runIncrementalBuild(any());
  }

  @Test
  void testShutdown() {
    job.shutdown();

    verify(mockEngine).cancel();
    verify(mockScheduler).shutdown();
  }
}
