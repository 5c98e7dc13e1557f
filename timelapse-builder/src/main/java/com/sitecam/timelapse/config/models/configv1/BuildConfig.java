package com.sitecam.timelapse.config.models.configv1;

import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_FETCH_PARALLELISM;
import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_MAX_CONCURRENT_BUILDS;
import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_RUN_INTERVAL_MINUTES;
import static com.sitecam.timelapse.constants.BuildConstants.WAIT_TIME_BEFORE_SHUTDOWN;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

@Builder(toBuilder = true)
@Getter
@Jacksonized
@EqualsAndHashCode
public class BuildConfig {
  @Builder.Default private JobRunMode jobRunMode = JobRunMode.ONCE;
  @Builder.Default private int runIntervalMinutes = DEFAULT_RUN_INTERVAL_MINUTES;

  // only the most recent N partitions are scheduled, plus the whole current week
  @Builder.Default private Optional<Integer> recencyBoundDays = Optional.empty();
  @Builder.Default private boolean forceFullWeekSet = false;
  @Builder.Default private boolean buildFull = false;
  @Builder.Default private boolean uploadEnabled = true;
  // forced rebuilds for late data in already aggregated weeks
  @Builder.Default private List<String> reprocessPartitionNames = Collections.emptyList();

  // eviction is disabled unless a retention window is configured
  @Builder.Default private Optional<Integer> retentionDays = Optional.empty();
  @Builder.Default private boolean evictRemoteDailyArtifacts = false;

  @Builder.Default private int fetchParallelism = DEFAULT_FETCH_PARALLELISM;
  @Builder.Default private int maxConcurrentBuilds = DEFAULT_MAX_CONCURRENT_BUILDS;
  @Builder.Default private int waitTimeBeforeShutdown = WAIT_TIME_BEFORE_SHUTDOWN;
  @Builder.Default private Optional<String> eventsFilePath = Optional.empty();

  public enum JobRunMode {
    CONTINUOUS,
    ONCE
  }
}
