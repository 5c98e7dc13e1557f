package com.sitecam.timelapse.metrics;

import com.sitecam.timelapse.artifact_builder.models.ArtifactType;
import com.sitecam.timelapse.config.Config;
import com.sitecam.timelapse.config.ConfigProvider;
import com.sitecam.timelapse.constants.MetricsConstants.BuildFailureReasons;
import io.micrometer.core.instrument.Tag;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;
import javax.inject.Inject;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TimelapseBuilderMetrics {
  private static final Logger log = LoggerFactory.getLogger(TimelapseBuilderMetrics.class);

  private final Metrics metrics;
  private final Metrics.Gauge partitionsDiscoveredGaugeMetric;
  private final Config builderConfig;

  static final String METRICS_COMMON_PREFIX = "timelapse_";

  // Tag keys
  static final String CONFIG_VERSION_TAG_KEY = "config_version";
  static final String JOB_RUN_MODE_TAG_KEY = "job_run_mode";
  static final String ARTIFACT_TYPE_TAG_KEY = "artifact_type";
  static final String BUILD_FAILURE_REASON_TAG_KEY = "build_failure_reason";

  // Metrics
  static final String ARTIFACT_BUILT_COUNTER = METRICS_COMMON_PREFIX + "artifact_built";
  static final String ARTIFACT_SKIPPED_COUNTER = METRICS_COMMON_PREFIX + "artifact_skipped";
  static final String ARTIFACT_UPLOADED_COUNTER = METRICS_COMMON_PREFIX + "artifact_uploaded";
  static final String ARTIFACT_EVICTED_COUNTER = METRICS_COMMON_PREFIX + "artifact_evicted";
  static final String BUILD_FAILURE_COUNTER = METRICS_COMMON_PREFIX + "build_failure";
  static final String TIER_CHECK_FAILURE_COUNTER = METRICS_COMMON_PREFIX + "tier_check_failure";
  static final String RUN_SUCCESS_COUNTER = METRICS_COMMON_PREFIX + "run_success";
  static final String RUN_FAILURE_COUNTER = METRICS_COMMON_PREFIX + "run_failure";
  static final String RUN_DURATION_TIMER = METRICS_COMMON_PREFIX + "run_duration";

  @Inject
  public TimelapseBuilderMetrics(@Nonnull Metrics metrics, @Nonnull ConfigProvider configProvider) {
    this.metrics = metrics;
    this.builderConfig = configProvider.getConfig();
    this.partitionsDiscoveredGaugeMetric =
        metrics.gauge(
            PartitionsDiscoveredGaugeMetricsMetadata.NAME,
            PartitionsDiscoveredGaugeMetricsMetadata.DESCRIPTION,
            getDefaultTags());
  }

  public void setPartitionsDiscovered(long numPartitionsDiscovered) {
    partitionsDiscoveredGaugeMetric.setValue(numPartitionsDiscovered);
  }

  public void incrementArtifactBuiltCounter(ArtifactType artifactType) {
    metrics.increment(ARTIFACT_BUILT_COUNTER, getArtifactTags(artifactType));
  }

  public void incrementArtifactSkippedCounter(ArtifactType artifactType) {
    metrics.increment(ARTIFACT_SKIPPED_COUNTER, getArtifactTags(artifactType));
  }

  public void incrementArtifactUploadedCounter(ArtifactType artifactType) {
    metrics.increment(ARTIFACT_UPLOADED_COUNTER, getArtifactTags(artifactType));
  }

  public void incrementArtifactEvictedCounter() {
    metrics.increment(ARTIFACT_EVICTED_COUNTER, getArtifactTags(ArtifactType.DAILY));
  }

  public void incrementTierCheckFailureCounter() {
    metrics.increment(TIER_CHECK_FAILURE_COUNTER, getDefaultTags());
  }

  public void incrementBuildFailureCounter(
      BuildFailureReasons buildFailureReason, String failureReason) {
    List<Tag> tags = getDefaultTags();
    tags.add(Tag.of(BUILD_FAILURE_REASON_TAG_KEY, buildFailureReason.name()));
    metrics.increment(BUILD_FAILURE_COUNTER, tags);
    log.error(
        "Artifact build failed with reason: {} - {}", buildFailureReason.name(), failureReason);
  }

  public void incrementRunSuccessCounter() {
    metrics.increment(RUN_SUCCESS_COUNTER, getDefaultTags());
  }

  public void incrementRunFailureCounter() {
    metrics.increment(RUN_FAILURE_COUNTER, getDefaultTags());
  }

  public void recordRunDuration(Duration duration) {
    metrics.timer(RUN_DURATION_TIMER, duration, getDefaultTags());
  }

  private List<Tag> getArtifactTags(ArtifactType artifactType) {
    List<Tag> tags = getDefaultTags();
    tags.add(Tag.of(ARTIFACT_TYPE_TAG_KEY, artifactType.name()));
    return tags;
  }

  private List<Tag> getDefaultTags() {
    List<Tag> tags = new ArrayList<>();
    tags.add(Tag.of(CONFIG_VERSION_TAG_KEY, builderConfig.getVersion().toString()));
    tags.add(
        Tag.of(JOB_RUN_MODE_TAG_KEY, builderConfig.getBuildConfig().getJobRunMode().toString()));
    return tags;
  }

  @Getter
  private static class PartitionsDiscoveredGaugeMetricsMetadata {
    public static final String NAME = METRICS_COMMON_PREFIX + "discovered_partitions";
    public static final String DESCRIPTION = "Number of raw partitions discovered during a run";
  }
}
