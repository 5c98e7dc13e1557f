package com.sitecam.timelapse.artifact_builder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import com.sitecam.timelapse.artifact_builder.models.ArtifactBuildState;
import com.sitecam.timelapse.artifact_builder.models.ArtifactKey;
import com.sitecam.timelapse.artifact_builder.models.DailyArtifact;
import com.sitecam.timelapse.artifact_builder.models.ProcessingState;
import com.sitecam.timelapse.artifact_builder.models.RunReport;
import com.sitecam.timelapse.artifact_builder.models.WeekBucket;
import com.sitecam.timelapse.config.Config;
import com.sitecam.timelapse.config.models.configv1.BuildConfig;
import com.sitecam.timelapse.constants.MetricsConstants.BuildFailureReasons;
import com.sitecam.timelapse.exceptions.NoSuchKeyException;
import com.sitecam.timelapse.exceptions.ProcessingStateException;
import com.sitecam.timelapse.exceptions.TierUnavailableException;
import com.sitecam.timelapse.metrics.TimelapseBuilderMetrics;
import com.sitecam.timelapse.storage.LocalArtifactStore;
import com.sitecam.timelapse.storage.RemoteArtifactStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves artifacts between tiers. Promotes finished artifacts to the durable tier, keeps the
 * processing state there, publishes the public aliases and evicts daily artifacts whose week is
 * already durable.
 */
@Slf4j
@Singleton
public class SyncAndRetentionManager {
  private static final ObjectMapper STATE_MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .enable(SerializationFeature.INDENT_OUTPUT);

  private final RemoteArtifactStore remoteArtifactStore;
  private final LocalArtifactStore localArtifactStore;
  private final ArtifactKeys artifactKeys;
  private final TieredCacheResolver tieredCacheResolver;
  private final TimelapseBuilderMetrics timelapseBuilderMetrics;
  private final Clock clock;
  private final BuildConfig buildConfig;
  private final String stateObjectPath;

  private final Object stateWriteLock = new Object();
  // every state write runs after the previous one so read-modify-write cycles never interleave
  private CompletableFuture<ProcessingState> stateWriteChain =
      CompletableFuture.completedFuture(null);

  @Inject
  public SyncAndRetentionManager(
      @Nonnull RemoteArtifactStore remoteArtifactStore,
      @Nonnull LocalArtifactStore localArtifactStore,
      @Nonnull ArtifactKeys artifactKeys,
      @Nonnull TieredCacheResolver tieredCacheResolver,
      @Nonnull TimelapseBuilderMetrics timelapseBuilderMetrics,
      @Nonnull Clock clock,
      @Nonnull Config config) {
    this.remoteArtifactStore = remoteArtifactStore;
    this.localArtifactStore = localArtifactStore;
    this.artifactKeys = artifactKeys;
    this.tieredCacheResolver = tieredCacheResolver;
    this.timelapseBuilderMetrics = timelapseBuilderMetrics;
    this.clock = clock;
    this.buildConfig = config.getBuildConfig();
    this.stateObjectPath = config.getArtifactStoreConfig().getStateObjectPath();
  }

  /** Reads the durable processing state. A missing state object means a first run. */
  public CompletableFuture<ProcessingState> loadState() {
    return readDurableState()
        .thenApply(
            state -> {
              log.info(
                  "Loaded processing state with {} processed partitions",
                  state.getProcessedPartitionNames().size());
              return state;
            });
  }

  /**
   * Records a partition as processed. The durable copy is re-read before every write and merged
   * with {@code knownState}, so entries written by earlier runs or concurrent builds survive.
   */
  public CompletableFuture<ProcessingState> recordProcessed(
      ProcessingState knownState, String partitionName, LocalDate partitionDate) {
    return updateState(
        knownState,
        state -> state.withProcessed(partitionName, partitionDate),
        partitionName + " as processed");
  }

  /** Records the partitions the durable weekly artifact of {@code mondayDate} was built from. */
  public CompletableFuture<ProcessingState> recordWeekCoverage(
      ProcessingState knownState, LocalDate mondayDate, Collection<String> partitionNames) {
    return updateState(
        knownState,
        state -> state.withWeekCoverage(mondayDate, partitionNames),
        "coverage of week " + mondayDate);
  }

  private CompletableFuture<ProcessingState> updateState(
      ProcessingState knownState, UnaryOperator<ProcessingState> update, String description) {
    if (!buildConfig.isUploadEnabled()) {
      log.info("Upload disabled, keeping {} in memory", description);
      return CompletableFuture.completedFuture(update.apply(knownState));
    }
    synchronized (stateWriteLock) {
      CompletableFuture<ProcessingState> write =
          stateWriteChain
              .handle((previous, previousFailure) -> previous)
              .thenCompose(
                  ignored ->
                      readDurableState()
                          .thenCompose(
                              durableState -> {
                                ProcessingState updated =
                                    update.apply(durableState.merge(knownState));
                                return remoteArtifactStore
                                    .putBytes(stateObjectPath, serialize(updated))
                                    .thenApply(written -> updated);
                              }))
              .exceptionally(
                  throwable -> {
                    Throwable cause = ArtifactBuilderUtils.unwrap(throwable);
                    if (cause instanceof ProcessingStateException) {
                      throw (ProcessingStateException) cause;
                    }
                    throw new ProcessingStateException("Failed to record " + description, cause);
                  });
      stateWriteChain = write;
      return write;
    }
  }

  /** Copies a locally published artifact to the durable tier. */
  public CompletableFuture<Void> promote(ArtifactKey key) {
    return publishFile(artifactKeys.localPath(key), artifactKeys.remotePath(key))
        .thenRun(
            () -> {
              if (buildConfig.isUploadEnabled()) {
                timelapseBuilderMetrics.incrementArtifactUploadedCounter(key.getType());
              }
            });
  }

  public CompletableFuture<Void> publishAlias(ArtifactKey key, String aliasObjectPath) {
    return publishFile(artifactKeys.localPath(key), aliasObjectPath);
  }

  public CompletableFuture<Void> publishFile(Path localPath, String objectPath) {
    if (!buildConfig.isUploadEnabled()) {
      log.info(
          "Upload disabled, would upload {} to {}",
          localPath,
          remoteArtifactStore.locate(objectPath));
      return CompletableFuture.completedFuture(null);
    }
    return guardRemote(
        () -> remoteArtifactStore.put(objectPath, localPath), "upload " + objectPath);
  }

  public CompletableFuture<Void> publishBytes(byte[] content, String objectPath) {
    if (!buildConfig.isUploadEnabled()) {
      log.info("Upload disabled, would write {}", remoteArtifactStore.locate(objectPath));
      return CompletableFuture.completedFuture(null);
    }
    return guardRemote(
        () -> remoteArtifactStore.putBytes(objectPath, content), "write " + objectPath);
  }

  /**
   * A daily artifact may be dropped only when it is older than the retention window, its week has
   * ended, and the weekly artifact covering it is confirmed in the durable tier.
   */
  @VisibleForTesting
  static boolean isEvictionEligible(
      LocalDate artifactDate,
      LocalDate today,
      int retentionDays,
      boolean weeklyArtifactDurable,
      boolean inCurrentWeek) {
    return weeklyArtifactDurable
        && !inCurrentWeek
        && ChronoUnit.DAYS.between(artifactDate, today) > retentionDays;
  }

  /**
   * Evicts eligible daily artifacts. Only dailies the week's durable weekly artifact was recorded
   * as built from are evicted. Returns the evicted keys; a failed deletion is reported.
   */
  public CompletableFuture<List<ArtifactKey>> evict(
      Collection<WeekBucket> buckets, ProcessingState processingState, RunReport.Collector report) {
    Optional<Integer> retentionDays = buildConfig.getRetentionDays();
    if (!retentionDays.isPresent()) {
      return CompletableFuture.completedFuture(new ArrayList<>());
    }
    LocalDate today = LocalDate.now(clock);
    ConcurrentLinkedQueue<ArtifactKey> evicted = new ConcurrentLinkedQueue<>();
    List<CompletableFuture<Void>> weekFutures = new ArrayList<>();
    for (WeekBucket bucket : buckets) {
      List<DailyArtifact> aged =
          bucket.getMembers().stream()
              .filter(this::hasCopyToEvict)
              .filter(
                  member ->
                      isEvictionEligible(
                          member.getDate(),
                          today,
                          retentionDays.get(),
                          true,
                          bucket.isCurrentWeek()))
              .filter(member -> isCoveredByWeekly(member, bucket, processingState))
              .collect(Collectors.toList());
      if (aged.isEmpty()) {
        continue;
      }
      weekFutures.add(
          tieredCacheResolver
              .checkRemote(ArtifactKeys.weeklyKey(bucket.getMondayDate()))
              .thenCompose(
                  weeklyDurable -> {
                    if (!weeklyDurable) {
                      log.info(
                          "Keeping dailies of week {}: weekly artifact is not durable",
                          bucket.getMondayDate());
                      return CompletableFuture.completedFuture(null);
                    }
                    List<CompletableFuture<Void>> evictions = new ArrayList<>();
                    for (DailyArtifact member : aged) {
                      if (isEvictionEligible(
                          member.getDate(),
                          today,
                          retentionDays.get(),
                          weeklyDurable,
                          bucket.isCurrentWeek())) {
                        evictions.add(evictDaily(member, evicted, report));
                      }
                    }
                    return CompletableFuture.allOf(evictions.toArray(new CompletableFuture[0]));
                  }));
    }
    return CompletableFuture.allOf(weekFutures.toArray(new CompletableFuture[0]))
        .thenApply(ignored -> new ArrayList<>(evicted));
  }

  private boolean hasCopyToEvict(DailyArtifact member) {
    if (member.getState() == ArtifactBuildState.RETIRED) {
      return false;
    }
    return localArtifactStore.exists(artifactKeys.localPath(member.getKey())) || evictsRemote();
  }

  private static boolean isCoveredByWeekly(
      DailyArtifact member, WeekBucket bucket, ProcessingState processingState) {
    if (processingState.isCovered(bucket.getMondayDate(), member.getPartitionName())) {
      return true;
    }
    log.info(
        "Keeping {}: the weekly artifact of {} is not recorded as containing it",
        member.getKey(),
        bucket.getMondayDate());
    return false;
  }

  private boolean evictsRemote() {
    return buildConfig.isEvictRemoteDailyArtifacts() && buildConfig.isUploadEnabled();
  }

  private CompletableFuture<Void> evictDaily(
      DailyArtifact member, Collection<ArtifactKey> evicted, RunReport.Collector report) {
    localArtifactStore.delete(artifactKeys.localPath(member.getKey()));
    // deleting a missing remote object is a no-op
    CompletableFuture<Void> remoteDeletion =
        evictsRemote()
            ? guardRemote(
                () -> remoteArtifactStore.delete(artifactKeys.remotePath(member.getKey())),
                "delete " + member.getKey())
            : CompletableFuture.completedFuture(null);
    return remoteDeletion.handle(
        (ignored, throwable) -> {
          if (throwable != null) {
            report.recordFailure(
                member.getKey(),
                BuildFailureReasons.TIER_UNAVAILABLE,
                ArtifactBuilderUtils.describe(throwable));
            timelapseBuilderMetrics.incrementBuildFailureCounter(
                BuildFailureReasons.TIER_UNAVAILABLE, ArtifactBuilderUtils.describe(throwable));
            return null;
          }
          log.info("Evicted {}", member.getKey());
          evicted.add(member.getKey());
          report.recordEvicted(member.getKey());
          timelapseBuilderMetrics.incrementArtifactEvictedCounter();
          return null;
        });
  }

  private CompletableFuture<ProcessingState> readDurableState() {
    CompletableFuture<byte[]> readFuture;
    try {
      readFuture = remoteArtifactStore.get(stateObjectPath);
    } catch (RuntimeException e) {
      readFuture = CompletableFuture.failedFuture(e);
    }
    return readFuture.handle(
        (content, throwable) -> {
          if (throwable != null) {
            Throwable cause = ArtifactBuilderUtils.unwrap(throwable);
            if (cause instanceof NoSuchKeyException) {
              log.info("No processing state at {}, starting fresh", stateObjectPath);
              return ProcessingState.empty();
            }
            throw new ProcessingStateException(
                "Failed to read processing state from " + stateObjectPath, cause);
          }
          return deserialize(content);
        });
  }

  @VisibleForTesting
  static byte[] serialize(ProcessingState state) {
    try {
      return STATE_MAPPER.writeValueAsBytes(state);
    } catch (IOException e) {
      throw new ProcessingStateException("Failed to serialize processing state", e);
    }
  }

  @VisibleForTesting
  static ProcessingState deserialize(byte[] content) {
    try {
      return STATE_MAPPER.readValue(content, ProcessingState.class);
    } catch (IOException e) {
      throw new ProcessingStateException("Processing state is corrupt", e);
    }
  }

  private interface RemoteCall {
    CompletableFuture<Void> call();
  }

  private static CompletableFuture<Void> guardRemote(RemoteCall remoteCall, String description) {
    CompletableFuture<Void> callFuture;
    try {
      callFuture = remoteCall.call();
    } catch (RuntimeException e) {
      callFuture = CompletableFuture.failedFuture(e);
    }
    return callFuture.exceptionally(
        throwable -> {
          throw new TierUnavailableException(
              "Failed to " + description, ArtifactBuilderUtils.unwrap(throwable));
        });
  }
}
