package com.sitecam.timelapse.artifact_builder;

import static com.sitecam.timelapse.constants.BuildConstants.CURRENT_WEEK_ALIAS;
import static com.sitecam.timelapse.constants.BuildConstants.FULL_ARTIFACT_FILE;
import static com.sitecam.timelapse.constants.BuildConstants.FULL_ARTIFACT_REMOTE_NAME;
import static com.sitecam.timelapse.constants.BuildConstants.FULL_ARTIFACT_REPORT_KEY;
import static com.sitecam.timelapse.constants.BuildConstants.LATEST_DAY_ALIAS;
import static com.sitecam.timelapse.constants.BuildConstants.METADATA_FILE;

import com.google.common.collect.Lists;
import com.google.inject.Inject;
import com.sitecam.timelapse.artifact_builder.models.ArtifactBuildState;
import com.sitecam.timelapse.artifact_builder.models.ArtifactType;
import com.sitecam.timelapse.artifact_builder.models.DailyArtifact;
import com.sitecam.timelapse.artifact_builder.models.DailyBuildPlan;
import com.sitecam.timelapse.artifact_builder.models.ProcessingState;
import com.sitecam.timelapse.artifact_builder.models.RunOptions;
import com.sitecam.timelapse.artifact_builder.models.RunReport;
import com.sitecam.timelapse.artifact_builder.models.SourcePartition;
import com.sitecam.timelapse.artifact_builder.models.WeekBucket;
import com.sitecam.timelapse.artifact_builder.models.WeeklyArtifact;
import com.sitecam.timelapse.config.Config;
import com.sitecam.timelapse.constants.MetricsConstants.BuildFailureReasons;
import com.sitecam.timelapse.encoder.MediaEncoder;
import com.sitecam.timelapse.exceptions.ProcessingStateException;
import com.sitecam.timelapse.metrics.TimelapseBuilderMetrics;
import com.sitecam.timelapse.source.RawInputSource;
import com.sitecam.timelapse.storage.LocalArtifactStore;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one incremental build: plans and builds daily artifacts, aggregates them into weekly
 * artifacts, publishes the aliases, the optional full timelapse and the metadata document, and
 * finally evicts daily artifacts whose week is durable.
 */
@Slf4j
@Singleton
public class TimelapseBuildEngine {
  private final RawInputSource rawInputSource;
  private final IncrementalBuildScheduler incrementalBuildScheduler;
  private final TieredCacheResolver tieredCacheResolver;
  private final DailyArtifactBuilder dailyArtifactBuilder;
  private final WeeklyAggregator weeklyAggregator;
  private final SyncAndRetentionManager syncAndRetentionManager;
  private final MetadataPublisher metadataPublisher;
  private final MediaEncoder mediaEncoder;
  private final LocalArtifactStore localArtifactStore;
  private final CalendarPartitioner calendarPartitioner;
  private final TimelapseBuilderMetrics timelapseBuilderMetrics;
  private final Config config;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  @Inject
  public TimelapseBuildEngine(
      @Nonnull RawInputSource rawInputSource,
      @Nonnull IncrementalBuildScheduler incrementalBuildScheduler,
      @Nonnull TieredCacheResolver tieredCacheResolver,
      @Nonnull DailyArtifactBuilder dailyArtifactBuilder,
      @Nonnull WeeklyAggregator weeklyAggregator,
      @Nonnull SyncAndRetentionManager syncAndRetentionManager,
      @Nonnull MetadataPublisher metadataPublisher,
      @Nonnull MediaEncoder mediaEncoder,
      @Nonnull LocalArtifactStore localArtifactStore,
      @Nonnull CalendarPartitioner calendarPartitioner,
      @Nonnull TimelapseBuilderMetrics timelapseBuilderMetrics,
      @Nonnull Config config) {
    this.rawInputSource = rawInputSource;
    this.incrementalBuildScheduler = incrementalBuildScheduler;
    this.tieredCacheResolver = tieredCacheResolver;
    this.dailyArtifactBuilder = dailyArtifactBuilder;
    this.weeklyAggregator = weeklyAggregator;
    this.syncAndRetentionManager = syncAndRetentionManager;
    this.metadataPublisher = metadataPublisher;
    this.mediaEncoder = mediaEncoder;
    this.localArtifactStore = localArtifactStore;
    this.calendarPartitioner = calendarPartitioner;
    this.timelapseBuilderMetrics = timelapseBuilderMetrics;
    this.config = config;
  }

  /**
   * Completes with the run's report. Completes exceptionally only when the processing state
   * cannot be loaded or persisted.
   */
  public CompletableFuture<RunReport> runIncrementalBuild(RunOptions runOptions) {
    RunContext context = new RunContext(runOptions);
    return syncAndRetentionManager
        .loadState()
        .thenCompose(
            state -> {
              context.processingState.set(state);
              return listPartitions(context);
            })
        .thenCompose(
            partitions -> {
              if (!partitions.isPresent()) {
                return CompletableFuture.completedFuture(context.report.build());
              }
              context.partitions = partitions.get();
              return buildAll(context);
            });
  }

  /** Stops scheduling further keys. Builds already started run to completion. */
  public void cancel() {
    if (!cancelled.getAndSet(true)) {
      log.info("Cancellation requested, no further artifacts will be scheduled");
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  private CompletableFuture<Optional<List<SourcePartition>>> listPartitions(RunContext context) {
    String rootUri = config.getSourceConfig().getRootUri();
    CompletableFuture<List<SourcePartition>> listFuture;
    try {
      listFuture = rawInputSource.listPartitions(rootUri);
    } catch (RuntimeException e) {
      listFuture = CompletableFuture.failedFuture(e);
    }
    return listFuture
        .thenApply(
            partitions -> {
              log.info("Discovered {} raw partitions under {}", partitions.size(), rootUri);
              timelapseBuilderMetrics.setPartitionsDiscovered(partitions.size());
              return Optional.of(partitions);
            })
        .exceptionally(
            throwable -> {
              log.error("Failed to list raw partitions under {}", rootUri, throwable);
              recordFailure(
                  context,
                  rootUri,
                  ArtifactBuilderUtils.getBuildFailureReason(
                      throwable, BuildFailureReasons.FETCH_ERROR),
                  throwable);
              return Optional.empty();
            });
  }

  private CompletableFuture<RunReport> buildAll(RunContext context) {
    return tieredCacheResolver
        .inventoryDailyArtifacts()
        .thenCompose(
            inventory ->
                incrementalBuildScheduler.plan(
                    context.partitions,
                    inventory,
                    context.processingState.get(),
                    context.runOptions,
                    context.report))
        .thenCompose(
            plan -> {
              context.parsedPartitions =
                  plan.getArtifacts().stream()
                      .map(DailyArtifact::getSourcePartition)
                      .filter(Objects::nonNull)
                      .collect(Collectors.toList());
              return buildDailies(context, plan);
            })
        .thenCompose(
            dailies -> {
              context.availableDailies =
                  dailies.stream()
                      .filter(daily -> daily.getState().isAvailable())
                      .collect(Collectors.toList());
              context.coveredDailies =
                  dailies.stream()
                      .filter(
                          daily ->
                              daily.getState().isAvailable()
                                  || daily.getState() == ArtifactBuildState.RETIRED)
                      .collect(Collectors.toList());
              context.incompleteMondays =
                  dailies.stream()
                      .filter(
                          daily ->
                              !daily.getState().isAvailable()
                                  && daily.getState() != ArtifactBuildState.RETIRED)
                      .map(daily -> calendarPartitioner.weekAnchor(daily.getDate()))
                      .collect(Collectors.toSet());
              if (stopIfCancelled(context)) {
                return CompletableFuture.completedFuture(context.report.build());
              }
              context.buckets = weeklyAggregator.groupIntoWeeks(context.coveredDailies);
              return weeklyAggregator
                  .plan(context.buckets.values(), forcedMondays(context, dailies), context.report)
                  .thenCompose(weeklies -> buildWeeklies(context, weeklies))
                  .thenCompose(weeklies -> publishOutputs(context, weeklies))
                  .thenCompose(ignored -> evict(context))
                  .thenApply(ignored -> context.report.build());
            });
  }

  private CompletableFuture<List<DailyArtifact>> buildDailies(
      RunContext context, DailyBuildPlan plan) {
    List<DailyArtifact> toRebuild = plan.getArtifactsToRebuild();
    List<DailyArtifact> settled =
        plan.getArtifacts().stream()
            .filter(daily -> daily.getState() != ArtifactBuildState.REBUILD)
            .collect(Collectors.toList());
    log.info("Rebuilding {} daily artifacts", toRebuild.size());
    return runInBatches(context, toRebuild, daily -> buildDaily(context, daily))
        .thenApply(
            built -> {
              List<DailyArtifact> all = new ArrayList<>(settled);
              all.addAll(built);
              all.sort(IncrementalBuildScheduler.DAILY_ORDER);
              return all;
            });
  }

  private CompletableFuture<DailyArtifact> buildDaily(RunContext context, DailyArtifact daily) {
    return context
        .buildRegistry
        .runExclusively(daily.getKey(), () -> dailyArtifactBuilder.build(daily))
        .thenApply(
            path -> {
              context.report.recordBuilt(daily.getKey());
              timelapseBuilderMetrics.incrementArtifactBuiltCounter(ArtifactType.DAILY);
              return daily.toBuilder().state(ArtifactBuildState.BUILT).existsLocal(true).build();
            })
        .thenCompose(built -> promoteDaily(context, built))
        .exceptionally(
            throwable -> {
              rethrowIfFatal(throwable);
              recordFailure(
                  context,
                  daily.getKey().toString(),
                  ArtifactBuilderUtils.getBuildFailureReason(
                      throwable, BuildFailureReasons.UNKNOWN),
                  throwable);
              return daily.toBuilder().state(ArtifactBuildState.UNRESOLVED).build();
            });
  }

  /**
   * A built artifact that fails to promote stays usable locally for this run. Its state entry is
   * only written once it is durable.
   */
  private CompletableFuture<DailyArtifact> promoteDaily(RunContext context, DailyArtifact built) {
    return syncAndRetentionManager
        .promote(built.getKey())
        .thenCompose(
            promoted ->
                syncAndRetentionManager
                    .recordProcessed(
                        context.processingState.get(), built.getPartitionName(), built.getDate())
                    .thenAccept(
                        updated ->
                            context.processingState.accumulateAndGet(
                                updated, ProcessingState::merge)))
        .thenApply(
            ignored ->
                config.getBuildConfig().isUploadEnabled()
                    ? built.toBuilder()
                        .state(ArtifactBuildState.UPLOADED)
                        .existsRemote(true)
                        .build()
                    : built)
        .exceptionally(
            throwable -> {
              rethrowIfFatal(throwable);
              recordFailure(
                  context,
                  built.getKey().toString(),
                  ArtifactBuilderUtils.getBuildFailureReason(
                      throwable, BuildFailureReasons.TIER_UNAVAILABLE),
                  throwable);
              return built;
            });
  }

  /**
   * Weeks whose past weekly artifact must be rebuilt: a member was reprocessed, or a member built
   * in this run is missing from the weekly artifact recorded for its week. A week that already
   * lost evicted members keeps its weekly artifact, since a rebuild would drop them.
   */
  private Set<LocalDate> forcedMondays(RunContext context, List<DailyArtifact> dailies) {
    ProcessingState processingState = context.processingState.get();
    Set<LocalDate> retiredMondays =
        dailies.stream()
            .filter(daily -> daily.getState() == ArtifactBuildState.RETIRED)
            .map(daily -> calendarPartitioner.weekAnchor(daily.getDate()))
            .collect(Collectors.toSet());
    Set<LocalDate> forcedMondays = new HashSet<>();
    for (DailyArtifact daily : dailies) {
      if (daily.getState() != ArtifactBuildState.BUILT
          && daily.getState() != ArtifactBuildState.UPLOADED) {
        continue;
      }
      LocalDate monday = calendarPartitioner.weekAnchor(daily.getDate());
      if (!daily.isForced() && processingState.isCovered(monday, daily.getPartitionName())) {
        continue;
      }
      if (retiredMondays.contains(monday)) {
        log.warn(
            "Not rebuilding week {} for {}: some of its dailies were evicted",
            monday,
            daily.getKey());
      } else {
        forcedMondays.add(monday);
      }
    }
    return forcedMondays;
  }

  private CompletableFuture<List<WeeklyArtifact>> buildWeeklies(
      RunContext context, List<WeeklyArtifact> weeklies) {
    List<WeeklyArtifact> toRebuild =
        weeklies.stream()
            .filter(weekly -> weekly.getState() == ArtifactBuildState.REBUILD)
            .collect(Collectors.toList());
    List<WeeklyArtifact> settled =
        weeklies.stream()
            .filter(weekly -> weekly.getState() != ArtifactBuildState.REBUILD)
            .collect(Collectors.toList());
    log.info("Rebuilding {} weekly artifacts", toRebuild.size());
    return runInBatches(context, toRebuild, weekly -> buildWeekly(context, weekly))
        .thenCompose(
            built -> {
              if (!context.runOptions.isForceFullWeekSet()) {
                return CompletableFuture.completedFuture(built);
              }
              return runInBatches(context, settled, weekly -> refreshWeekly(context, weekly))
                  .thenApply(
                      refreshed -> {
                        settled.clear();
                        settled.addAll(refreshed);
                        return built;
                      });
            })
        .thenApply(
            built -> {
              List<WeeklyArtifact> all = new ArrayList<>(settled);
              all.addAll(built);
              return all;
            });
  }

  private CompletableFuture<WeeklyArtifact> buildWeekly(RunContext context, WeeklyArtifact weekly) {
    WeekBucket bucket = context.buckets.get(weekly.getMondayDate());
    return context
        .buildRegistry
        .runExclusively(weekly.getKey(), () -> weeklyAggregator.build(weekly, bucket))
        .thenApply(
            path -> {
              context.report.recordBuilt(weekly.getKey());
              timelapseBuilderMetrics.incrementArtifactBuiltCounter(ArtifactType.WEEKLY);
              return weekly.toBuilder().state(ArtifactBuildState.BUILT).existsLocal(true).build();
            })
        .thenCompose(
            built ->
                syncAndRetentionManager
                    .promote(built.getKey())
                    .thenCompose(promoted -> recordWeekCoverage(context, bucket))
                    .thenApply(
                        recorded ->
                            config.getBuildConfig().isUploadEnabled()
                                ? built.toBuilder()
                                    .state(ArtifactBuildState.UPLOADED)
                                    .existsRemote(true)
                                    .build()
                                : built)
                    .exceptionally(
                        throwable -> {
                          rethrowIfFatal(throwable);
                          recordFailure(
                              context,
                              built.getKey().toString(),
                              ArtifactBuilderUtils.getBuildFailureReason(
                                  throwable, BuildFailureReasons.TIER_UNAVAILABLE),
                              throwable);
                          return built;
                        }))
        .exceptionally(
            throwable -> {
              rethrowIfFatal(throwable);
              recordFailure(
                  context,
                  weekly.getKey().toString(),
                  ArtifactBuilderUtils.getBuildFailureReason(
                      throwable, BuildFailureReasons.UNKNOWN),
                  throwable);
              return weekly.toBuilder().state(ArtifactBuildState.UNRESOLVED).build();
            });
  }

  private CompletableFuture<Void> recordWeekCoverage(RunContext context, WeekBucket bucket) {
    List<String> memberNames =
        bucket.getMembers().stream()
            .map(DailyArtifact::getPartitionName)
            .collect(Collectors.toList());
    return syncAndRetentionManager
        .recordWeekCoverage(context.processingState.get(), bucket.getMondayDate(), memberNames)
        .thenAccept(
            updated ->
                context.processingState.updateAndGet(
                    state ->
                        state
                            .merge(updated)
                            .withWeekCoverage(bucket.getMondayDate(), memberNames)));
  }

  /** Pulls a durable past weekly artifact into the local tier and publishes it again. */
  private CompletableFuture<WeeklyArtifact> refreshWeekly(
      RunContext context, WeeklyArtifact weekly) {
    return tieredCacheResolver
        .materialize(weekly.getKey())
        .thenCompose(path -> syncAndRetentionManager.promote(weekly.getKey()))
        .thenApply(ignored -> weekly.toBuilder().existsLocal(true).build())
        .exceptionally(
            throwable -> {
              recordFailure(
                  context,
                  weekly.getKey().toString(),
                  ArtifactBuilderUtils.getBuildFailureReason(
                      throwable, BuildFailureReasons.TIER_UNAVAILABLE),
                  throwable);
              return weekly;
            });
  }

  private CompletableFuture<Void> publishOutputs(
      RunContext context, List<WeeklyArtifact> weeklies) {
    if (stopIfCancelled(context)) {
      return CompletableFuture.completedFuture(null);
    }
    List<WeeklyArtifact> availableWeeklies =
        weeklies.stream()
            .filter(weekly -> weekly.getState().isAvailable())
            .collect(Collectors.toList());
    List<CompletableFuture<Void>> outputs = new ArrayList<>();

    availableWeeklies.stream()
        .filter(WeeklyArtifact::isCurrentWeek)
        .findFirst()
        .ifPresent(
            currentWeek ->
                outputs.add(
                    guardOutput(
                        context,
                        CURRENT_WEEK_ALIAS,
                        () ->
                            tieredCacheResolver
                                .materialize(currentWeek.getKey())
                                .thenCompose(
                                    path ->
                                        syncAndRetentionManager.publishAlias(
                                            currentWeek.getKey(), CURRENT_WEEK_ALIAS)))));

    if (!context.availableDailies.isEmpty()) {
      DailyArtifact latestDaily =
          context.availableDailies.get(context.availableDailies.size() - 1);
      outputs.add(
          guardOutput(
              context,
              LATEST_DAY_ALIAS,
              () ->
                  tieredCacheResolver
                      .materialize(latestDaily.getKey())
                      .thenCompose(
                          path ->
                              syncAndRetentionManager.publishAlias(
                                  latestDaily.getKey(), LATEST_DAY_ALIAS))));
    }

    if (context.runOptions.isBuildFull()) {
      outputs.add(
          guardOutput(
              context, FULL_ARTIFACT_REPORT_KEY, () -> buildFull(context, availableWeeklies)));
    }

    outputs.add(
        guardOutput(
            context,
            METADATA_FILE,
            () ->
                metadataPublisher
                    .publishLatestImage(context.parsedPartitions)
                    .exceptionally(
                        throwable -> {
                          log.warn(
                              "Failed to publish the latest image: {}",
                              ArtifactBuilderUtils.describe(throwable));
                          return Optional.empty();
                        })
                    .thenCompose(
                        latestImage ->
                            metadataPublisher.publishMetadata(
                                metadataPublisher.buildMetadata(
                                    context.coveredDailies, availableWeeklies, latestImage)))));

    return CompletableFuture.allOf(outputs.toArray(new CompletableFuture[0]));
  }

  /**
   * Re-encodes every available weekly artifact, in week order, into the full timelapse. Weekly
   * artifacts still cover the days whose dailies were evicted.
   */
  private CompletableFuture<Void> buildFull(
      RunContext context, List<WeeklyArtifact> availableWeeklies) {
    if (availableWeeklies.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    List<CompletableFuture<Path>> weeklyPaths =
        availableWeeklies.stream()
            .sorted(Comparator.comparing(WeeklyArtifact::getMondayDate))
            .map(weekly -> tieredCacheResolver.materialize(weekly.getKey()))
            .collect(Collectors.toList());
    Path fullPath = localArtifactStore.resolve(FULL_ARTIFACT_FILE);
    Path tempPath = localArtifactStore.newTempPath(fullPath);
    return CompletableFuture.allOf(weeklyPaths.toArray(new CompletableFuture[0]))
        .thenCompose(
            ignored -> {
              localArtifactStore.prepareParent(fullPath);
              return mediaEncoder.concatenateAndReencode(
                  weeklyPaths.stream().map(CompletableFuture::join).collect(Collectors.toList()),
                  tempPath);
            })
        .thenCompose(
            encodedPath -> {
              localArtifactStore.publish(encodedPath, fullPath);
              context.report.recordBuilt(FULL_ARTIFACT_REPORT_KEY);
              return syncAndRetentionManager.publishFile(fullPath, FULL_ARTIFACT_REMOTE_NAME);
            })
        .whenComplete(
            (ignored, throwable) -> {
              if (throwable != null) {
                localArtifactStore.delete(tempPath);
              }
            });
  }

  private CompletableFuture<Void> evict(RunContext context) {
    if (stopIfCancelled(context)) {
      return CompletableFuture.completedFuture(null);
    }
    // a week missing a partition keeps its dailies so its weekly artifact can still be rebuilt
    List<WeekBucket> completeWeeks =
        context.buckets.values().stream()
            .filter(
                bucket -> {
                  if (context.incompleteMondays.contains(bucket.getMondayDate())) {
                    log.info(
                        "Keeping dailies of week {}: some of its partitions have no artifact",
                        bucket.getMondayDate());
                    return false;
                  }
                  return true;
                })
            .collect(Collectors.toList());
    return syncAndRetentionManager
        .evict(completeWeeks, context.processingState.get(), context.report)
        .thenAccept(
            evicted -> {
              if (!evicted.isEmpty()) {
                log.info("Evicted {} daily artifacts", evicted.size());
              }
            });
  }

  /**
   * Runs {@code task} over {@code work} in sequential batches of {@code maxConcurrentBuilds}
   * concurrent tasks. Items of batches not started because of cancellation are returned as is.
   */
  private <T> CompletableFuture<List<T>> runInBatches(
      RunContext context, List<T> work, Function<T, CompletableFuture<T>> task) {
    List<T> results = new ArrayList<>();
    CompletableFuture<Void> batchChain = CompletableFuture.completedFuture(null);
    for (List<T> batch :
        Lists.partition(work, config.getBuildConfig().getMaxConcurrentBuilds())) {
      batchChain =
          batchChain.thenCompose(
              ignored -> {
                if (stopIfCancelled(context)) {
                  results.addAll(batch);
                  return CompletableFuture.completedFuture(null);
                }
                List<CompletableFuture<T>> batchFutures =
                    batch.stream().map(task).collect(Collectors.toList());
                return CompletableFuture.allOf(batchFutures.toArray(new CompletableFuture[0]))
                    .thenAccept(
                        done -> batchFutures.forEach(future -> results.add(future.join())));
              });
    }
    return batchChain.thenApply(ignored -> results);
  }

  private CompletableFuture<Void> guardOutput(
      RunContext context, String outputKey, OutputStep outputStep) {
    CompletableFuture<Void> stepFuture;
    try {
      stepFuture = outputStep.run();
    } catch (RuntimeException e) {
      stepFuture = CompletableFuture.failedFuture(e);
    }
    return stepFuture.exceptionally(
        throwable -> {
          recordFailure(
              context,
              outputKey,
              ArtifactBuilderUtils.getBuildFailureReason(
                  throwable, BuildFailureReasons.UNKNOWN),
              throwable);
          return null;
        });
  }

  private interface OutputStep {
    CompletableFuture<Void> run();
  }

  private boolean stopIfCancelled(RunContext context) {
    if (cancelled.get()) {
      context.report.markCancelled();
      return true;
    }
    return false;
  }

  private void recordFailure(
      RunContext context, String key, BuildFailureReasons reason, Throwable throwable) {
    String message = ArtifactBuilderUtils.describe(throwable);
    log.error("Failed to produce {}", key, ArtifactBuilderUtils.unwrap(throwable));
    context.report.recordFailure(key, reason, message);
    timelapseBuilderMetrics.incrementBuildFailureCounter(reason, message);
  }

  private static void rethrowIfFatal(Throwable throwable) {
    Throwable cause = ArtifactBuilderUtils.unwrap(throwable);
    if (cause instanceof ProcessingStateException) {
      throw (ProcessingStateException) cause;
    }
  }

  /** Mutable state of a single run, confined to that run. */
  private static class RunContext {
    private final RunOptions runOptions;
    private final RunReport.Collector report = new RunReport.Collector();
    private final KeyedBuildRegistry buildRegistry = new KeyedBuildRegistry();
    private final AtomicReference<ProcessingState> processingState =
        new AtomicReference<>(ProcessingState.empty());
    private List<SourcePartition> partitions = new ArrayList<>();
    // partitions whose name carries a valid date
    private List<SourcePartition> parsedPartitions = new ArrayList<>();
    private List<DailyArtifact> availableDailies = new ArrayList<>();
    // available dailies plus evicted ones whose week is still durable
    private List<DailyArtifact> coveredDailies = new ArrayList<>();
    // weeks with a partition that failed or was left out of this run
    private Set<LocalDate> incompleteMondays = new HashSet<>();
    private SortedMap<LocalDate, WeekBucket> buckets;

    private RunContext(RunOptions runOptions) {
      this.runOptions = runOptions;
    }
  }
}
