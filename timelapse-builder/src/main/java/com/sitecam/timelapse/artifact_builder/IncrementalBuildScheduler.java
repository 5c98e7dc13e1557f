package com.sitecam.timelapse.artifact_builder;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import com.sitecam.timelapse.artifact_builder.models.ArtifactBuildState;
import com.sitecam.timelapse.artifact_builder.models.ArtifactKey;
import com.sitecam.timelapse.artifact_builder.models.ArtifactType;
import com.sitecam.timelapse.artifact_builder.models.DailyArtifact;
import com.sitecam.timelapse.artifact_builder.models.DailyBuildPlan;
import com.sitecam.timelapse.artifact_builder.models.ProcessingState;
import com.sitecam.timelapse.artifact_builder.models.Resolution;
import com.sitecam.timelapse.artifact_builder.models.RunOptions;
import com.sitecam.timelapse.artifact_builder.models.RunReport;
import com.sitecam.timelapse.artifact_builder.models.SourcePartition;
import com.sitecam.timelapse.constants.MetricsConstants.BuildFailureReasons;
import com.sitecam.timelapse.exceptions.PartitionNameParseException;
import com.sitecam.timelapse.metrics.TimelapseBuilderMetrics;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides, per daily artifact, whether this run rebuilds it. The partition still being captured
 * is always rebuilt, everything else only when no tier holds a fresh copy.
 */
@Slf4j
public class IncrementalBuildScheduler {
  static final Comparator<DailyArtifact> DAILY_ORDER =
      Comparator.comparing(DailyArtifact::getDate).thenComparing(DailyArtifact::getPartitionName);
  private static final Comparator<SourcePartition> PARTITION_ORDER =
      Comparator.comparing(SourcePartition::getDate).thenComparing(SourcePartition::getName);

  private final CalendarPartitioner calendarPartitioner;
  private final TieredCacheResolver tieredCacheResolver;
  private final TimelapseBuilderMetrics timelapseBuilderMetrics;

  @Inject
  public IncrementalBuildScheduler(
      @Nonnull CalendarPartitioner calendarPartitioner,
      @Nonnull TieredCacheResolver tieredCacheResolver,
      @Nonnull TimelapseBuilderMetrics timelapseBuilderMetrics) {
    this.calendarPartitioner = calendarPartitioner;
    this.tieredCacheResolver = tieredCacheResolver;
    this.timelapseBuilderMetrics = timelapseBuilderMetrics;
  }

  public CompletableFuture<DailyBuildPlan> plan(
      List<SourcePartition> rawPartitions,
      Map<String, Resolution> artifactInventory,
      ProcessingState processingState,
      RunOptions runOptions,
      RunReport.Collector report) {
    List<SourcePartition> partitions = parsePartitions(rawPartitions, report);
    Optional<SourcePartition> currentPartition =
        partitions.isEmpty()
            ? Optional.empty()
            : Optional.of(partitions.get(partitions.size() - 1));
    Optional<LocalDate> currentMonday =
        currentPartition.map(partition -> calendarPartitioner.weekAnchor(partition.getDate()));
    Set<String> scheduledNames = selectScheduled(partitions, currentMonday, runOptions);
    Map<LocalDate, CompletableFuture<Boolean>> durableWeeks = new ConcurrentHashMap<>();

    List<CompletableFuture<DailyArtifact>> planFutures = new ArrayList<>();
    for (SourcePartition partition : partitions) {
      boolean isCurrent =
          currentPartition
              .map(current -> current.getName().equals(partition.getName()))
              .orElse(false);
      boolean forced = runOptions.getReprocessPartitionNames().contains(partition.getName());
      DailyArtifact candidate =
          DailyArtifact.builder()
              .key(ArtifactKeys.dailyKey(partition.getName()))
              .partitionName(partition.getName())
              .date(partition.getDate())
              .sourcePartition(partition)
              .isCurrent(isCurrent)
              .forced(forced)
              .build();
      if (scheduledNames.contains(partition.getName())) {
        planFutures.add(
            planScheduled(candidate, currentMonday, processingState, durableWeeks, report));
      } else {
        planFutures.add(planOutOfBound(candidate, report));
      }
    }

    Set<String> sourceNames =
        partitions.stream().map(SourcePartition::getName).collect(Collectors.toSet());
    List<DailyArtifact> artifactOnly = new ArrayList<>();
    artifactInventory.forEach(
        (partitionName, resolution) -> {
          if (!sourceNames.contains(partitionName)) {
            planArtifactOnly(partitionName, resolution, report).ifPresent(artifactOnly::add);
          }
        });

    return CompletableFuture.allOf(planFutures.toArray(new CompletableFuture[0]))
        .thenApply(
            ignored -> {
              List<DailyArtifact> artifacts = new ArrayList<>(artifactOnly);
              planFutures.forEach(future -> artifacts.add(future.join()));
              artifacts.sort(DAILY_ORDER);
              log.info(
                  "Planned {} daily artifacts, {} to rebuild",
                  artifacts.size(),
                  artifacts.stream()
                      .filter(artifact -> artifact.getState() == ArtifactBuildState.REBUILD)
                      .count());
              return DailyBuildPlan.builder()
                  .artifacts(artifacts)
                  .currentMonday(currentMonday)
                  .build();
            });
  }

  /**
   * Partitions with a parseable date, de-duplicated by name and ordered by date then name.
   * Unparseable partitions are reported and left out of every later step.
   */
  @VisibleForTesting
  List<SourcePartition> parsePartitions(
      List<SourcePartition> rawPartitions, RunReport.Collector report) {
    Map<String, SourcePartition> byName = new LinkedHashMap<>();
    for (SourcePartition rawPartition : rawPartitions) {
      if (byName.containsKey(rawPartition.getName())) {
        log.warn("Ignoring duplicate partition {}", rawPartition.getName());
        continue;
      }
      try {
        LocalDate date = calendarPartitioner.parseDate(rawPartition.getName());
        byName.put(rawPartition.getName(), rawPartition.toBuilder().date(date).build());
      } catch (PartitionNameParseException e) {
        report.recordFailure(
            ArtifactKeys.dailyKey(rawPartition.getName()),
            BuildFailureReasons.PARSE_ERROR,
            e.getMessage());
        timelapseBuilderMetrics.incrementBuildFailureCounter(
            BuildFailureReasons.PARSE_ERROR, e.getMessage());
      }
    }
    List<SourcePartition> partitions = new ArrayList<>(byName.values());
    partitions.sort(PARTITION_ORDER);
    return partitions;
  }

  /**
   * Names of the partitions this run may rebuild: the most recent {@code recencyBoundDays}
   * partitions, every partition of the current week, and every partition named for reprocessing.
   */
  @VisibleForTesting
  Set<String> selectScheduled(
      List<SourcePartition> partitions, Optional<LocalDate> currentMonday, RunOptions runOptions) {
    Set<String> scheduled = new HashSet<>();
    int bound = runOptions.getRecencyBoundDays().orElse(partitions.size());
    partitions
        .subList(Math.max(0, partitions.size() - bound), partitions.size())
        .forEach(partition -> scheduled.add(partition.getName()));
    currentMonday.ifPresent(
        monday ->
            partitions.stream()
                .filter(
                    partition ->
                        calendarPartitioner.weekAnchor(partition.getDate()).equals(monday))
                .forEach(partition -> scheduled.add(partition.getName())));
    Set<String> sourceNames =
        partitions.stream().map(SourcePartition::getName).collect(Collectors.toSet());
    for (String reprocessName : runOptions.getReprocessPartitionNames()) {
      if (sourceNames.contains(reprocessName)) {
        scheduled.add(reprocessName);
      } else {
        log.warn("Cannot reprocess {}: no such raw partition", reprocessName);
      }
    }
    return scheduled;
  }

  private CompletableFuture<DailyArtifact> planScheduled(
      DailyArtifact candidate,
      Optional<LocalDate> currentMonday,
      ProcessingState processingState,
      Map<LocalDate, CompletableFuture<Boolean>> durableWeeks,
      RunReport.Collector report) {
    return tieredCacheResolver
        .resolve(candidate.getKey(), candidate.isCurrent() || candidate.isForced())
        .thenCompose(
            resolution -> {
              DailyArtifact resolved =
                  candidate.toBuilder()
                      .existsLocal(resolution.isExistsLocal())
                      .existsRemote(resolution.isExistsRemote())
                      .build();
              if (resolution.getState().isFresh()) {
                return CompletableFuture.completedFuture(skip(resolved, report));
              }
              if (!mayBeRetired(resolved, currentMonday, processingState)) {
                return CompletableFuture.completedFuture(
                    resolved.toBuilder().state(ArtifactBuildState.REBUILD).build());
              }
              LocalDate monday = calendarPartitioner.weekAnchor(resolved.getDate());
              return durableWeeks
                  .computeIfAbsent(
                      monday,
                      key -> tieredCacheResolver.checkRemote(ArtifactKeys.weeklyKey(key)))
                  .thenApply(
                      weeklyDurable -> {
                        if (weeklyDurable) {
                          log.debug(
                              "{} was evicted after its week became durable", resolved.getKey());
                          report.recordSkipped(resolved.getKey());
                          return resolved.toBuilder().state(ArtifactBuildState.RETIRED).build();
                        }
                        return resolved.toBuilder().state(ArtifactBuildState.REBUILD).build();
                      });
            });
  }

  /**
   * A processed past-week daily with no copy left may have been evicted on purpose, but only once
   * its week's weekly artifact was recorded as containing it.
   */
  private boolean mayBeRetired(
      DailyArtifact artifact, Optional<LocalDate> currentMonday, ProcessingState processingState) {
    return !artifact.isCurrent()
        && !artifact.isForced()
        && processingState.isProcessed(artifact.getPartitionName())
        && processingState.isCovered(
            calendarPartitioner.weekAnchor(artifact.getDate()), artifact.getPartitionName())
        && currentMonday.map(monday -> artifact.getDate().isBefore(monday)).orElse(false);
  }

  private CompletableFuture<DailyArtifact> planOutOfBound(
      DailyArtifact candidate, RunReport.Collector report) {
    return tieredCacheResolver
        .resolve(candidate.getKey(), false)
        .thenApply(
            resolution -> {
              DailyArtifact resolved =
                  candidate.toBuilder()
                      .existsLocal(resolution.isExistsLocal())
                      .existsRemote(resolution.isExistsRemote())
                      .build();
              if (resolution.getState().isFresh()) {
                return skip(resolved, report);
              }
              report.recordOutOfBound(resolved.getKey());
              return resolved.toBuilder().state(ArtifactBuildState.OUT_OF_BOUND).build();
            });
  }

  private Optional<DailyArtifact> planArtifactOnly(
      String partitionName, Resolution resolution, RunReport.Collector report) {
    LocalDate date;
    try {
      date = calendarPartitioner.parseDate(partitionName);
    } catch (PartitionNameParseException e) {
      log.debug("Ignoring unrecognised daily artifact {}", partitionName);
      return Optional.empty();
    }
    ArtifactKey key = ArtifactKeys.dailyKey(partitionName);
    log.debug("{} has no raw partition left, keeping the existing artifact", key);
    return Optional.of(
        skip(
            DailyArtifact.builder()
                .key(key)
                .partitionName(partitionName)
                .date(date)
                .existsLocal(resolution.isExistsLocal())
                .existsRemote(resolution.isExistsRemote())
                .build(),
            report));
  }

  private DailyArtifact skip(DailyArtifact artifact, RunReport.Collector report) {
    report.recordSkipped(artifact.getKey());
    timelapseBuilderMetrics.incrementArtifactSkippedCounter(ArtifactType.DAILY);
    return artifact.toBuilder().state(ArtifactBuildState.SKIP).build();
  }
}
