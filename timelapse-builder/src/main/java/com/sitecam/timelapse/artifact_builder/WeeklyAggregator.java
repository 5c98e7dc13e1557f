package com.sitecam.timelapse.artifact_builder;

import com.google.inject.Inject;
import com.sitecam.timelapse.artifact_builder.models.ArtifactBuildState;
import com.sitecam.timelapse.artifact_builder.models.ArtifactType;
import com.sitecam.timelapse.artifact_builder.models.DailyArtifact;
import com.sitecam.timelapse.artifact_builder.models.RunReport;
import com.sitecam.timelapse.artifact_builder.models.WeekBucket;
import com.sitecam.timelapse.artifact_builder.models.WeeklyArtifact;
import com.sitecam.timelapse.encoder.MediaEncoder;
import com.sitecam.timelapse.exceptions.EncodeException;
import com.sitecam.timelapse.metrics.TimelapseBuilderMetrics;
import com.sitecam.timelapse.storage.LocalArtifactStore;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class WeeklyAggregator {
  private final CalendarPartitioner calendarPartitioner;
  private final ArtifactKeys artifactKeys;
  private final TieredCacheResolver tieredCacheResolver;
  private final MediaEncoder mediaEncoder;
  private final LocalArtifactStore localArtifactStore;
  private final TimelapseBuilderMetrics timelapseBuilderMetrics;

  @Inject
  public WeeklyAggregator(
      @Nonnull CalendarPartitioner calendarPartitioner,
      @Nonnull ArtifactKeys artifactKeys,
      @Nonnull TieredCacheResolver tieredCacheResolver,
      @Nonnull MediaEncoder mediaEncoder,
      @Nonnull LocalArtifactStore localArtifactStore,
      @Nonnull TimelapseBuilderMetrics timelapseBuilderMetrics) {
    this.calendarPartitioner = calendarPartitioner;
    this.artifactKeys = artifactKeys;
    this.tieredCacheResolver = tieredCacheResolver;
    this.mediaEncoder = mediaEncoder;
    this.localArtifactStore = localArtifactStore;
    this.timelapseBuilderMetrics = timelapseBuilderMetrics;
  }

  /** Buckets keyed by Monday. The bucket with the latest Monday is the current week. */
  public SortedMap<LocalDate, WeekBucket> groupIntoWeeks(Collection<DailyArtifact> dailyArtifacts) {
    TreeMap<LocalDate, List<DailyArtifact>> membersByMonday =
        dailyArtifacts.stream()
            .collect(
                Collectors.groupingBy(
                    artifact -> calendarPartitioner.weekAnchor(artifact.getDate()),
                    TreeMap::new,
                    Collectors.toList()));
    SortedMap<LocalDate, WeekBucket> buckets = new TreeMap<>();
    if (membersByMonday.isEmpty()) {
      return buckets;
    }
    LocalDate currentMonday = membersByMonday.lastKey();
    membersByMonday.forEach(
        (monday, members) -> {
          List<DailyArtifact> orderedMembers = new ArrayList<>(members);
          orderedMembers.sort(IncrementalBuildScheduler.DAILY_ORDER);
          buckets.put(
              monday,
              WeekBucket.builder()
                  .mondayDate(monday)
                  .members(orderedMembers)
                  .isCurrentWeek(monday.equals(currentMonday))
                  .build());
        });
    return buckets;
  }

  public CompletableFuture<List<WeeklyArtifact>> plan(
      Collection<WeekBucket> buckets, Set<LocalDate> forcedMondays, RunReport.Collector report) {
    List<CompletableFuture<WeeklyArtifact>> planFutures = new ArrayList<>();
    for (WeekBucket bucket : buckets) {
      WeeklyArtifact candidate =
          WeeklyArtifact.builder()
              .key(ArtifactKeys.weeklyKey(bucket.getMondayDate()))
              .mondayDate(bucket.getMondayDate())
              .isCurrentWeek(bucket.isCurrentWeek())
              .build();
      boolean forced = bucket.isCurrentWeek() || forcedMondays.contains(bucket.getMondayDate());
      planFutures.add(
          tieredCacheResolver
              .resolve(candidate.getKey(), forced)
              .thenApply(
                  resolution -> {
                    WeeklyArtifact resolved =
                        candidate.toBuilder()
                            .existsLocal(resolution.isExistsLocal())
                            .existsRemote(resolution.isExistsRemote())
                            .build();
                    if (resolution.getState().isFresh()) {
                      report.recordSkipped(resolved.getKey());
                      timelapseBuilderMetrics.incrementArtifactSkippedCounter(ArtifactType.WEEKLY);
                      return resolved.toBuilder().state(ArtifactBuildState.SKIP).build();
                    }
                    return resolved.toBuilder().state(ArtifactBuildState.REBUILD).build();
                  }));
    }
    return CompletableFuture.allOf(planFutures.toArray(new CompletableFuture[0]))
        .thenApply(
            ignored ->
                planFutures.stream().map(CompletableFuture::join).collect(Collectors.toList()));
  }

  /** Concatenates the bucket's members in order and publishes the result locally. */
  public CompletableFuture<Path> build(WeeklyArtifact weeklyArtifact, WeekBucket bucket) {
    if (bucket.getMembers().isEmpty()) {
      return CompletableFuture.failedFuture(
          new EncodeException("Week " + bucket.getMondayDate() + " has no daily artifacts"));
    }
    log.info(
        "Building {} from {} daily artifacts", weeklyArtifact.getKey(), bucket.getMembers().size());
    List<CompletableFuture<Path>> memberPaths =
        bucket.getMembers().stream().map(this::localCopyOf).collect(Collectors.toList());
    return CompletableFuture.allOf(memberPaths.toArray(new CompletableFuture[0]))
        .thenCompose(
            ignored -> {
              List<Path> orderedPaths =
                  memberPaths.stream().map(CompletableFuture::join).collect(Collectors.toList());
              Path localPath = artifactKeys.localPath(weeklyArtifact.getKey());
              localArtifactStore.prepareParent(localPath);
              Path tempPath = localArtifactStore.newTempPath(localPath);
              return mediaEncoder
                  .concatenate(orderedPaths, tempPath)
                  .thenApply(
                      encodedPath -> {
                        localArtifactStore.publish(encodedPath, localPath);
                        return localPath;
                      })
                  .whenComplete(
                      (path, throwable) -> {
                        if (throwable != null) {
                          localArtifactStore.delete(tempPath);
                        }
                      });
            });
  }

  private CompletableFuture<Path> localCopyOf(DailyArtifact member) {
    if (member.getState() == ArtifactBuildState.BUILT
        || member.getState() == ArtifactBuildState.UPLOADED
        || member.isExistsLocal()) {
      return CompletableFuture.completedFuture(artifactKeys.localPath(member.getKey()));
    }
    return tieredCacheResolver.materialize(member.getKey());
  }
}
