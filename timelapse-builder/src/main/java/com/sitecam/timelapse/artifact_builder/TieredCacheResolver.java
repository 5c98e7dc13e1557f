package com.sitecam.timelapse.artifact_builder;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import com.sitecam.timelapse.artifact_builder.models.ArtifactKey;
import com.sitecam.timelapse.artifact_builder.models.ArtifactType;
import com.sitecam.timelapse.artifact_builder.models.Resolution;
import com.sitecam.timelapse.artifact_builder.models.ResolutionState;
import com.sitecam.timelapse.exceptions.TierUnavailableException;
import com.sitecam.timelapse.metrics.TimelapseBuilderMetrics;
import com.sitecam.timelapse.storage.LocalArtifactStore;
import com.sitecam.timelapse.storage.RemoteArtifactStore;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * Answers where a fresh copy of an artifact lives, consulting the local tier first and the remote
 * tier second. Weekly artifacts only count as fresh once they are durable, and the artifact of the
 * partition still being captured never counts as fresh.
 */
@Slf4j
public class TieredCacheResolver {
  private final LocalArtifactStore localArtifactStore;
  private final RemoteArtifactStore remoteArtifactStore;
  private final ArtifactKeys artifactKeys;
  private final TimelapseBuilderMetrics timelapseBuilderMetrics;
  private final ExecutorService executorService;

  @Inject
  public TieredCacheResolver(
      @Nonnull LocalArtifactStore localArtifactStore,
      @Nonnull RemoteArtifactStore remoteArtifactStore,
      @Nonnull ArtifactKeys artifactKeys,
      @Nonnull TimelapseBuilderMetrics timelapseBuilderMetrics,
      @Nonnull ExecutorService executorService) {
    this.localArtifactStore = localArtifactStore;
    this.remoteArtifactStore = remoteArtifactStore;
    this.artifactKeys = artifactKeys;
    this.timelapseBuilderMetrics = timelapseBuilderMetrics;
    this.executorService = executorService;
  }

  public CompletableFuture<Resolution> resolve(ArtifactKey key, boolean isCurrent) {
    if (isCurrent) {
      log.debug("{} is still accumulating input, treating as missing", key);
      return CompletableFuture.completedFuture(Resolution.missing());
    }
    boolean existsLocal = localArtifactStore.exists(artifactKeys.localPath(key));
    if (existsLocal && key.getType() == ArtifactType.DAILY) {
      return CompletableFuture.completedFuture(
          Resolution.builder().state(ResolutionState.LOCAL_FRESH).existsLocal(true).build());
    }
    return checkRemote(key)
        .thenApply(
            existsRemote ->
                Resolution.builder()
                    .state(classify(key.getType(), existsLocal, existsRemote, false))
                    .existsLocal(existsLocal)
                    .existsRemote(existsRemote)
                    .build());
  }

  /**
   * Freshness decision for a key given what each tier reported. Kept free of I/O so the rules can
   * be checked in isolation.
   */
  @VisibleForTesting
  static ResolutionState classify(
      ArtifactType artifactType, boolean existsLocal, boolean existsRemote, boolean isCurrent) {
    if (isCurrent) {
      return ResolutionState.MISSING;
    }
    if (artifactType == ArtifactType.WEEKLY && !existsRemote) {
      return ResolutionState.MISSING;
    }
    if (existsLocal) {
      return ResolutionState.LOCAL_FRESH;
    }
    if (existsRemote) {
      return ResolutionState.REMOTE_FRESH;
    }
    return ResolutionState.MISSING;
  }

  /**
   * Fresh existence check against the durable tier. An unreachable tier reports absent, which
   * makes callers rebuild or keep data rather than trust a copy that may not exist.
   */
  public CompletableFuture<Boolean> checkRemote(ArtifactKey key) {
    String remotePath = artifactKeys.remotePath(key);
    CompletableFuture<Boolean> existsFuture;
    try {
      existsFuture = remoteArtifactStore.exists(remotePath);
    } catch (RuntimeException e) {
      existsFuture = CompletableFuture.failedFuture(e);
    }
    return existsFuture.exceptionally(
        throwable -> {
          log.warn(
              "Remote tier check failed for {}, treating as absent: {}",
              key,
              ArtifactBuilderUtils.describe(throwable));
          timelapseBuilderMetrics.incrementTierCheckFailureCounter();
          return false;
        });
  }

  /** Ensures the artifact is in the local tier, pulling it from the remote tier if needed. */
  public CompletableFuture<Path> materialize(ArtifactKey key) {
    Path localPath = artifactKeys.localPath(key);
    if (localArtifactStore.exists(localPath)) {
      return CompletableFuture.completedFuture(localPath);
    }
    log.info("Materializing {} from the remote tier", key);
    localArtifactStore.prepareParent(localPath);
    Path tempPath = localArtifactStore.newTempPath(localPath);
    CompletableFuture<Void> downloadFuture;
    try {
      downloadFuture = remoteArtifactStore.download(artifactKeys.remotePath(key), tempPath);
    } catch (RuntimeException e) {
      downloadFuture = CompletableFuture.failedFuture(e);
    }
    return downloadFuture
        .thenApplyAsync(
            ignored -> {
              localArtifactStore.publish(tempPath, localPath);
              return localPath;
            },
            executorService)
        .exceptionally(
            throwable -> {
              localArtifactStore.delete(tempPath);
              throw new TierUnavailableException("Failed to materialize " + key, throwable);
            });
  }

  /**
   * Daily artifacts present in either tier keyed by partition name, regardless of whether their
   * raw partition still exists. A remote listing failure degrades to the local view.
   */
  public CompletableFuture<Map<String, Resolution>> inventoryDailyArtifacts() {
    String dailyDirectory = ArtifactKeys.directoryOf(ArtifactType.DAILY);
    Set<String> localNames = partitionNames(localArtifactStore.list(dailyDirectory));
    CompletableFuture<List<String>> remoteFuture;
    try {
      remoteFuture = remoteArtifactStore.list(dailyDirectory);
    } catch (RuntimeException e) {
      remoteFuture = CompletableFuture.failedFuture(e);
    }
    return remoteFuture
        .exceptionally(
            throwable -> {
              log.warn(
                  "Failed to list remote daily artifacts: {}",
                  ArtifactBuilderUtils.describe(throwable));
              timelapseBuilderMetrics.incrementTierCheckFailureCounter();
              return Collections.emptyList();
            })
        .thenApply(
            remoteObjectPaths -> {
              Set<String> remoteNames =
                  partitionNames(
                      remoteObjectPaths.stream()
                          .map(objectPath -> objectPath.substring(objectPath.lastIndexOf('/') + 1))
                          .collect(Collectors.toList()));
              Map<String, Resolution> inventory = new TreeMap<>();
              Set<String> allNames = new TreeSet<>(localNames);
              allNames.addAll(remoteNames);
              for (String name : allNames) {
                boolean existsLocal = localNames.contains(name);
                boolean existsRemote = remoteNames.contains(name);
                inventory.put(
                    name,
                    Resolution.builder()
                        .state(classify(ArtifactType.DAILY, existsLocal, existsRemote, false))
                        .existsLocal(existsLocal)
                        .existsRemote(existsRemote)
                        .build());
              }
              return inventory;
            });
  }

  private static Set<String> partitionNames(List<String> fileNames) {
    Set<String> names = new HashSet<>();
    fileNames.forEach(fileName -> ArtifactKeys.partitionNameOf(fileName).ifPresent(names::add));
    return names;
  }
}
