package com.sitecam.timelapse.artifact_builder;

import com.google.common.collect.Lists;
import com.google.inject.Inject;
import com.sitecam.timelapse.artifact_builder.models.DailyArtifact;
import com.sitecam.timelapse.artifact_builder.models.ItemRef;
import com.sitecam.timelapse.config.Config;
import com.sitecam.timelapse.encoder.MediaEncoder;
import com.sitecam.timelapse.exceptions.RawInputFetchException;
import com.sitecam.timelapse.source.RawInputSource;
import com.sitecam.timelapse.storage.LocalArtifactStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

@Slf4j
public class DailyArtifactBuilder {
  private final RawInputSource rawInputSource;
  private final MediaEncoder mediaEncoder;
  private final LocalArtifactStore localArtifactStore;
  private final ArtifactKeys artifactKeys;
  private final ExecutorService executorService;
  private final int fetchParallelism;

  @Inject
  public DailyArtifactBuilder(
      @Nonnull RawInputSource rawInputSource,
      @Nonnull MediaEncoder mediaEncoder,
      @Nonnull LocalArtifactStore localArtifactStore,
      @Nonnull ArtifactKeys artifactKeys,
      @Nonnull ExecutorService executorService,
      @Nonnull Config config) {
    this.rawInputSource = rawInputSource;
    this.mediaEncoder = mediaEncoder;
    this.localArtifactStore = localArtifactStore;
    this.artifactKeys = artifactKeys;
    this.executorService = executorService;
    this.fetchParallelism = config.getBuildConfig().getFetchParallelism();
  }

  /** Returns the local path of the freshly published artifact. */
  public CompletableFuture<Path> build(DailyArtifact artifact) {
    if (artifact.getSourcePartition() == null) {
      return CompletableFuture.failedFuture(
          new RawInputFetchException("No raw partition to rebuild " + artifact.getKey() + " from"));
    }
    log.info("Building {}", artifact.getKey());
    return rawInputSource
        .listItems(artifact.getSourcePartition())
        .thenComposeAsync(
            items -> {
              if (items.isEmpty()) {
                throw new RawInputFetchException(
                    "No items found in partition " + artifact.getPartitionName());
              }
              Path scratchDirectory = createScratchDirectory(artifact);
              return fetchAll(items, scratchDirectory)
                  .thenCompose(framePaths -> encode(artifact, framePaths))
                  .whenComplete(
                      (path, throwable) -> FileUtils.deleteQuietly(scratchDirectory.toFile()));
            },
            executorService);
  }

  /**
   * Fetches items in sequential batches of {@code fetchParallelism} concurrent downloads. The
   * returned paths keep the order of {@code items}.
   */
  private CompletableFuture<List<Path>> fetchAll(List<ItemRef> items, Path scratchDirectory) {
    List<Path> framePaths = new ArrayList<>(items.size());
    CompletableFuture<Void> batchChain = CompletableFuture.completedFuture(null);
    int index = 0;
    for (List<ItemRef> batch : Lists.partition(items, fetchParallelism)) {
      List<Path> batchPaths = new ArrayList<>();
      for (ItemRef item : batch) {
        batchPaths.add(scratchDirectory.resolve(String.format("%06d_%s", index++, item.getName())));
      }
      framePaths.addAll(batchPaths);
      batchChain =
          batchChain.thenCompose(ignored -> fetchBatch(batch, batchPaths));
    }
    return batchChain.thenApply(ignored -> framePaths);
  }

  private CompletableFuture<Void> fetchBatch(List<ItemRef> batch, List<Path> batchPaths) {
    List<CompletableFuture<Void>> fetchFutures = new ArrayList<>();
    for (int i = 0; i < batch.size(); i++) {
      Path framePath = batchPaths.get(i);
      ItemRef item = batch.get(i);
      fetchFutures.add(
          rawInputSource
              .fetchItem(item)
              .thenAcceptAsync(content -> writeFrame(item, framePath, content), executorService));
    }
    return CompletableFuture.allOf(fetchFutures.toArray(new CompletableFuture[0]));
  }

  private CompletableFuture<Path> encode(DailyArtifact artifact, List<Path> framePaths) {
    Path localPath = artifactKeys.localPath(artifact.getKey());
    localArtifactStore.prepareParent(localPath);
    Path tempPath = localArtifactStore.newTempPath(localPath);
    return mediaEncoder
        .encodeSequence(framePaths, tempPath)
        .thenApply(
            encodedPath -> {
              localArtifactStore.publish(encodedPath, localPath);
              log.info("Built {} from {} frames", artifact.getKey(), framePaths.size());
              return localPath;
            })
        .whenComplete(
            (path, throwable) -> {
              if (throwable != null) {
                localArtifactStore.delete(tempPath);
              }
            });
  }

  private static void writeFrame(ItemRef item, Path framePath, byte[] content) {
    try {
      Files.write(framePath, content);
    } catch (IOException e) {
      throw new RawInputFetchException("Failed to store item " + item.getId(), e);
    }
  }

  private static Path createScratchDirectory(DailyArtifact artifact) {
    try {
      return Files.createTempDirectory("timelapse-" + artifact.getPartitionName() + "-");
    } catch (IOException e) {
      throw new RawInputFetchException(
          "Failed to create scratch directory for " + artifact.getPartitionName(), e);
    }
  }
}
