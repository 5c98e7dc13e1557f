package com.sitecam.timelapse.source;

import com.google.inject.Inject;
import com.sitecam.timelapse.RuntimeModule.RawInputObjectStorageAsyncClient;
import com.sitecam.timelapse.artifact_builder.models.ItemRef;
import com.sitecam.timelapse.artifact_builder.models.SourcePartition;
import com.sitecam.timelapse.config.Config;
import com.sitecam.timelapse.config.models.configv1.SourceConfig;
import com.sitecam.timelapse.exceptions.RawInputFetchException;
import com.sitecam.timelapse.storage.AsyncStorageClient;
import com.sitecam.timelapse.storage.StorageUtils;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

@Slf4j
public class ObjectStorageRawInputSource implements RawInputSource {
  private final AsyncStorageClient asyncStorageClient;
  private final StorageUtils storageUtils;
  private final SourceConfig sourceConfig;

  @Inject
  public ObjectStorageRawInputSource(
      @Nonnull @RawInputObjectStorageAsyncClient AsyncStorageClient asyncStorageClient,
      @Nonnull StorageUtils storageUtils,
      @Nonnull Config config) {
    this.asyncStorageClient = asyncStorageClient;
    this.storageUtils = storageUtils;
    this.sourceConfig = config.getSourceConfig();
  }

  @Override
  public CompletableFuture<List<SourcePartition>> listPartitions(String rootId) {
    log.info("Listing raw partitions under {}", rootId);
    return asyncStorageClient
        .listAllFilesInDir(rootId)
        .thenApply(
            files ->
                files.stream()
                    .filter(file -> file.isDirectory())
                    .map(file -> StringUtils.removeEnd(file.getFilename(), "/"))
                    .filter(name -> name.startsWith(sourceConfig.getPartitionNamePrefix()))
                    .map(
                        name ->
                            SourcePartition.builder()
                                .id(storageUtils.constructFileUri(rootId, name))
                                .name(name)
                                .build())
                    .sorted(Comparator.comparing(SourcePartition::getName))
                    .collect(Collectors.toList()));
  }

  @Override
  public CompletableFuture<List<ItemRef>> listItems(SourcePartition partition) {
    return asyncStorageClient
        .listAllFilesInDir(partition.getId())
        .thenApply(
            files ->
                files.stream()
                    .filter(file -> !file.isDirectory())
                    .map(file -> file.getFilename())
                    .filter(this::isFrame)
                    .map(
                        name ->
                            ItemRef.builder()
                                .id(storageUtils.constructFileUri(partition.getId(), name))
                                .name(name)
                                .build())
                    .sorted(FrameOrdering.BY_FRAME_NUMBER)
                    .collect(Collectors.toList()))
        .exceptionally(
            throwable -> {
              throw new RawInputFetchException(
                  "Failed to list items of partition " + partition.getName(), throwable);
            });
  }

  @Override
  public CompletableFuture<byte[]> fetchItem(ItemRef itemRef) {
    return asyncStorageClient
        .readFileAsBytes(itemRef.getId())
        .exceptionally(
            throwable -> {
              throw new RawInputFetchException(
                  "Failed to fetch item " + itemRef.getId(), throwable);
            });
  }

  private boolean isFrame(String fileName) {
    return fileName.startsWith(sourceConfig.getItemNamePrefix())
        && StringUtils.endsWithIgnoreCase(fileName, sourceConfig.getItemNameSuffix());
  }
}
