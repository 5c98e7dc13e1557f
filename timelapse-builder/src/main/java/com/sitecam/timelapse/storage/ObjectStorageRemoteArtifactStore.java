package com.sitecam.timelapse.storage;

import com.google.inject.Inject;
import com.sitecam.timelapse.RuntimeModule.ArtifactObjectStorageAsyncClient;
import com.sitecam.timelapse.config.Config;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

@Slf4j
public class ObjectStorageRemoteArtifactStore implements RemoteArtifactStore {
  private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

  private final AsyncStorageClient asyncStorageClient;
  private final StorageUtils storageUtils;
  private final String remoteBaseUri;

  @Inject
  public ObjectStorageRemoteArtifactStore(
      @Nonnull @ArtifactObjectStorageAsyncClient AsyncStorageClient asyncStorageClient,
      @Nonnull StorageUtils storageUtils,
      @Nonnull Config config) {
    this.asyncStorageClient = asyncStorageClient;
    this.storageUtils = storageUtils;
    this.remoteBaseUri = config.getArtifactStoreConfig().getRemoteBaseUri();
  }

  @Override
  public CompletableFuture<Boolean> exists(String objectPath) {
    return asyncStorageClient.fileExists(locate(objectPath));
  }

  @Override
  public CompletableFuture<byte[]> get(String objectPath) {
    return asyncStorageClient.readFileAsBytes(locate(objectPath));
  }

  @Override
  public CompletableFuture<Void> download(String objectPath, Path destination) {
    return asyncStorageClient.downloadFile(locate(objectPath), destination);
  }

  @Override
  public CompletableFuture<Void> put(String objectPath, Path source) {
    log.info("Uploading {} to {}", source, locate(objectPath));
    return asyncStorageClient.uploadFile(locate(objectPath), source, contentTypeOf(objectPath));
  }

  @Override
  public CompletableFuture<Void> putBytes(String objectPath, byte[] content) {
    return asyncStorageClient.writeBytes(locate(objectPath), content, contentTypeOf(objectPath));
  }

  @Override
  public CompletableFuture<Void> delete(String objectPath) {
    log.info("Deleting {}", locate(objectPath));
    return asyncStorageClient.deleteFile(locate(objectPath));
  }

  @Override
  public CompletableFuture<List<String>> list(String prefix) {
    return asyncStorageClient
        .listAllFilesInDir(locate(prefix))
        .thenApply(
            files ->
                files.stream()
                    .filter(file -> !file.isDirectory())
                    .map(file -> storageUtils.constructFileUri(prefix, file.getFilename()))
                    .collect(Collectors.toList()));
  }

  @Override
  public String locate(String objectPath) {
    return storageUtils.constructFileUri(remoteBaseUri, objectPath);
  }

  static String contentTypeOf(String objectPath) {
    switch (FilenameUtils.getExtension(objectPath).toLowerCase(Locale.ROOT)) {
      case "mp4":
        return "video/mp4";
      case "jpg":
      case "jpeg":
        return "image/jpeg";
      case "json":
        return "application/json";
      default:
        return DEFAULT_CONTENT_TYPE;
    }
  }
}
