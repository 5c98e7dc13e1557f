package com.sitecam.timelapse.storage;

import com.google.api.gax.paging.Page;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import com.sitecam.timelapse.exceptions.NoSuchKeyException;
import com.sitecam.timelapse.exceptions.ObjectStorageClientException;
import com.sitecam.timelapse.exceptions.RateLimitException;
import com.sitecam.timelapse.storage.models.File;
import com.sitecam.timelapse.storage.providers.GcsClientProvider;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

@Slf4j
public class GCSAsyncStorageClient extends AbstractAsyncStorageClient {
  private static final int TOO_MANY_REQUESTS_STATUS_CODE = 429;
  private final GcsClientProvider gcsClientProvider;

  @Inject
  public GCSAsyncStorageClient(
      @Nonnull GcsClientProvider gcsClientProvider,
      @Nonnull StorageUtils storageUtils,
      @Nonnull ExecutorService executorService) {
    super(executorService, storageUtils);
    this.gcsClientProvider = gcsClientProvider;
  }

  @Override
  public CompletableFuture<Pair<String, List<File>>> fetchObjectsByPage(
      String bucketName, String prefix, String continuationToken, String startAfter) {
    log.debug(
        "fetching files in dir {} continuationToken {} startAfter {}",
        prefix,
        continuationToken,
        startAfter);
    return CompletableFuture.supplyAsync(
        () -> {
          List<Storage.BlobListOption> optionList =
              new ArrayList<>(
                  Arrays.asList(
                      Storage.BlobListOption.prefix(prefix),
                      Storage.BlobListOption.delimiter("/")));
          if (StringUtils.isNotBlank(continuationToken)) {
            optionList.add(Storage.BlobListOption.pageToken(continuationToken));
          }
          if (StringUtils.isNotBlank(startAfter)) {
            optionList.add(Storage.BlobListOption.startOffset(startAfter));
          }
          Page<Blob> blobs =
              callGcs(
                  () ->
                      gcsClientProvider
                          .getGcsClient()
                          .list(bucketName, optionList.toArray(new Storage.BlobListOption[0])),
                  "fetchObjectsByPage",
                  bucketName);
          List<File> files = new ArrayList<>();
          for (Blob blob : blobs.getValues()) {
            files.add(
                File.builder()
                    .filename(StringUtils.removeStart(blob.getName(), prefix))
                    .lastModifiedAt(
                        Instant.ofEpochMilli(
                            !blob.isDirectory() && blob.getUpdateTime() != null
                                ? blob.getUpdateTime()
                                : 0))
                    .isDirectory(blob.isDirectory())
                    .build());
          }
          String nextPageToken = blobs.hasNextPage() ? blobs.getNextPageToken() : null;
          return Pair.of(nextPageToken, files);
        },
        executorService);
  }

  @VisibleForTesting
  CompletableFuture<Blob> readBlob(String gcsUri) {
    log.debug("Reading GCS file: {}", gcsUri);
    return CompletableFuture.supplyAsync(
        () -> {
          Blob blob = callGcs(() -> getBlob(gcsUri), "readBlob", gcsUri);
          if (blob != null) {
            return blob;
          } else {
            throw new NoSuchKeyException("Blob not found: " + gcsUri);
          }
        },
        executorService);
  }

  @Override
  public CompletableFuture<byte[]> readFileAsBytes(String gcsUri) {
    return readBlob(gcsUri).thenApply(Blob::getContent);
  }

  @Override
  public CompletableFuture<Void> downloadFile(String gcsUri, Path destination) {
    return readBlob(gcsUri)
        .thenAcceptAsync(
            blob -> callGcs(() -> downloadBlob(blob, destination), "downloadFile", gcsUri),
            executorService);
  }

  @Override
  public CompletableFuture<Boolean> fileExists(String gcsUri) {
    return CompletableFuture.supplyAsync(
        () -> callGcs(() -> getBlob(gcsUri), "fileExists", gcsUri) != null, executorService);
  }

  @Override
  public CompletableFuture<Void> uploadFile(String gcsUri, Path source, String contentType) {
    log.debug("Uploading {} to {}", source, gcsUri);
    return CompletableFuture.runAsync(
        () ->
            callGcs(
                () -> {
                  try {
                    return gcsClientProvider
                        .getGcsClient()
                        .createFrom(blobInfo(gcsUri, contentType), source);
                  } catch (IOException e) {
                    throw new ObjectStorageClientException(e);
                  }
                },
                "uploadFile",
                gcsUri),
        executorService);
  }

  @Override
  public CompletableFuture<Void> writeBytes(String gcsUri, byte[] content, String contentType) {
    log.debug("Writing {} bytes to {}", content.length, gcsUri);
    return CompletableFuture.runAsync(
        () ->
            callGcs(
                () ->
                    gcsClientProvider
                        .getGcsClient()
                        .create(blobInfo(gcsUri, contentType), content),
                "writeBytes",
                gcsUri),
        executorService);
  }

  @Override
  public CompletableFuture<Void> deleteFile(String gcsUri) {
    log.debug("Deleting GCS file {}", gcsUri);
    return CompletableFuture.runAsync(
        () ->
            callGcs(
                () -> gcsClientProvider.getGcsClient().delete(blobId(gcsUri)),
                "deleteFile",
                gcsUri),
        executorService);
  }

  @Override
  public void refreshClient() {
    gcsClientProvider.refreshClient();
  }

  private Blob getBlob(String gcsUri) {
    return gcsClientProvider.getGcsClient().get(blobId(gcsUri));
  }

  private Path downloadBlob(Blob blob, Path destination) {
    blob.downloadTo(destination);
    return destination;
  }

  private BlobId blobId(String gcsUri) {
    return BlobId.of(
        storageUtils.getBucketNameFromUri(gcsUri), storageUtils.getPathFromUrl(gcsUri));
  }

  private BlobInfo blobInfo(String gcsUri, String contentType) {
    return BlobInfo.newBuilder(blobId(gcsUri)).setContentType(contentType).build();
  }

  private interface GcsCall<T> {
    T call();
  }

  private static <T> T callGcs(GcsCall<T> gcsCall, String operation, String path) {
    try {
      return gcsCall.call();
    } catch (StorageException e) {
      if (e.getCode() == TOO_MANY_REQUESTS_STATUS_CODE) {
        throw new RateLimitException(
            String.format("Throttled by GCS for operation : %s on path : %s", operation, path));
      }
      throw new ObjectStorageClientException(e);
    }
  }
}
