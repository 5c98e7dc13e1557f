package com.sitecam.timelapse.storage;

import com.google.inject.Inject;
import com.sitecam.timelapse.exceptions.NoSuchKeyException;
import com.sitecam.timelapse.exceptions.ObjectStorageClientException;
import com.sitecam.timelapse.exceptions.RateLimitException;
import com.sitecam.timelapse.storage.models.File;
import com.sitecam.timelapse.storage.providers.S3AsyncClientProvider;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.awscore.internal.AwsErrorCode;
import software.amazon.awssdk.core.BytesWrapper;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

@Slf4j
public class S3AsyncStorageClient extends AbstractAsyncStorageClient {
  private static final int NOT_FOUND_STATUS_CODE = 404;
  private final S3AsyncClientProvider s3AsyncClientProvider;

  @Inject
  public S3AsyncStorageClient(
      @Nonnull S3AsyncClientProvider s3AsyncClientProvider,
      @Nonnull StorageUtils storageUtils,
      @Nonnull ExecutorService executorService) {
    super(executorService, storageUtils);
    this.s3AsyncClientProvider = s3AsyncClientProvider;
  }

  @Override
  public CompletableFuture<Pair<String, List<File>>> fetchObjectsByPage(
      String bucketName, String prefix, String continuationToken, String startAfter) {

    log.debug(
        "fetching files in dir {} continuationToken {} startAfter {}",
        prefix,
        continuationToken,
        startAfter);
    ListObjectsV2Request.Builder listObjectsV2RequestBuilder =
        ListObjectsV2Request.builder().bucket(bucketName).prefix(prefix).delimiter("/");

    if (StringUtils.isNotBlank(startAfter)) {
      listObjectsV2RequestBuilder.startAfter(startAfter);
    }

    if (StringUtils.isNotBlank(continuationToken)) {
      listObjectsV2RequestBuilder.continuationToken(continuationToken);
    }

    return s3AsyncClientProvider
        .getS3AsyncClient()
        .listObjectsV2(listObjectsV2RequestBuilder.build())
        .thenComposeAsync(
            listObjectsV2Response -> {
              List<File> files =
                  new ArrayList<>(processListObjectsV2Response(listObjectsV2Response, prefix));
              String newContinuationToken =
                  Boolean.TRUE.equals(listObjectsV2Response.isTruncated())
                      ? listObjectsV2Response.nextContinuationToken()
                      : null;
              return CompletableFuture.completedFuture(Pair.of(newContinuationToken, files));
            },
            executorService)
        .exceptionally(
            ex -> {
              log.error("Failed to fetch objects by page", ex);
              throw clientException(ex, "fetchObjectsByPage", bucketName);
            });
  }

  private List<File> processListObjectsV2Response(ListObjectsV2Response response, String prefix) {
    // process files
    List<File> files =
        response.contents().stream()
            .map(
                s3Object ->
                    File.builder()
                        .filename(StringUtils.removeStart(s3Object.key(), prefix))
                        .lastModifiedAt(s3Object.lastModified())
                        .isDirectory(false)
                        .build())
            .collect(Collectors.toList());
    // process directories
    files.addAll(
        response.commonPrefixes().stream()
            .map(
                commonPrefix ->
                    File.builder()
                        .filename(StringUtils.removeStart(commonPrefix.prefix(), prefix))
                        .isDirectory(true)
                        .lastModifiedAt(Instant.EPOCH)
                        .build())
            .collect(Collectors.toList()));

    return files;
  }

  @Override
  public CompletableFuture<byte[]> readFileAsBytes(String s3Uri) {
    log.debug("Reading S3 file:  {}", s3Uri);
    return s3AsyncClientProvider
        .getS3AsyncClient()
        .getObject(getObjectRequest(s3Uri), AsyncResponseTransformer.toBytes())
        .thenApplyAsync(BytesWrapper::asByteArray, executorService)
        .exceptionally(
            ex -> {
              log.debug("Failed to read file as bytes {}", s3Uri, ex);
              throw clientException(ex, "readFileAsBytes", s3Uri);
            });
  }

  @Override
  public CompletableFuture<Void> downloadFile(String s3Uri, Path destination) {
    log.debug("Downloading S3 file {} to {}", s3Uri, destination);
    return s3AsyncClientProvider
        .getS3AsyncClient()
        .getObject(getObjectRequest(s3Uri), AsyncResponseTransformer.toFile(destination))
        .<Void>thenApply(response -> null)
        .exceptionally(
            ex -> {
              log.error("Failed to download file {}", s3Uri, ex);
              throw clientException(ex, "downloadFile", s3Uri);
            });
  }

  @Override
  public CompletableFuture<Boolean> fileExists(String s3Uri) {
    HeadObjectRequest headObjectRequest =
        HeadObjectRequest.builder()
            .bucket(storageUtils.getBucketNameFromUri(s3Uri))
            .key(storageUtils.getPathFromUrl(s3Uri))
            .build();
    return s3AsyncClientProvider
        .getS3AsyncClient()
        .headObject(headObjectRequest)
        .handle(
            (response, ex) -> {
              if (ex == null) {
                return true;
              }
              if (isNotFound(unwrap(ex))) {
                return false;
              }
              throw clientException(ex, "fileExists", s3Uri);
            });
  }

  @Override
  public CompletableFuture<Void> uploadFile(String s3Uri, Path source, String contentType) {
    log.debug("Uploading {} to {}", source, s3Uri);
    return s3AsyncClientProvider
        .getS3AsyncClient()
        .putObject(putObjectRequest(s3Uri, contentType), AsyncRequestBody.fromFile(source))
        .<Void>thenApply(response -> null)
        .exceptionally(
            ex -> {
              log.error("Failed to upload file {}", s3Uri, ex);
              throw clientException(ex, "uploadFile", s3Uri);
            });
  }

  @Override
  public CompletableFuture<Void> writeBytes(String s3Uri, byte[] content, String contentType) {
    log.debug("Writing {} bytes to {}", content.length, s3Uri);
    return s3AsyncClientProvider
        .getS3AsyncClient()
        .putObject(putObjectRequest(s3Uri, contentType), AsyncRequestBody.fromBytes(content))
        .<Void>thenApply(response -> null)
        .exceptionally(
            ex -> {
              log.error("Failed to write bytes to {}", s3Uri, ex);
              throw clientException(ex, "writeBytes", s3Uri);
            });
  }

  @Override
  public CompletableFuture<Void> deleteFile(String s3Uri) {
    log.debug("Deleting S3 file {}", s3Uri);
    DeleteObjectRequest deleteObjectRequest =
        DeleteObjectRequest.builder()
            .bucket(storageUtils.getBucketNameFromUri(s3Uri))
            .key(storageUtils.getPathFromUrl(s3Uri))
            .build();
    return s3AsyncClientProvider
        .getS3AsyncClient()
        .deleteObject(deleteObjectRequest)
        .<Void>thenApply(response -> null)
        .exceptionally(
            ex -> {
              log.error("Failed to delete file {}", s3Uri, ex);
              throw clientException(ex, "deleteFile", s3Uri);
            });
  }

  private GetObjectRequest getObjectRequest(String s3Uri) {
    return GetObjectRequest.builder()
        .bucket(storageUtils.getBucketNameFromUri(s3Uri))
        .key(storageUtils.getPathFromUrl(s3Uri))
        .build();
  }

  private PutObjectRequest putObjectRequest(String s3Uri, String contentType) {
    return PutObjectRequest.builder()
        .bucket(storageUtils.getBucketNameFromUri(s3Uri))
        .key(storageUtils.getPathFromUrl(s3Uri))
        .contentType(contentType)
        .build();
  }

  private static boolean isNotFound(Throwable cause) {
    return cause instanceof software.amazon.awssdk.services.s3.model.NoSuchKeyException
        || (cause instanceof AwsServiceException
            && ((AwsServiceException) cause).statusCode() == NOT_FOUND_STATUS_CODE);
  }

  private RuntimeException clientException(Throwable ex, String operation, String path) {
    Throwable wrappedException = unwrap(ex);
    if (wrappedException instanceof ObjectStorageClientException) {
      return (ObjectStorageClientException) wrappedException;
    }
    if (wrappedException instanceof AwsServiceException
        && ((AwsServiceException) wrappedException).awsErrorDetails() != null
        && AwsErrorCode.isThrottlingErrorCode(
            ((AwsServiceException) wrappedException).awsErrorDetails().errorCode())) {
      return new RateLimitException(
          String.format("Throttled by S3 for operation : %s on path : %s", operation, path));
    }
    if (isNotFound(wrappedException)) {
      return new NoSuchKeyException(
          String.format("Key not found for operation : %s on path : %s", operation, path));
    }
    return new ObjectStorageClientException(wrappedException);
  }

  @Override
  public void refreshClient() {
    s3AsyncClientProvider.refreshClient();
  }
}
