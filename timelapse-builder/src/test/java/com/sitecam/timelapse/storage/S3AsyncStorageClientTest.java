package com.sitecam.timelapse.storage;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.sitecam.timelapse.exceptions.NoSuchKeyException;
import com.sitecam.timelapse.exceptions.ObjectStorageClientException;
import com.sitecam.timelapse.exceptions.RateLimitException;
import com.sitecam.timelapse.storage.models.File;
import com.sitecam.timelapse.storage.providers.S3AsyncClientProvider;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ForkJoinPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

@ExtendWith(MockitoExtension.class)
class S3AsyncStorageClientTest {
  @Mock private S3AsyncClientProvider mockS3AsyncClientProvider;
  @Mock private S3AsyncClient mockS3AsyncClient;
  private S3AsyncStorageClient s3AsyncStorageClient;
  private static final String TEST_BUCKET = "timelapse-public";
  private static final String TEST_KEY = "site-a/daily";
  private static final String S3_URI = "s3://" + TEST_BUCKET + "/" + TEST_KEY;

  @BeforeEach
  void setup() {
    when(mockS3AsyncClientProvider.getS3AsyncClient()).thenReturn(mockS3AsyncClient);
    s3AsyncStorageClient =
        new S3AsyncStorageClient(
            mockS3AsyncClientProvider, new StorageUtils(), ForkJoinPool.commonPool());
  }

  @Test
  void testListAllFilesInDir() {
    String continuationToken = "token";
    ListObjectsV2Request expectedRequestPart1 =
        ListObjectsV2Request.builder()
            .bucket(TEST_BUCKET)
            .prefix(TEST_KEY + "/")
            .delimiter("/")
            .build();
    ListObjectsV2Request expectedRequestPart2 =
        expectedRequestPart1.toBuilder().continuationToken(continuationToken).build();
    when(mockS3AsyncClient.listObjectsV2(expectedRequestPart1))
        .thenReturn(
            CompletableFuture.completedFuture(
                ListObjectsV2Response.builder()
                    .contents(
                        S3Object.builder()
                            .key(TEST_KEY + "/TLST04A00879_250710_0600.mp4")
                            .lastModified(Instant.EPOCH)
                            .build())
                    .isTruncated(true)
                    .nextContinuationToken(continuationToken)
                    .build()));
    when(mockS3AsyncClient.listObjectsV2(expectedRequestPart2))
        .thenReturn(
            CompletableFuture.completedFuture(
                ListObjectsV2Response.builder()
                    .commonPrefixes(CommonPrefix.builder().prefix(TEST_KEY + "/archive/").build())
                    .isTruncated(false)
                    .build()));

    List<File> result = s3AsyncStorageClient.listAllFilesInDir(S3_URI).join();

    assertEquals(
        Arrays.asList(
            File.builder()
                .isDirectory(false)
                .filename("TLST04A00879_250710_0600.mp4")
                .lastModifiedAt(Instant.EPOCH)
                .build(),
            File.builder()
                .isDirectory(true)
                .filename("archive/")
                .lastModifiedAt(Instant.EPOCH)
                .build()),
        result);
  }

  @Test
  void testListFailureIsWrapped() {
    when(mockS3AsyncClient.listObjectsV2(any(ListObjectsV2Request.class)))
        .thenReturn(failed(AwsServiceException.builder().statusCode(500).build()));

    CompletionException exception =
        assertThrows(
            CompletionException.class,
            () -> s3AsyncStorageClient.listAllFilesInDir(S3_URI).join());

    assertInstanceOf(ObjectStorageClientException.class, exception.getCause());
  }

  @Test
  void testReadFileAsBytes() {
    byte[] fileContent = "{\"processed_folders\":[]}".getBytes(StandardCharsets.UTF_8);
    when(mockS3AsyncClient.getObject(
            eq(GetObjectRequest.builder().bucket(TEST_BUCKET).key(TEST_KEY).build()),
            any(AsyncResponseTransformer.class)))
        .thenReturn(
            CompletableFuture.completedFuture(
                ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), fileContent)));

    assertArrayEquals(fileContent, s3AsyncStorageClient.readFileAsBytes(S3_URI).join());
  }

  @Test
  void testReadFileAsBytesWithS3RateLimiting() {
    when(mockS3AsyncClient.getObject(
            any(GetObjectRequest.class), any(AsyncResponseTransformer.class)))
        .thenReturn(failed(throttlingException()));

    CompletionException exception =
        assertThrows(
            CompletionException.class, () -> s3AsyncStorageClient.readFileAsBytes(S3_URI).join());

    assertInstanceOf(RateLimitException.class, exception.getCause());
    assertEquals(
        "Throttled by S3 for operation : readFileAsBytes on path : " + S3_URI,
        exception.getCause().getMessage());
  }

  @Test
  void testReadMissingFile() {
    when(mockS3AsyncClient.getObject(
            any(GetObjectRequest.class), any(AsyncResponseTransformer.class)))
        .thenReturn(failed(S3Exception.builder().statusCode(404).build()));

    CompletionException exception =
        assertThrows(
            CompletionException.class, () -> s3AsyncStorageClient.readFileAsBytes(S3_URI).join());

    assertInstanceOf(NoSuchKeyException.class, exception.getCause());
  }

  @Test
  void testFileExists() {
    HeadObjectRequest existing =
        HeadObjectRequest.builder().bucket(TEST_BUCKET).key(TEST_KEY + "/day.mp4").build();
    HeadObjectRequest missing =
        HeadObjectRequest.builder().bucket(TEST_BUCKET).key(TEST_KEY + "/week.mp4").build();
    when(mockS3AsyncClient.headObject(existing))
        .thenReturn(CompletableFuture.completedFuture(HeadObjectResponse.builder().build()));
    when(mockS3AsyncClient.headObject(missing))
        .thenReturn(failed(S3Exception.builder().statusCode(404).build()));

    assertTrue(s3AsyncStorageClient.fileExists(S3_URI + "/day.mp4").join());
    assertFalse(s3AsyncStorageClient.fileExists(S3_URI + "/week.mp4").join());
  }

  @Test
  void testFileExistsPropagatesOtherFailures() {
    when(mockS3AsyncClient.headObject(any(HeadObjectRequest.class)))
        .thenReturn(failed(AwsServiceException.builder().statusCode(403).build()));

    CompletionException exception =
        assertThrows(
            CompletionException.class, () -> s3AsyncStorageClient.fileExists(S3_URI).join());

    assertInstanceOf(ObjectStorageClientException.class, exception.getCause());
  }

  @Test
  void testWriteBytesSetsContentType() {
    PutObjectRequest expectedRequest =
        PutObjectRequest.builder()
            .bucket(TEST_BUCKET)
            .key("site-a/metadata.json")
            .contentType("application/json")
            .build();
    when(mockS3AsyncClient.putObject(eq(expectedRequest), any(AsyncRequestBody.class)))
        .thenReturn(CompletableFuture.completedFuture(PutObjectResponse.builder().build()));

    s3AsyncStorageClient
        .writeBytes(
            "s3://timelapse-public/site-a/metadata.json",
            "{}".getBytes(StandardCharsets.UTF_8),
            "application/json")
        .join();

    verify(mockS3AsyncClient).putObject(eq(expectedRequest), any(AsyncRequestBody.class));
  }

  @Test
  void testDeleteFile() {
    DeleteObjectRequest expectedRequest =
        DeleteObjectRequest.builder().bucket(TEST_BUCKET).key(TEST_KEY + "/day.mp4").build();
    when(mockS3AsyncClient.deleteObject(expectedRequest))
        .thenReturn(CompletableFuture.completedFuture(DeleteObjectResponse.builder().build()));

    s3AsyncStorageClient.deleteFile(S3_URI + "/day.mp4").join();

    verify(mockS3AsyncClient).deleteObject(expectedRequest);
  }

  @MockitoSettings(strictness = Strictness.LENIENT)
  @Test
  void testRefreshClient() {
    s3AsyncStorageClient.refreshClient();

    verify(mockS3AsyncClientProvider).refreshClient();
  }

  private static AwsServiceException throttlingException() {
    return AwsServiceException.builder()
        .awsErrorDetails(AwsErrorDetails.builder().errorCode("Throttling").build())
        .build();
  }

  private static <R> CompletableFuture<R> failed(Throwable throwable) {
    CompletableFuture<R> future = new CompletableFuture<>();
    future.completeExceptionally(throwable);
    return future;
  }
}
