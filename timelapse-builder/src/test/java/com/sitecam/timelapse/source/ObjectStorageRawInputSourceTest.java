package com.sitecam.timelapse.source;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.sitecam.timelapse.artifact_builder.models.ItemRef;
import com.sitecam.timelapse.artifact_builder.models.SourcePartition;
import com.sitecam.timelapse.config.Config;
import com.sitecam.timelapse.config.models.configv1.SourceConfig;
import com.sitecam.timelapse.exceptions.ObjectStorageClientException;
import com.sitecam.timelapse.exceptions.RawInputFetchException;
import com.sitecam.timelapse.storage.AsyncStorageClient;
import com.sitecam.timelapse.storage.StorageUtils;
import com.sitecam.timelapse.storage.models.File;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ObjectStorageRawInputSourceTest {
  private static final String ROOT_URI = "s3://camera-uploads/site-a/";
  private static final SourcePartition PARTITION =
      SourcePartition.builder()
          .id("s3://camera-uploads/site-a/TLST04A00879_250710_0600")
          .name("TLST04A00879_250710_0600")
          .build();

  @Mock private AsyncStorageClient mockAsyncStorageClient;
  @Mock private Config config;

  private ObjectStorageRawInputSource rawInputSource;

  @BeforeEach
  void setUp() {
    when(config.getSourceConfig()).thenReturn(SourceConfig.builder().rootUri(ROOT_URI).build());
    rawInputSource =
        new ObjectStorageRawInputSource(mockAsyncStorageClient, new StorageUtils(), config);
  }

  private static File file(String name) {
    return File.builder().filename(name).lastModifiedAt(Instant.EPOCH).isDirectory(false).build();
  }

  private static File directory(String name) {
    return File.builder().filename(name).lastModifiedAt(Instant.EPOCH).isDirectory(true).build();
  }

  private static <T> CompletableFuture<T> failed(Throwable throwable) {
    CompletableFuture<T> future = new CompletableFuture<>();
    future.completeExceptionally(throwable);
    return future;
  }

  @Test
  void testListPartitionsKeepsPrefixedDirectories() {
    when(mockAsyncStorageClient.listAllFilesInDir(ROOT_URI))
        .thenReturn(
            CompletableFuture.completedFuture(
                Arrays.asList(
                    directory("TLST04A00879_250711_0600/"),
                    directory("TLST04A00879_250710_0600/"),
                    directory("thumbnails/"),
                    file("TLST04A00879_250712_0600.zip"))));

    List<SourcePartition> partitions = rawInputSource.listPartitions(ROOT_URI).join();

    assertEquals(2, partitions.size());
    assertEquals(PARTITION, partitions.get(0));
    assertEquals("TLST04A00879_250711_0600", partitions.get(1).getName());
    assertNull(partitions.get(1).getDate());
  }

  @Test
  void testListPartitionsPropagatesListingFailures() {
    when(mockAsyncStorageClient.listAllFilesInDir(ROOT_URI))
        .thenReturn(failed(new ObjectStorageClientException("unreachable")));

    CompletionException exception =
        assertThrows(
            CompletionException.class, () -> rawInputSource.listPartitions(ROOT_URI).join());

    assertInstanceOf(ObjectStorageClientException.class, exception.getCause());
  }

  @Test
  void testListItemsReturnsFramesInCaptureOrder() {
    when(mockAsyncStorageClient.listAllFilesInDir(PARTITION.getId()))
        .thenReturn(
            CompletableFuture.completedFuture(
                Arrays.asList(
                    file("TLS_0010.jpg"),
                    file("TLS_0002.JPG"),
                    file("notes.txt"),
                    file("TLS_0003.png"),
                    directory("TLS_0004.jpg/"),
                    file("TLS_0001.jpg"))));

    List<ItemRef> items = rawInputSource.listItems(PARTITION).join();

    assertEquals(
        Arrays.asList("TLS_0001.jpg", "TLS_0002.JPG", "TLS_0010.jpg"),
        items.stream().map(ItemRef::getName).collect(Collectors.toList()));
    assertEquals(
        "s3://camera-uploads/site-a/TLST04A00879_250710_0600/TLS_0001.jpg", items.get(0).getId());
  }

  @Test
  void testListItemsFailureIsAFetchError() {
    when(mockAsyncStorageClient.listAllFilesInDir(PARTITION.getId()))
        .thenReturn(failed(new ObjectStorageClientException("unreachable")));

    CompletionException exception =
        assertThrows(CompletionException.class, () -> rawInputSource.listItems(PARTITION).join());

    assertInstanceOf(RawInputFetchException.class, exception.getCause());
  }

  @Test
  void testFetchItem() {
    ItemRef itemRef =
        ItemRef.builder().id(PARTITION.getId() + "/TLS_0001.jpg").name("TLS_0001.jpg").build();
    byte[] content = "jpeg".getBytes(StandardCharsets.UTF_8);
    when(mockAsyncStorageClient.readFileAsBytes(itemRef.getId()))
        .thenReturn(CompletableFuture.completedFuture(content))
        .thenReturn(failed(new ObjectStorageClientException("reset")));

    assertArrayEquals(content, rawInputSource.fetchItem(itemRef).join());
    CompletionException exception =
        assertThrows(CompletionException.class, () -> rawInputSource.fetchItem(itemRef).join());
    assertInstanceOf(RawInputFetchException.class, exception.getCause());
  }
}
