package com.sitecam.timelapse.storage;

import com.sitecam.timelapse.storage.models.File;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.tuple.Pair;

public interface AsyncStorageClient {
  CompletableFuture<List<File>> listAllFilesInDir(String path);

  CompletableFuture<Pair<String, List<File>>> fetchObjectsByPage(
      String bucketName, String prefix, String continuationToken, String startAfter);

  CompletableFuture<byte[]> readFileAsBytes(String path);

  CompletableFuture<Void> downloadFile(String path, Path destination);

  CompletableFuture<Boolean> fileExists(String path);

  CompletableFuture<Void> uploadFile(String path, Path source, String contentType);

  CompletableFuture<Void> writeBytes(String path, byte[] content, String contentType);

  CompletableFuture<Void> deleteFile(String path);

  void refreshClient();
}
