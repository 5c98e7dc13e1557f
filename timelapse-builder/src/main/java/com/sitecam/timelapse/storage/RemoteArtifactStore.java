package com.sitecam.timelapse.storage;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Durable tier holding published artifacts, the processing state and the public aliases. All
 * object paths are relative to the configured remote base.
 */
public interface RemoteArtifactStore {
  CompletableFuture<Boolean> exists(String objectPath);

  CompletableFuture<byte[]> get(String objectPath);

  CompletableFuture<Void> download(String objectPath, Path destination);

  CompletableFuture<Void> put(String objectPath, Path source);

  CompletableFuture<Void> putBytes(String objectPath, byte[] content);

  CompletableFuture<Void> delete(String objectPath);

  /** Lists object paths directly under {@code prefix}, returned relative to the remote base. */
  CompletableFuture<List<String>> list(String prefix);

  /** Fully qualified location of an object path, for logging and metadata. */
  String locate(String objectPath);
}
