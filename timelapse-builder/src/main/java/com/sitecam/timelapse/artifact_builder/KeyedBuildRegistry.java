package com.sitecam.timelapse.artifact_builder;

import com.sitecam.timelapse.artifact_builder.models.ArtifactKey;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Guarantees at most one build per artifact key. Callers asking for a key that is already being
 * built share the in-flight result instead of starting a second build.
 */
@Slf4j
public class KeyedBuildRegistry {
  private final Map<ArtifactKey, CompletableFuture<Path>> inFlightBuilds =
      new ConcurrentHashMap<>();

  public CompletableFuture<Path> runExclusively(
      ArtifactKey key, Supplier<CompletableFuture<Path>> buildSupplier) {
    CompletableFuture<Path> placeholder = new CompletableFuture<>();
    CompletableFuture<Path> existing = inFlightBuilds.putIfAbsent(key, placeholder);
    if (existing != null) {
      log.debug("Joining in-flight build of {}", key);
      return existing;
    }
    CompletableFuture<Path> buildFuture;
    try {
      buildFuture = buildSupplier.get();
    } catch (RuntimeException e) {
      buildFuture = CompletableFuture.failedFuture(e);
    }
    buildFuture.whenComplete(
        (path, throwable) -> {
          if (throwable != null) {
            placeholder.completeExceptionally(throwable);
          } else {
            placeholder.complete(path);
          }
        });
    return placeholder;
  }

  public boolean isInFlight(ArtifactKey key) {
    CompletableFuture<Path> build = inFlightBuilds.get(key);
    return build != null && !build.isDone();
  }
}
