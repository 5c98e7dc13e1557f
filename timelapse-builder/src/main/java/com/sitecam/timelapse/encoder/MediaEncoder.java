package com.sitecam.timelapse.encoder;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface MediaEncoder {
  /** Encodes ordered still frames into a single video written to {@code outputPath}. */
  CompletableFuture<Path> encodeSequence(List<Path> orderedFramePaths, Path outputPath);

  /** Joins already encoded videos in order without re-encoding. */
  CompletableFuture<Path> concatenate(List<Path> orderedArtifactPaths, Path outputPath);

  /** Joins videos in order and re-encodes the result with the full timelapse settings. */
  CompletableFuture<Path> concatenateAndReencode(List<Path> orderedArtifactPaths, Path outputPath);
}
