package com.sitecam.timelapse.artifact_builder;

import com.sitecam.timelapse.encoder.MediaEncoder;
import com.sitecam.timelapse.exceptions.EncodeException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Encoder writing the concatenated bytes of its inputs, so tests can check what went into an
 * artifact and in which order.
 */
class RecordingMediaEncoder implements MediaEncoder {
  private static final byte[] SEPARATOR = {'\n'};

  private final AtomicInteger sequenceEncodes = new AtomicInteger();
  private final AtomicInteger concatenations = new AtomicInteger();
  private final AtomicInteger reencodes = new AtomicInteger();
  private final Set<String> failingOutputs = ConcurrentHashMap.newKeySet();

  /** Fails every encode whose output file name contains {@code marker}. */
  void failOutputsContaining(String marker) {
    failingOutputs.add(marker);
  }

  int getSequenceEncodes() {
    return sequenceEncodes.get();
  }

  int getConcatenations() {
    return concatenations.get();
  }

  int getReencodes() {
    return reencodes.get();
  }

  @Override
  public CompletableFuture<Path> encodeSequence(List<Path> orderedFramePaths, Path outputPath) {
    sequenceEncodes.incrementAndGet();
    return write(orderedFramePaths, outputPath);
  }

  @Override
  public CompletableFuture<Path> concatenate(List<Path> orderedArtifactPaths, Path outputPath) {
    concatenations.incrementAndGet();
    return write(orderedArtifactPaths, outputPath);
  }

  @Override
  public CompletableFuture<Path> concatenateAndReencode(
      List<Path> orderedArtifactPaths, Path outputPath) {
    reencodes.incrementAndGet();
    return write(orderedArtifactPaths, outputPath);
  }

  private CompletableFuture<Path> write(List<Path> inputs, Path outputPath) {
    String outputName = outputPath.getFileName().toString();
    for (String marker : failingOutputs) {
      if (outputName.contains(marker)) {
        return CompletableFuture.failedFuture(
            new EncodeException("ffmpeg exited with code 1 for " + outputName));
      }
    }
    try {
      ByteArrayOutputStream content = new ByteArrayOutputStream();
      for (Path input : inputs) {
        content.write(Files.readAllBytes(input));
        content.write(SEPARATOR);
      }
      Files.write(outputPath, content.toByteArray());
      return CompletableFuture.completedFuture(outputPath);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
