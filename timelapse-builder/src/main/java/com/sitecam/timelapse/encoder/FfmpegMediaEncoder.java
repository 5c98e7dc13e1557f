package com.sitecam.timelapse.encoder;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import com.sitecam.timelapse.config.Config;
import com.sitecam.timelapse.config.models.configv1.VideoConfig;
import com.sitecam.timelapse.exceptions.EncodeException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

@Slf4j
public class FfmpegMediaEncoder implements MediaEncoder {
  private static final int OUTPUT_TAIL_LINES = 20;

  private final VideoConfig videoConfig;
  private final ExecutorService executorService;

  @Inject
  public FfmpegMediaEncoder(@Nonnull Config config, @Nonnull ExecutorService executorService) {
    this.videoConfig = config.getVideoConfig();
    this.executorService = executorService;
  }

  @Override
  public CompletableFuture<Path> encodeSequence(List<Path> orderedFramePaths, Path outputPath) {
    return CompletableFuture.supplyAsync(
        () -> {
          requireInputs(orderedFramePaths, outputPath);
          Path listFile = writeListFile(buildFrameList(orderedFramePaths));
          try {
            runFfmpeg(buildSequenceCommand(listFile, outputPath));
            return outputPath;
          } finally {
            FileUtils.deleteQuietly(listFile.toFile());
          }
        },
        executorService);
  }

  @Override
  public CompletableFuture<Path> concatenate(List<Path> orderedArtifactPaths, Path outputPath) {
    return CompletableFuture.supplyAsync(
        () -> {
          requireInputs(orderedArtifactPaths, outputPath);
          Path listFile = writeListFile(buildConcatList(orderedArtifactPaths));
          try {
            runFfmpeg(buildConcatCommand(listFile, outputPath));
            return outputPath;
          } finally {
            FileUtils.deleteQuietly(listFile.toFile());
          }
        },
        executorService);
  }

  @Override
  public CompletableFuture<Path> concatenateAndReencode(
      List<Path> orderedArtifactPaths, Path outputPath) {
    return CompletableFuture.supplyAsync(
        () -> {
          requireInputs(orderedArtifactPaths, outputPath);
          Path listFile = writeListFile(buildConcatList(orderedArtifactPaths));
          try {
            runFfmpeg(buildReencodeCommand(listFile, outputPath));
            return outputPath;
          } finally {
            FileUtils.deleteQuietly(listFile.toFile());
          }
        },
        executorService);
  }

  @VisibleForTesting
  List<String> buildSequenceCommand(Path listFile, Path outputPath) {
    List<String> command = concatInput(listFile);
    command.addAll(encodingArgs(videoConfig.getCrf(), videoConfig.getMaxWidth()));
    command.addAll(Arrays.asList("-r", String.valueOf(videoConfig.getFps())));
    command.add(outputPath.toAbsolutePath().toString());
    return command;
  }

  @VisibleForTesting
  List<String> buildConcatCommand(Path listFile, Path outputPath) {
    List<String> command = concatInput(listFile);
    command.addAll(Arrays.asList("-c", "copy"));
    command.add(outputPath.toAbsolutePath().toString());
    return command;
  }

  @VisibleForTesting
  List<String> buildReencodeCommand(Path listFile, Path outputPath) {
    VideoConfig.FullVideoConfig fullVideo = videoConfig.getFullVideo();
    List<String> command = concatInput(listFile);
    command.addAll(encodingArgs(fullVideo.getCrf(), fullVideo.getMaxWidth()));
    command.addAll(Arrays.asList("-r", String.valueOf(fullVideo.getFps())));
    command.add(outputPath.toAbsolutePath().toString());
    return command;
  }

  /**
   * Each frame is shown for one output frame interval. The last frame is listed twice because the
   * concat demuxer ignores the duration of the final entry.
   */
  @VisibleForTesting
  String buildFrameList(List<Path> orderedFramePaths) {
    String frameDuration = String.format(Locale.ROOT, "%.6f", 1.0d / videoConfig.getFps());
    StringBuilder list = new StringBuilder();
    for (Path framePath : orderedFramePaths) {
      list.append(fileEntry(framePath)).append('\n');
      list.append("duration ").append(frameDuration).append('\n');
    }
    list.append(fileEntry(orderedFramePaths.get(orderedFramePaths.size() - 1))).append('\n');
    return list.toString();
  }

  @VisibleForTesting
  String buildConcatList(List<Path> orderedArtifactPaths) {
    StringBuilder list = new StringBuilder();
    for (Path artifactPath : orderedArtifactPaths) {
      list.append(fileEntry(artifactPath)).append('\n');
    }
    return list.toString();
  }

  @VisibleForTesting
  void runFfmpeg(List<String> command) {
    log.debug("Running {}", String.join(" ", command));
    Path outputLog = null;
    try {
      outputLog = Files.createTempFile("ffmpeg-", ".log");
      ProcessBuilder processBuilder = new ProcessBuilder(command);
      processBuilder.redirectErrorStream(true);
      processBuilder.redirectOutput(outputLog.toFile());
      Process process = processBuilder.start();
      if (!process.waitFor(videoConfig.getEncodeTimeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new EncodeException(
            String.format(
                "ffmpeg did not finish within %d seconds", videoConfig.getEncodeTimeoutSeconds()));
      }
      if (process.exitValue() != 0) {
        throw new EncodeException(
            String.format(
                "ffmpeg failed with exit code %d: %s",
                process.exitValue(), readTail(outputLog)));
      }
    } catch (IOException e) {
      throw new EncodeException("Failed to run ffmpeg at " + videoConfig.getFfmpegPath(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EncodeException("Interrupted while waiting for ffmpeg", e);
    } finally {
      if (outputLog != null) {
        FileUtils.deleteQuietly(outputLog.toFile());
      }
    }
  }

  private List<String> concatInput(Path listFile) {
    return new ArrayList<>(
        Arrays.asList(
            videoConfig.getFfmpegPath(),
            "-y",
            "-hide_banner",
            "-loglevel",
            "error",
            "-f",
            "concat",
            "-safe",
            "0",
            "-i",
            listFile.toAbsolutePath().toString()));
  }

  private List<String> encodingArgs(int crf, int maxWidth) {
    List<String> args =
        new ArrayList<>(
            Arrays.asList(
                "-c:v",
                videoConfig.getCodec(),
                "-preset",
                videoConfig.getPreset(),
                "-crf",
                String.valueOf(crf),
                "-pix_fmt",
                "yuv420p",
                "-movflags",
                "+faststart"));
    if (maxWidth > 0) {
      // -2 keeps the height even, which yuv420p requires
      args.addAll(Arrays.asList("-vf", String.format("scale=%d:-2:flags=lanczos", maxWidth)));
    }
    return args;
  }

  private static String fileEntry(Path path) {
    // concat demuxer quoting: close the quote, emit an escaped quote, reopen
    return "file '" + path.toAbsolutePath().toString().replace("'", "'\\''") + "'";
  }

  private static void requireInputs(List<Path> inputs, Path outputPath) {
    if (inputs == null || inputs.isEmpty()) {
      throw new EncodeException("No inputs to encode into " + outputPath);
    }
  }

  private static Path writeListFile(String content) {
    try {
      Path listFile = Files.createTempFile("ffmpeg-concat-", ".txt");
      Files.write(listFile, content.getBytes(StandardCharsets.UTF_8));
      return listFile;
    } catch (IOException e) {
      throw new EncodeException("Failed to write ffmpeg input list", e);
    }
  }

  private static String readTail(Path outputLog) {
    try {
      List<String> lines = Files.readAllLines(outputLog, StandardCharsets.UTF_8);
      return StringUtils.join(
          lines.subList(Math.max(0, lines.size() - OUTPUT_TAIL_LINES), lines.size()), '\n');
    } catch (IOException e) {
      log.warn("Failed to read ffmpeg output", e);
      return "<output unavailable>";
    }
  }
}
