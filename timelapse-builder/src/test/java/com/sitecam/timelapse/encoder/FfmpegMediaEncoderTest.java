package com.sitecam.timelapse.encoder;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.sitecam.timelapse.config.Config;
import com.sitecam.timelapse.config.models.configv1.VideoConfig;
import com.sitecam.timelapse.exceptions.EncodeException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ForkJoinPool;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class FfmpegMediaEncoderTest {
  private static final Path LIST_FILE = Paths.get("/tmp/list.txt");
  private static final Path OUTPUT = Paths.get("/videos/daily/TLST04A00879_250710_0600.mp4");

  @TempDir Path workDirectory;

  private static FfmpegMediaEncoder encoder(VideoConfig videoConfig) {
    Config config = mock(Config.class);
    when(config.getVideoConfig()).thenReturn(videoConfig);
    return new FfmpegMediaEncoder(config, ForkJoinPool.commonPool());
  }

  private static List<String> concatInput(String ffmpegPath) {
    return Arrays.asList(
        ffmpegPath,
        "-y",
        "-hide_banner",
        "-loglevel",
        "error",
        "-f",
        "concat",
        "-safe",
        "0",
        "-i",
        "/tmp/list.txt");
  }

  @Test
  void testSequenceCommandUsesDailySettings() {
    FfmpegMediaEncoder encoder = encoder(VideoConfig.builder().fps(24).build());

    List<String> command = encoder.buildSequenceCommand(LIST_FILE, OUTPUT);

    assertEquals(concatInput("ffmpeg"), command.subList(0, 11));
    assertEquals(
        Arrays.asList(
            "-c:v",
            "libx264",
            "-preset",
            "slow",
            "-crf",
            "28",
            "-pix_fmt",
            "yuv420p",
            "-movflags",
            "+faststart",
            "-vf",
            "scale=1920:-2:flags=lanczos",
            "-r",
            "24",
            OUTPUT.toString()),
        command.subList(11, command.size()));
  }

  @Test
  void testZeroMaxWidthKeepsTheSourceWidth() {
    FfmpegMediaEncoder encoder = encoder(VideoConfig.builder().maxWidth(0).build());

    assertFalse(encoder.buildSequenceCommand(LIST_FILE, OUTPUT).contains("-vf"));
  }

  @Test
  void testConcatCommandCopiesStreams() {
    FfmpegMediaEncoder encoder =
        encoder(VideoConfig.builder().ffmpegPath("/opt/ffmpeg/bin/ffmpeg").build());
    Path weekly = Paths.get("/videos/weeks/timelapse_week_250707.mp4");

    List<String> command = encoder.buildConcatCommand(LIST_FILE, weekly);

    assertEquals(concatInput("/opt/ffmpeg/bin/ffmpeg"), command.subList(0, 11));
    assertEquals(
        Arrays.asList("-c", "copy", weekly.toString()), command.subList(11, command.size()));
  }

  @Test
  void testReencodeCommandUsesFullTimelapseSettings() {
    FfmpegMediaEncoder encoder =
        encoder(
            VideoConfig.builder()
                .fullVideo(
                    VideoConfig.FullVideoConfig.builder().crf(35).maxWidth(960).fps(15).build())
                .build());
    Path full = Paths.get("/videos/timelapse_full.mp4");

    List<String> command = encoder.buildReencodeCommand(LIST_FILE, full);

    assertEquals("35", command.get(command.indexOf("-crf") + 1));
    assertEquals("scale=960:-2:flags=lanczos", command.get(command.indexOf("-vf") + 1));
    assertEquals("15", command.get(command.indexOf("-r") + 1));
    assertEquals(full.toString(), command.get(command.size() - 1));
  }

  @Test
  void testFrameListHoldsEachFrameForOneInterval() {
    FfmpegMediaEncoder encoder = encoder(VideoConfig.builder().fps(25).build());

    String frameList =
        encoder.buildFrameList(
            Arrays.asList(Paths.get("/frames/TLS_0001.jpg"), Paths.get("/frames/TLS_0002.jpg")));

    assertEquals(
        "file '/frames/TLS_0001.jpg'\n"
            + "duration 0.040000\n"
            + "file '/frames/TLS_0002.jpg'\n"
            + "duration 0.040000\n"
            + "file '/frames/TLS_0002.jpg'\n",
        frameList);
  }

  @Test
  void testConcatListEscapesQuotes() {
    FfmpegMediaEncoder encoder = encoder(VideoConfig.builder().build());

    String concatList =
        encoder.buildConcatList(
            Arrays.asList(Paths.get("/videos/daily/a.mp4"), Paths.get("/videos/site's/b.mp4")));

    assertEquals(
        "file '/videos/daily/a.mp4'\nfile '/videos/site'\\''s/b.mp4'\n", concatList);
  }

  @Test
  void testEncodingNothingFails() {
    FfmpegMediaEncoder encoder = encoder(VideoConfig.builder().build());

    CompletionException exception =
        assertThrows(
            CompletionException.class,
            () -> encoder.encodeSequence(Collections.emptyList(), OUTPUT).join());

    assertInstanceOf(EncodeException.class, exception.getCause());
  }

  @Test
  void testMissingBinaryFailsTheEncode() {
    FfmpegMediaEncoder encoder =
        encoder(
            VideoConfig.builder()
                .ffmpegPath(workDirectory.resolve("missing-ffmpeg").toString())
                .build());

    CompletionException exception =
        assertThrows(
            CompletionException.class,
            () ->
                encoder
                    .concatenate(
                        Collections.singletonList(workDirectory.resolve("day.mp4")),
                        workDirectory.resolve("week.mp4"))
                    .join());

    assertInstanceOf(EncodeException.class, exception.getCause());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void testNonZeroExitReportsTheOutputTail() {
    FfmpegMediaEncoder encoder = encoder(VideoConfig.builder().build());

    EncodeException exception =
        assertThrows(
            EncodeException.class,
            () -> encoder.runFfmpeg(Arrays.asList("sh", "-c", "echo broken input; exit 3")));

    assertEquals("ffmpeg failed with exit code 3: broken input", exception.getMessage());
  }
}
