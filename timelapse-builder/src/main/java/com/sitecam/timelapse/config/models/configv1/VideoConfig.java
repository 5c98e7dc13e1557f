package com.sitecam.timelapse.config.models.configv1;

import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_ENCODE_TIMEOUT_SECONDS;
import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_FULL_VIDEO_CRF;
import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_FULL_VIDEO_FPS;
import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_FULL_VIDEO_MAX_WIDTH;
import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_VIDEO_CODEC;
import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_VIDEO_CRF;
import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_VIDEO_FPS;
import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_VIDEO_MAX_WIDTH;
import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_VIDEO_PRESET;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

@Builder
@Getter
@Jacksonized
@EqualsAndHashCode
public class VideoConfig {
  @Builder.Default private String ffmpegPath = "ffmpeg";
  @Builder.Default private int fps = DEFAULT_VIDEO_FPS;
  @Builder.Default private String codec = DEFAULT_VIDEO_CODEC;
  @Builder.Default private String preset = DEFAULT_VIDEO_PRESET;
  @Builder.Default private int crf = DEFAULT_VIDEO_CRF;
  // 0 keeps the source width
  @Builder.Default private int maxWidth = DEFAULT_VIDEO_MAX_WIDTH;
  @Builder.Default private long encodeTimeoutSeconds = DEFAULT_ENCODE_TIMEOUT_SECONDS;
  @Builder.Default private FullVideoConfig fullVideo = FullVideoConfig.builder().build();

  @Builder
  @Getter
  @Jacksonized
  @EqualsAndHashCode
  public static class FullVideoConfig {
    @Builder.Default private int crf = DEFAULT_FULL_VIDEO_CRF;
    @Builder.Default private int maxWidth = DEFAULT_FULL_VIDEO_MAX_WIDTH;
    @Builder.Default private int fps = DEFAULT_FULL_VIDEO_FPS;
  }
}
