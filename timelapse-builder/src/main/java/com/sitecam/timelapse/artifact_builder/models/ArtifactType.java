package com.sitecam.timelapse.artifact_builder.models;

import static com.sitecam.timelapse.constants.BuildConstants.DAILY_KEY_PREFIX;
import static com.sitecam.timelapse.constants.BuildConstants.WEEKLY_KEY_PREFIX;

import lombok.Getter;

public enum ArtifactType {
  DAILY(DAILY_KEY_PREFIX),
  WEEKLY(WEEKLY_KEY_PREFIX);

  @Getter private final String keyPrefix;

  ArtifactType(String keyPrefix) {
    this.keyPrefix = keyPrefix;
  }
}
