package com.sitecam.timelapse.config;

import com.sitecam.timelapse.config.models.common.FileSystemConfiguration;
import com.sitecam.timelapse.config.models.configv1.ArtifactStoreConfig;
import com.sitecam.timelapse.config.models.configv1.BuildConfig;
import com.sitecam.timelapse.config.models.configv1.SourceConfig;
import com.sitecam.timelapse.config.models.configv1.VideoConfig;

public interface Config {
  ConfigVersion getVersion();

  FileSystemConfiguration getFileSystemConfiguration();

  SourceConfig getSourceConfig();

  ArtifactStoreConfig getArtifactStoreConfig();

  BuildConfig getBuildConfig();

  VideoConfig getVideoConfig();
}
