package com.sitecam.timelapse.config.models.configv1;

import com.sitecam.timelapse.config.Config;
import com.sitecam.timelapse.config.ConfigVersion;
import com.sitecam.timelapse.config.models.common.FileSystemConfiguration;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.jackson.Jacksonized;

@Builder(toBuilder = true)
@Getter
@Jacksonized
@EqualsAndHashCode
public class ConfigV1 implements Config {
  @NonNull private String version;
  @NonNull private FileSystemConfiguration fileSystemConfiguration;
  @NonNull private SourceConfig sourceConfig;
  @NonNull private ArtifactStoreConfig artifactStoreConfig;
  @Builder.Default private BuildConfig buildConfig = BuildConfig.builder().build();
  @Builder.Default private VideoConfig videoConfig = VideoConfig.builder().build();

  @Override
  public ConfigVersion getVersion() {
    return ConfigVersion.valueOf(version);
  }
}
