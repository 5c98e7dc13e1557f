package com.sitecam.timelapse.config.models.configv1;

import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_LOCAL_BASE_DIR;
import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_STATE_OBJECT_PATH;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.jackson.Jacksonized;

@Builder
@Getter
@Jacksonized
@EqualsAndHashCode
public class ArtifactStoreConfig {
  @NonNull private String remoteBaseUri;
  @Builder.Default private String localBaseDir = DEFAULT_LOCAL_BASE_DIR;
  // relative to remoteBaseUri
  @Builder.Default private String stateObjectPath = DEFAULT_STATE_OBJECT_PATH;
}
