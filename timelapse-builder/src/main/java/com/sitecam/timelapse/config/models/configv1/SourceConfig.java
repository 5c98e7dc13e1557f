package com.sitecam.timelapse.config.models.configv1;

import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_ITEM_NAME_PREFIX;
import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_ITEM_NAME_SUFFIX;
import static com.sitecam.timelapse.constants.BuildConstants.DEFAULT_PARTITION_NAME_PREFIX;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.jackson.Jacksonized;

@Builder
@Getter
@Jacksonized
@EqualsAndHashCode
public class SourceConfig {
  // directory holding one sub-directory of images per day
  @NonNull private String rootUri;
  @Builder.Default private String partitionNamePrefix = DEFAULT_PARTITION_NAME_PREFIX;
  @Builder.Default private String itemNamePrefix = DEFAULT_ITEM_NAME_PREFIX;
  @Builder.Default private String itemNameSuffix = DEFAULT_ITEM_NAME_SUFFIX;
  @Builder.Default private boolean latestImageEnabled = true;
}
