package com.sitecam.timelapse.artifact_builder.models;

import com.sitecam.timelapse.constants.MetricsConstants.BuildFailureReasons;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder
@Value
public class BuildFailure {
  @NonNull BuildFailureReasons reason;
  String message;
}
