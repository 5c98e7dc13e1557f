package com.sitecam.timelapse.artifact_builder.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder
@Value
public class ItemRef {
  @NonNull String id;
  @NonNull String name;
}
