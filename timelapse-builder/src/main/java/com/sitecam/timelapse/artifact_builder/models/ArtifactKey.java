package com.sitecam.timelapse.artifact_builder.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder
@Value
public class ArtifactKey {
  @NonNull ArtifactType type;
  @NonNull String id;

  @Override
  public String toString() {
    return type.getKeyPrefix() + "/" + id;
  }
}
