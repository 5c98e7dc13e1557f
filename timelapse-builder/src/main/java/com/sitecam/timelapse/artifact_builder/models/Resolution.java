package com.sitecam.timelapse.artifact_builder.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder
@Value
public class Resolution {
  @NonNull ResolutionState state;
  boolean existsLocal;
  // only meaningful when the remote tier was consulted
  boolean existsRemote;

  public static Resolution missing() {
    return Resolution.builder().state(ResolutionState.MISSING).build();
  }
}
