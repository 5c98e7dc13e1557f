package com.sitecam.timelapse.artifact_builder.models;

public enum ResolutionState {
  LOCAL_FRESH,
  REMOTE_FRESH,
  MISSING;

  public boolean isFresh() {
    return this != MISSING;
  }
}
