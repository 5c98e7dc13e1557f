package com.sitecam.timelapse.artifact_builder.models;

public enum ArtifactBuildState {
  UNRESOLVED,
  SKIP,
  REBUILD,
  BUILT,
  UPLOADED,
  // evicted after its week became durable, nothing left to rebuild or aggregate
  RETIRED,
  OUT_OF_BOUND;

  public boolean isAvailable() {
    return this == SKIP || this == BUILT || this == UPLOADED;
  }
}
