package com.sitecam.timelapse.artifact_builder.models;

import java.time.LocalDate;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder(toBuilder = true)
@Value
public class DailyArtifact {
  @NonNull ArtifactKey key;
  @NonNull String partitionName;
  @NonNull LocalDate date;
  // absent when the artifact outlived its raw partition
  SourcePartition sourcePartition;
  boolean isCurrent;
  boolean existsLocal;
  boolean existsRemote;
  @Builder.Default @NonNull ArtifactBuildState state = ArtifactBuildState.UNRESOLVED;
  // set for manual reprocess requests
  boolean forced;
}
