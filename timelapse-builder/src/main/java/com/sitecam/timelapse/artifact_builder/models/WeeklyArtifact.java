package com.sitecam.timelapse.artifact_builder.models;

import java.time.LocalDate;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder(toBuilder = true)
@Value
public class WeeklyArtifact {
  @NonNull ArtifactKey key;
  @NonNull LocalDate mondayDate;
  boolean isCurrentWeek;
  boolean existsLocal;
  boolean existsRemote;
  @Builder.Default @NonNull ArtifactBuildState state = ArtifactBuildState.UNRESOLVED;
}
