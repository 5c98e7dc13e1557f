package com.sitecam.timelapse.artifact_builder.models;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder
@Value
public class DailyBuildPlan {
  // every daily artifact known to this run, ordered by date then partition name
  @NonNull List<DailyArtifact> artifacts;
  // Monday of the week holding the partition still being captured, absent without raw input
  @Builder.Default @NonNull Optional<LocalDate> currentMonday = Optional.empty();

  public List<DailyArtifact> getArtifactsToRebuild() {
    return withState(ArtifactBuildState.REBUILD);
  }

  public List<DailyArtifact> withState(ArtifactBuildState state) {
    return artifacts.stream()
        .filter(artifact -> artifact.getState() == state)
        .collect(Collectors.toList());
  }
}
