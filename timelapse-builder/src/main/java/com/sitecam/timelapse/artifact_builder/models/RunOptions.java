package com.sitecam.timelapse.artifact_builder.models;

import com.sitecam.timelapse.config.models.configv1.BuildConfig;
import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder
@Value
public class RunOptions {
  @Builder.Default @NonNull Optional<Integer> recencyBoundDays = Optional.empty();
  boolean forceFullWeekSet;
  boolean buildFull;
  @Builder.Default @NonNull Set<String> reprocessPartitionNames = Collections.emptySet();

  public static RunOptions fromBuildConfig(BuildConfig buildConfig) {
    return RunOptions.builder()
        .recencyBoundDays(buildConfig.getRecencyBoundDays())
        .forceFullWeekSet(buildConfig.isForceFullWeekSet())
        .buildFull(buildConfig.isBuildFull())
        .reprocessPartitionNames(
            Collections.unmodifiableSet(new HashSet<>(buildConfig.getReprocessPartitionNames())))
        .build();
  }
}
