package com.sitecam.timelapse.artifact_builder.models;

import java.time.LocalDate;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder(toBuilder = true)
@Value
public class SourcePartition {
  // fully qualified location of the partition in the raw input tier
  @NonNull String id;
  @NonNull String name;
  // null until the name has been parsed
  LocalDate date;
}
