package com.sitecam.timelapse.artifact_builder.models;

import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder
@Value
public class WeekBucket {
  @NonNull LocalDate mondayDate;
  // ordered by date, then partition name
  @NonNull List<DailyArtifact> members;
  boolean isCurrentWeek;

  public LocalDate getSundayDate() {
    return mondayDate.plusDays(6);
  }
}
