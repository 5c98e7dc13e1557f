package com.sitecam.timelapse.artifact_builder.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Builder
@Value
@JsonInclude(JsonInclude.Include.ALWAYS)
public class TimelapseMetadata {
  @JsonProperty("last_updated")
  String lastUpdated;

  @JsonProperty("total_days")
  int totalDays;

  @JsonProperty("latest_image")
  LatestImage latestImage;

  @JsonProperty("latest_day")
  String latestDay;

  @JsonProperty("current_week")
  DateSpan currentWeek;

  @JsonProperty("weekly_videos")
  List<WeeklyVideo> weeklyVideos;

  @JsonProperty("date_range")
  DateSpan dateRange;

  List<Event> events;

  @Builder
  @Value
  public static class LatestImage {
    String date;
    String filename;
  }

  @Builder
  @Value
  public static class DateSpan {
    String start;
    String end;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("monday_date")
    String mondayDate;
  }

  @Builder
  @Value
  public static class WeeklyVideo {
    String filename;

    @JsonProperty("monday_date")
    String mondayDate;

    String start;
    String end;

    @JsonProperty("r2_path")
    String remotePath;
  }

  @Builder
  @Value
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class Event {
    String title;
    String date;

    @JsonProperty("monday_date")
    String mondayDate;

    String description;
  }
}
