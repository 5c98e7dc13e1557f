package com.sitecam.timelapse.artifact_builder.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Builder(toBuilder = true)
@Value
@Jacksonized
public class ProcessingState {
  @JsonProperty("processed_folders")
  @Builder.Default
  @NonNull
  SortedSet<String> processedPartitionNames = Collections.emptySortedSet();

  @JsonProperty("last_processed_date")
  LocalDate lastProcessedDate;

  // keyed by the week's Monday
  @JsonProperty("weekly_coverage")
  @Builder.Default
  @NonNull
  SortedMap<LocalDate, SortedSet<String>> weeklyCoverage = Collections.emptySortedMap();

  public static ProcessingState empty() {
    return ProcessingState.builder().build();
  }

  public boolean isProcessed(String partitionName) {
    return processedPartitionNames.contains(partitionName);
  }

  /** Whether the durable weekly artifact of {@code mondayDate} contains {@code partitionName}. */
  public boolean isCovered(LocalDate mondayDate, String partitionName) {
    SortedSet<String> covered = weeklyCoverage.get(mondayDate);
    return covered != null && covered.contains(partitionName);
  }

  public ProcessingState withProcessed(String partitionName, LocalDate date) {
    SortedSet<String> names = new TreeSet<>(processedPartitionNames);
    names.add(partitionName);
    return toBuilder()
        .processedPartitionNames(Collections.unmodifiableSortedSet(names))
        .lastProcessedDate(latest(lastProcessedDate, date))
        .build();
  }

  /** Replaces the coverage of one week with the members its weekly artifact was just built from. */
  public ProcessingState withWeekCoverage(LocalDate mondayDate, Collection<String> partitionNames) {
    SortedMap<LocalDate, SortedSet<String>> coverage = new TreeMap<>(weeklyCoverage);
    coverage.put(mondayDate, Collections.unmodifiableSortedSet(new TreeSet<>(partitionNames)));
    return toBuilder().weeklyCoverage(Collections.unmodifiableSortedMap(coverage)).build();
  }

  /**
   * Union of both states, so that concurrent writers never drop each other's entries. A week
   * recorded by both keeps the coverage of this state.
   */
  public ProcessingState merge(ProcessingState other) {
    SortedSet<String> names = new TreeSet<>(processedPartitionNames);
    names.addAll(other.getProcessedPartitionNames());
    SortedMap<LocalDate, SortedSet<String>> coverage = new TreeMap<>(other.getWeeklyCoverage());
    coverage.putAll(weeklyCoverage);
    return ProcessingState.builder()
        .processedPartitionNames(Collections.unmodifiableSortedSet(names))
        .lastProcessedDate(latest(lastProcessedDate, other.getLastProcessedDate()))
        .weeklyCoverage(Collections.unmodifiableSortedMap(coverage))
        .build();
  }

  private static LocalDate latest(LocalDate first, LocalDate second) {
    if (first == null) {
      return second;
    }
    if (second == null) {
      return first;
    }
    return first.isAfter(second) ? first : second;
  }
}
