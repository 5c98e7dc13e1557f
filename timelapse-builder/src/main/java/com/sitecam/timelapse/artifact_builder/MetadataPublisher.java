package com.sitecam.timelapse.artifact_builder;

import static com.sitecam.timelapse.constants.BuildConstants.LATEST_IMAGE_ALIAS;
import static com.sitecam.timelapse.constants.BuildConstants.METADATA_FILE;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import com.sitecam.timelapse.artifact_builder.models.DailyArtifact;
import com.sitecam.timelapse.artifact_builder.models.ItemRef;
import com.sitecam.timelapse.artifact_builder.models.SourcePartition;
import com.sitecam.timelapse.artifact_builder.models.TimelapseMetadata;
import com.sitecam.timelapse.artifact_builder.models.WeeklyArtifact;
import com.sitecam.timelapse.config.Config;
import com.sitecam.timelapse.source.RawInputSource;
import com.sitecam.timelapse.storage.LocalArtifactStore;
import com.sitecam.timelapse.storage.RemoteArtifactStore;
import com.sitecam.timelapse.storage.StorageUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class MetadataPublisher {
  private static final DateTimeFormatter ISO_DATE_TIME = DateTimeFormatter.ISO_LOCAL_DATE_TIME;
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private final RawInputSource rawInputSource;
  private final SyncAndRetentionManager syncAndRetentionManager;
  private final RemoteArtifactStore remoteArtifactStore;
  private final LocalArtifactStore localArtifactStore;
  private final ArtifactKeys artifactKeys;
  private final CalendarPartitioner calendarPartitioner;
  private final StorageUtils storageUtils;
  private final Clock clock;
  private final Config config;

  @Inject
  public MetadataPublisher(
      @Nonnull RawInputSource rawInputSource,
      @Nonnull SyncAndRetentionManager syncAndRetentionManager,
      @Nonnull RemoteArtifactStore remoteArtifactStore,
      @Nonnull LocalArtifactStore localArtifactStore,
      @Nonnull ArtifactKeys artifactKeys,
      @Nonnull CalendarPartitioner calendarPartitioner,
      @Nonnull StorageUtils storageUtils,
      @Nonnull Clock clock,
      @Nonnull Config config) {
    this.rawInputSource = rawInputSource;
    this.syncAndRetentionManager = syncAndRetentionManager;
    this.remoteArtifactStore = remoteArtifactStore;
    this.localArtifactStore = localArtifactStore;
    this.artifactKeys = artifactKeys;
    this.calendarPartitioner = calendarPartitioner;
    this.storageUtils = storageUtils;
    this.clock = clock;
    this.config = config;
  }

  /**
   * Publishes the last frame of the newest partition that has any frames. Returns the frame's
   * name, or empty when disabled or no partition holds a frame.
   */
  public CompletableFuture<Optional<String>> publishLatestImage(List<SourcePartition> partitions) {
    if (!config.getSourceConfig().isLatestImageEnabled() || partitions.isEmpty()) {
      return CompletableFuture.completedFuture(Optional.empty());
    }
    List<SourcePartition> newestFirst = new ArrayList<>(partitions);
    newestFirst.sort(
        Comparator.comparing(
                SourcePartition::getDate,
                Comparator.nullsFirst(Comparator.<LocalDate>naturalOrder()))
            .thenComparing(SourcePartition::getName)
            .reversed());
    return findLatestImage(newestFirst, 0)
        .thenCompose(
            latest -> {
              if (!latest.isPresent()) {
                log.info("No frame found for {}", LATEST_IMAGE_ALIAS);
                return CompletableFuture.completedFuture(Optional.<String>empty());
              }
              String itemName = latest.get().getName();
              return rawInputSource
                  .fetchItem(latest.get())
                  .thenCompose(
                      content -> {
                        localArtifactStore.write(
                            localArtifactStore.resolve(LATEST_IMAGE_ALIAS), content);
                        return syncAndRetentionManager.publishBytes(content, LATEST_IMAGE_ALIAS);
                      })
                  .thenApply(
                      ignored -> {
                        log.info("Published {} from {}", LATEST_IMAGE_ALIAS, itemName);
                        return Optional.of(itemName);
                      });
            });
  }

  private CompletableFuture<Optional<ItemRef>> findLatestImage(
      List<SourcePartition> newestFirst, int index) {
    if (index >= newestFirst.size()) {
      return CompletableFuture.completedFuture(Optional.empty());
    }
    return rawInputSource
        .listItems(newestFirst.get(index))
        .thenCompose(
            items ->
                items.isEmpty()
                    ? findLatestImage(newestFirst, index + 1)
                    : CompletableFuture.completedFuture(
                        Optional.of(items.get(items.size() - 1))));
  }

  public CompletableFuture<Void> publishMetadata(TimelapseMetadata metadata) {
    byte[] content;
    try {
      content = JSON_MAPPER.writeValueAsBytes(metadata);
    } catch (IOException e) {
      return CompletableFuture.failedFuture(
          new UncheckedIOException("Failed to serialize metadata", e));
    }
    localArtifactStore.write(localArtifactStore.resolve(METADATA_FILE), content);
    return syncAndRetentionManager.publishBytes(content, METADATA_FILE);
  }

  /**
   * Builds the metadata document from the daily and weekly artifacts available after this run.
   * Dates are rendered as ISO local date-times at midnight.
   */
  public TimelapseMetadata buildMetadata(
      List<DailyArtifact> availableDailies,
      List<WeeklyArtifact> availableWeeklies,
      Optional<String> latestImageName) {
    List<LocalDate> dates =
        availableDailies.stream()
            .map(DailyArtifact::getDate)
            .sorted()
            .collect(Collectors.toList());
    Optional<String> latestDay =
        dates.isEmpty() ? Optional.empty() : Optional.of(atMidnight(dates.get(dates.size() - 1)));

    List<WeeklyArtifact> orderedWeeklies = new ArrayList<>(availableWeeklies);
    orderedWeeklies.sort(Comparator.comparing(WeeklyArtifact::getMondayDate));

    return TimelapseMetadata.builder()
        .lastUpdated(LocalDateTime.now(clock).format(ISO_DATE_TIME))
        .totalDays(availableDailies.size())
        .latestImage(
            latestImageName.isPresent() && latestDay.isPresent()
                ? TimelapseMetadata.LatestImage.builder()
                    .date(latestDay.get())
                    .filename(latestImageName.get())
                    .build()
                : null)
        .latestDay(latestDay.orElse(null))
        .currentWeek(
            orderedWeeklies.stream()
                .filter(WeeklyArtifact::isCurrentWeek)
                .findFirst()
                .map(
                    weekly ->
                        TimelapseMetadata.DateSpan.builder()
                            .start(atMidnight(weekly.getMondayDate()))
                            .end(atMidnight(weekly.getMondayDate().plusDays(6)))
                            .mondayDate(weekly.getKey().getId())
                            .build())
                .orElse(null))
        .weeklyVideos(
            orderedWeeklies.stream().map(this::toWeeklyVideo).collect(Collectors.toList()))
        .dateRange(
            TimelapseMetadata.DateSpan.builder()
                .start(dates.isEmpty() ? null : atMidnight(dates.get(0)))
                .end(latestDay.orElse(null))
                .build())
        .events(loadEvents())
        .build();
  }

  private TimelapseMetadata.WeeklyVideo toWeeklyVideo(WeeklyArtifact weekly) {
    String remotePath = artifactKeys.remotePath(weekly.getKey());
    return TimelapseMetadata.WeeklyVideo.builder()
        .filename(ArtifactKeys.fileName(weekly.getKey()))
        .mondayDate(weekly.getKey().getId())
        .start(atMidnight(weekly.getMondayDate()))
        .end(atMidnight(weekly.getMondayDate().plusDays(6)))
        .remotePath(storageUtils.getPathFromUrl(remoteArtifactStore.locate(remotePath)))
        .build();
  }

  /**
   * Reads the optional events file, a YAML document with an {@code events} list of entries
   * carrying {@code title}, {@code date} and an optional {@code description}. A broken file is
   * logged and ignored.
   */
  @VisibleForTesting
  List<TimelapseMetadata.Event> loadEvents() {
    Optional<String> eventsFilePath = config.getBuildConfig().getEventsFilePath();
    if (!eventsFilePath.isPresent()) {
      return new ArrayList<>();
    }
    Path path = Paths.get(eventsFilePath.get());
    if (!Files.isRegularFile(path)) {
      log.debug("No events file at {}", path);
      return new ArrayList<>();
    }
    List<TimelapseMetadata.Event> events = new ArrayList<>();
    try {
      JsonNode root = YAML_MAPPER.readTree(path.toFile());
      for (JsonNode eventNode : root.path("events")) {
        if (!eventNode.hasNonNull("date")) {
          continue;
        }
        LocalDateTime eventDate = parseEventDate(eventNode.get("date").asText());
        events.add(
            TimelapseMetadata.Event.builder()
                .title(eventNode.path("title").asText(""))
                .date(eventDate.format(ISO_DATE_TIME))
                .mondayDate(
                    ArtifactKeys.formatDateToken(
                        calendarPartitioner.weekAnchor(eventDate.toLocalDate())))
                .description(
                    eventNode.hasNonNull("description")
                        ? eventNode.get("description").asText()
                        : null)
                .build());
      }
    } catch (IOException | DateTimeParseException e) {
      log.warn("Failed to load events from {}", path, e);
      return new ArrayList<>();
    }
    return events;
  }

  private static LocalDateTime parseEventDate(String value) {
    return value.contains("T")
        ? LocalDateTime.parse(value, ISO_DATE_TIME)
        : LocalDate.parse(value).atStartOfDay();
  }

  private static String atMidnight(LocalDate date) {
    return date.atStartOfDay().format(ISO_DATE_TIME);
  }
}
