package com.sitecam.timelapse.artifact_builder;

import static com.sitecam.timelapse.constants.BuildConstants.DAILY_ARTIFACT_DIR;
import static com.sitecam.timelapse.constants.BuildConstants.VIDEO_FILE_EXTENSION;
import static com.sitecam.timelapse.constants.BuildConstants.WEEKLY_ARTIFACT_DIR;
import static com.sitecam.timelapse.constants.BuildConstants.WEEKLY_ARTIFACT_FILE_PREFIX;

import com.google.inject.Inject;
import com.sitecam.timelapse.artifact_builder.models.ArtifactKey;
import com.sitecam.timelapse.artifact_builder.models.ArtifactType;
import com.sitecam.timelapse.storage.LocalArtifactStore;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Optional;
import javax.annotation.Nonnull;
import org.apache.commons.lang3.StringUtils;

public class ArtifactKeys {
  private final LocalArtifactStore localArtifactStore;

  @Inject
  public ArtifactKeys(@Nonnull LocalArtifactStore localArtifactStore) {
    this.localArtifactStore = localArtifactStore;
  }

  public static ArtifactKey dailyKey(String partitionName) {
    return ArtifactKey.builder().type(ArtifactType.DAILY).id(partitionName).build();
  }

  public static ArtifactKey weeklyKey(LocalDate mondayDate) {
    return ArtifactKey.builder().type(ArtifactType.WEEKLY).id(formatDateToken(mondayDate)).build();
  }

  public static String formatDateToken(LocalDate date) {
    return String.format(
        "%02d%02d%02d", date.getYear() % 100, date.getMonthValue(), date.getDayOfMonth());
  }

  public static String fileName(ArtifactKey key) {
    if (key.getType() == ArtifactType.WEEKLY) {
      return WEEKLY_ARTIFACT_FILE_PREFIX + key.getId() + VIDEO_FILE_EXTENSION;
    }
    return key.getId() + VIDEO_FILE_EXTENSION;
  }

  /** Object path relative to the remote base, mirroring the local layout. */
  public String remotePath(ArtifactKey key) {
    return directoryOf(key.getType()) + "/" + fileName(key);
  }

  public Path localPath(ArtifactKey key) {
    return localArtifactStore.resolve(directoryOf(key.getType())).resolve(fileName(key));
  }

  /** Reverses {@link #fileName(ArtifactKey)} for a file found in the daily directory. */
  public static Optional<String> partitionNameOf(String dailyFileName) {
    if (!dailyFileName.endsWith(VIDEO_FILE_EXTENSION)) {
      return Optional.empty();
    }
    String partitionName = StringUtils.removeEnd(dailyFileName, VIDEO_FILE_EXTENSION);
    return partitionName.isEmpty() ? Optional.empty() : Optional.of(partitionName);
  }

  public static String directoryOf(ArtifactType artifactType) {
    return artifactType == ArtifactType.WEEKLY ? WEEKLY_ARTIFACT_DIR : DAILY_ARTIFACT_DIR;
  }
}
