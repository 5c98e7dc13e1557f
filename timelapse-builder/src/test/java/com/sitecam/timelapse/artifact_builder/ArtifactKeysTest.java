package com.sitecam.timelapse.artifact_builder;

import static org.junit.jupiter.api.Assertions.*;

import com.sitecam.timelapse.artifact_builder.models.ArtifactKey;
import com.sitecam.timelapse.artifact_builder.models.ArtifactType;
import com.sitecam.timelapse.storage.LocalArtifactStore;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ArtifactKeysTest {
  private final Path baseDirectory = Paths.get("/data/videos");
  private final ArtifactKeys artifactKeys = new ArtifactKeys(new LocalArtifactStore(baseDirectory));

  @Test
  void testDailyKey() {
    ArtifactKey key = ArtifactKeys.dailyKey("TLST04A00879_250714_0600");
    assertEquals(ArtifactType.DAILY, key.getType());
    assertEquals("daily/TLST04A00879_250714_0600", key.toString());
    assertEquals("daily/TLST04A00879_250714_0600.mp4", artifactKeys.remotePath(key));
    assertEquals(
        baseDirectory.resolve("daily").resolve("TLST04A00879_250714_0600.mp4"),
        artifactKeys.localPath(key));
  }

  @Test
  void testWeeklyKey() {
    ArtifactKey key = ArtifactKeys.weeklyKey(LocalDate.of(2025, 7, 14));
    assertEquals(ArtifactType.WEEKLY, key.getType());
    assertEquals("250714", key.getId());
    assertEquals("weekly/250714", key.toString());
    assertEquals("weeks/timelapse_week_250714.mp4", artifactKeys.remotePath(key));
    assertEquals(
        baseDirectory.resolve("weeks").resolve("timelapse_week_250714.mp4"),
        artifactKeys.localPath(key));
  }

  @Test
  void testKeysAreValueObjects() {
    assertEquals(ArtifactKeys.dailyKey("X_250714"), ArtifactKeys.dailyKey("X_250714"));
    assertNotEquals(ArtifactKeys.dailyKey("X_250714"), ArtifactKeys.dailyKey("X_250715"));
  }

  @Test
  void testFormatDateToken() {
    assertEquals("250105", ArtifactKeys.formatDateToken(LocalDate.of(2025, 1, 5)));
    assertEquals("991231", ArtifactKeys.formatDateToken(LocalDate.of(2099, 12, 31)));
  }

  @Test
  void testPartitionNameOf() {
    assertEquals(Optional.of("X_250714"), ArtifactKeys.partitionNameOf("X_250714.mp4"));
    assertEquals(Optional.empty(), ArtifactKeys.partitionNameOf("X_250714.json"));
    assertEquals(Optional.empty(), ArtifactKeys.partitionNameOf(".mp4"));
  }
}
