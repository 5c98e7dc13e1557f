package com.sitecam.timelapse;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.sitecam.timelapse.config.Config;
import com.sitecam.timelapse.config.models.configv1.ArtifactStoreConfig;
import com.sitecam.timelapse.config.models.configv1.SourceConfig;
import com.sitecam.timelapse.storage.AsyncStorageClient;
import com.sitecam.timelapse.storage.GCSAsyncStorageClient;
import com.sitecam.timelapse.storage.LocalArtifactStore;
import com.sitecam.timelapse.storage.S3AsyncStorageClient;
import com.sitecam.timelapse.storage.StorageUtils;
import com.sitecam.timelapse.storage.providers.GcsClientProvider;
import com.sitecam.timelapse.storage.providers.S3AsyncClientProvider;
import java.util.concurrent.ExecutorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TestRuntimeModule {
  private Config mockConfig;
  private S3AsyncClientProvider mockS3AsyncClientProvider;
  private GcsClientProvider mockGcsClientProvider;
  private ExecutorService mockExecutorService;

  @BeforeEach
  void setUp() {
    mockConfig = mock(Config.class);
    mockS3AsyncClientProvider = mock(S3AsyncClientProvider.class);
    mockGcsClientProvider = mock(GcsClientProvider.class);
    mockExecutorService = mock(ExecutorService.class);
  }

  @ParameterizedTest
  @CsvSource({
    "s3://camera-uploads/site-a, s3://timelapse-public/site-a, S3, S3",
    "gs://camera-uploads/site-a, s3://timelapse-public/site-a, GCS, S3",
    "s3://camera-uploads/site-a, gs://timelapse-public/site-a, S3, GCS",
    "gs://camera-uploads/site-a, gs://timelapse-public/site-a, GCS, GCS"
  })
  void testProvidesAsyncStorageClientPerUriScheme(
      String rootUri, String remoteBaseUri, String sourceClient, String artifactClient) {
    when(mockConfig.getSourceConfig()).thenReturn(SourceConfig.builder().rootUri(rootUri).build());
    when(mockConfig.getArtifactStoreConfig())
        .thenReturn(ArtifactStoreConfig.builder().remoteBaseUri(remoteBaseUri).build());

    AsyncStorageClient rawInputClient =
        RuntimeModule.providesAsyncStorageClientForRawInput(
            mockConfig,
            new StorageUtils(),
            mockS3AsyncClientProvider,
            mockGcsClientProvider,
            mockExecutorService);
    AsyncStorageClient artifactClientInstance =
        RuntimeModule.providesAsyncStorageClientForArtifacts(
            mockConfig,
            new StorageUtils(),
            mockS3AsyncClientProvider,
            mockGcsClientProvider,
            mockExecutorService);

    assertInstanceOf(expectedClass(sourceClient), rawInputClient);
    assertInstanceOf(expectedClass(artifactClient), artifactClientInstance);
  }

  @Test
  void testProvidesLocalArtifactStoreWithAbsoluteBaseDirectory() {
    when(mockConfig.getArtifactStoreConfig())
        .thenReturn(
            ArtifactStoreConfig.builder()
                .remoteBaseUri("s3://timelapse-public/site-a")
                .localBaseDir("build-cache")
                .build());

    LocalArtifactStore localArtifactStore = RuntimeModule.providesLocalArtifactStore(mockConfig);

    assertTrue(localArtifactStore.getBaseDirectory().isAbsolute());
    assertTrue(localArtifactStore.getBaseDirectory().endsWith("build-cache"));
  }

  private static Class<? extends AsyncStorageClient> expectedClass(String client) {
    return "GCS".equals(client) ? GCSAsyncStorageClient.class : S3AsyncStorageClient.class;
  }
}
