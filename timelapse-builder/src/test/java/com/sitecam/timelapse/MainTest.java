package com.sitecam.timelapse;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.sitecam.timelapse.artifact_builder.TimelapseBuildJob;
import com.sitecam.timelapse.cli_parser.CliParser;
import com.sitecam.timelapse.config.Config;
import com.sitecam.timelapse.config.ConfigLoader;
import com.sitecam.timelapse.config.models.common.FileSystemConfiguration;
import com.sitecam.timelapse.config.models.common.S3Config;
import com.sitecam.timelapse.config.models.configv1.ArtifactStoreConfig;
import com.sitecam.timelapse.config.models.configv1.BuildConfig;
import com.sitecam.timelapse.config.models.configv1.ConfigV1;
import com.sitecam.timelapse.config.models.configv1.SourceConfig;
import com.sitecam.timelapse.metrics.MetricsModule;
import com.sitecam.timelapse.metrics.MetricsServer;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.MockedStatic;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MainTest {

  @Mock private CliParser mockParser;
  @Mock private ConfigLoader mockConfigLoader;
  @Mock private Injector mockInjector;
  @Mock private TimelapseBuildJob mockJob;
  @Mock private MetricsServer mockMetricsServer;
  MockedStatic<Guice> guiceMockedStatic;

  private Main main;

  @BeforeEach
  void setUp() {
    guiceMockedStatic = mockStatic(Guice.class);
    main = new Main(mockParser, mockConfigLoader);
  }

  @AfterEach
  void shutdown() {
    guiceMockedStatic.close();
  }

  private static ConfigV1 config(BuildConfig buildConfig) {
    return ConfigV1.builder()
        .version("V1")
        .fileSystemConfiguration(
            FileSystemConfiguration.builder()
                .s3Config(S3Config.builder().region("auto").build())
                .build())
        .sourceConfig(SourceConfig.builder().rootUri("s3://camera-uploads/site-a/").build())
        .artifactStoreConfig(
            ArtifactStoreConfig.builder().remoteBaseUri("s3://timelapse-public/site-a").build())
        .buildConfig(buildConfig)
        .build();
  }

  private void stubInjector() {
    when(mockInjector.getInstance(TimelapseBuildJob.class)).thenReturn(mockJob);
    when(mockInjector.getInstance(MetricsServer.class)).thenReturn(mockMetricsServer);
    guiceMockedStatic
        .when(() -> Guice.createInjector(any(RuntimeModule.class), any(MetricsModule.class)))
        .thenReturn(mockInjector);
  }

  @Test
  void testLoadConfigFromFileAndRunOnce() {
    String[] args = {"-p", "configFilePath"};
    when(mockParser.getConfigFilePath()).thenReturn("configFilePath");
    when(mockConfigLoader.loadConfigFromConfigFile(anyString()))
        .thenReturn(config(BuildConfig.builder().build()));
    stubInjector();

    main.start(args);

    verify(mockConfigLoader).loadConfigFromConfigFile("configFilePath");
    verify(mockJob).runOnce();
    verify(mockJob, never()).runInContinuousMode();
    verifyShutdown();
  }

  @Test
  void testRunOnceFailureStillShutsDown() {
    String[] args = {"-p", "configFilePath"};
    when(mockParser.getConfigFilePath()).thenReturn("configFilePath");
    when(mockConfigLoader.loadConfigFromConfigFile(anyString()))
        .thenReturn(config(BuildConfig.builder().build()));
    stubInjector();
    doThrow(new RuntimeException()).when(mockJob).runOnce();

    main.start(args);

    verify(mockJob).runOnce();
    verifyShutdown();
  }

  @Test
  void testLoadConfigFromStringAndRunContinuous() {
    String[] args = {"-c", "configYamlString"};
    Config config =
        config(BuildConfig.builder().jobRunMode(BuildConfig.JobRunMode.CONTINUOUS).build());
    when(mockParser.getConfigYamlString()).thenReturn("configYamlString");
    when(mockConfigLoader.loadConfigFromString(anyString())).thenReturn(config);
    stubInjector();

    main.start(args);

    verify(mockConfigLoader).loadConfigFromString("configYamlString");
    verify(mockJob).runInContinuousMode();
    verify(mockJob, never()).shutdown();

    main.shutdown(config);
    verifyShutdown();
  }

  @Test
  void testHelpOption() {
    String[] args = {"-h"};
    when(mockParser.isHelpRequested()).thenReturn(true);

    main.start(args);

    verifyNoInteractions(mockConfigLoader);
    guiceMockedStatic.verifyNoInteractions();
  }

  @Test
  void testCliOverridesTakePrecedence() {
    BuildConfig buildConfig =
        BuildConfig.builder()
            .recencyBoundDays(Optional.of(7))
            .retentionDays(Optional.of(14))
            .build();
    when(mockParser.getRecencyBoundDays()).thenReturn(Optional.of(2));
    when(mockParser.isUploadAllWeeks()).thenReturn(true);
    when(mockParser.isBuildFull()).thenReturn(true);
    when(mockParser.isNoUpload()).thenReturn(true);
    when(mockParser.getReprocessPartitionNames())
        .thenReturn(Arrays.asList("TLST04A00879_250702_0600", "TLST04A00879_250703_0600"));

    Config overridden = Main.applyCliOverrides(config(buildConfig), mockParser);

    BuildConfig result = overridden.getBuildConfig();
    assertEquals(Optional.of(2), result.getRecencyBoundDays());
    assertTrue(result.isForceFullWeekSet());
    assertTrue(result.isBuildFull());
    assertFalse(result.isUploadEnabled());
    assertEquals(
        Arrays.asList("TLST04A00879_250702_0600", "TLST04A00879_250703_0600"),
        result.getReprocessPartitionNames());
    assertEquals(Optional.of(14), result.getRetentionDays());
    assertEquals("s3://camera-uploads/site-a/", overridden.getSourceConfig().getRootUri());
  }

  @Test
  void testConfigIsKeptWithoutCliOverrides() {
    ConfigV1 config =
        config(
            BuildConfig.builder()
                .recencyBoundDays(Optional.of(7))
                .reprocessPartitionNames(
                    Collections.singletonList("TLST04A00879_250702_0600"))
                .build());
    when(mockParser.getRecencyBoundDays()).thenReturn(Optional.empty());
    when(mockParser.getReprocessPartitionNames()).thenReturn(Collections.emptyList());

    assertEquals(config, Main.applyCliOverrides(config, mockParser));
  }

  private void verifyShutdown() {
    verify(mockJob).shutdown();
    verify(mockMetricsServer).shutdown();
  }
}
