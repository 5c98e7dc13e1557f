package com.sitecam.timelapse;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.sitecam.timelapse.artifact_builder.TimelapseBuildJob;
import com.sitecam.timelapse.cli_parser.CliParser;
import com.sitecam.timelapse.config.Config;
import com.sitecam.timelapse.config.ConfigLoader;
import com.sitecam.timelapse.config.models.configv1.BuildConfig;
import com.sitecam.timelapse.config.models.configv1.ConfigV1;
import com.sitecam.timelapse.metrics.MetricsModule;
import com.sitecam.timelapse.metrics.MetricsServer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.ParseException;

@Slf4j
public class Main {

  private TimelapseBuildJob job;
  private MetricsServer metricsServer;
  private final CliParser parser;
  private final ConfigLoader configLoader;

  public Main(CliParser parser, ConfigLoader configLoader) {
    this.parser = parser;
    this.configLoader = configLoader;
  }

  public static void main(String[] args) {
    CliParser parser = new CliParser();
    ConfigLoader configLoader = new ConfigLoader();

    Main main = new Main(parser, configLoader);
    main.start(args);
  }

  public void start(String[] args) {
    log.info("Starting timelapse builder");
    Config config = null;
    try {
      parser.parse(args);

      if (parser.isHelpRequested()) {
        return;
      }

      String configFilePath = parser.getConfigFilePath();
      String configYamlString = parser.getConfigYamlString();
      config = applyCliOverrides(loadConfig(configFilePath, configYamlString), parser);
    } catch (ParseException e) {
      log.error("Failed to parse command line arguments", e);
      System.exit(1);
    }

    Injector injector = Guice.createInjector(new RuntimeModule(config), new MetricsModule());
    job = injector.getInstance(TimelapseBuildJob.class);
    metricsServer = injector.getInstance(MetricsServer.class);

    runJob(config);
  }

  private Config loadConfig(String configFilePath, String configYamlString) {
    if (configFilePath != null) {
      return configLoader.loadConfigFromConfigFile(configFilePath);
    } else if (configYamlString != null) {
      return configLoader.loadConfigFromString(configYamlString);
    } else {
      log.error("No configuration provided. Please specify either a file path or a YAML string.");
      System.exit(1);
    }
    return null;
  }

  /** Command line run options take precedence over the build section of the config. */
  @VisibleForTesting
  static Config applyCliOverrides(Config config, CliParser parser) {
    BuildConfig.BuildConfigBuilder buildConfigBuilder = config.getBuildConfig().toBuilder();
    if (parser.getRecencyBoundDays().isPresent()) {
      buildConfigBuilder.recencyBoundDays(parser.getRecencyBoundDays());
    }
    if (parser.isUploadAllWeeks()) {
      buildConfigBuilder.forceFullWeekSet(true);
    }
    if (parser.isBuildFull()) {
      buildConfigBuilder.buildFull(true);
    }
    if (parser.isNoUpload()) {
      buildConfigBuilder.uploadEnabled(false);
    }
    if (!parser.getReprocessPartitionNames().isEmpty()) {
      buildConfigBuilder.reprocessPartitionNames(parser.getReprocessPartitionNames());
    }
    return ((ConfigV1) config).toBuilder().buildConfig(buildConfigBuilder.build()).build();
  }

  private void runJob(Config config) {
    try {
      BuildConfig.JobRunMode jobRunMode = config.getBuildConfig().getJobRunMode();
      if (BuildConfig.JobRunMode.CONTINUOUS.equals(jobRunMode)) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(config)));
        job.runInContinuousMode();
      } else {
        job.runOnce();
        shutdown(config);
      }
    } catch (Exception e) {
      log.error(e.getMessage(), e);
      shutdown(config);
    }
  }

  @VisibleForTesting
  void shutdown(Config config) {
    if (config.getBuildConfig().getJobRunMode().equals(BuildConfig.JobRunMode.ONCE)) {
      log.info(
          String.format(
              "Scheduling JVM shutdown after %d seconds",
              config.getBuildConfig().getWaitTimeBeforeShutdown()));
      try {
        Thread.sleep(config.getBuildConfig().getWaitTimeBeforeShutdown() * 1000L);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    job.shutdown();
    metricsServer.shutdown();
  }
}
