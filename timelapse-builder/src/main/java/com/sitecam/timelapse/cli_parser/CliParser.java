package com.sitecam.timelapse.cli_parser;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

public class CliParser {
  private String configFilePath;
  private String configYamlString;
  private static final String PATH_OPTION = "p";
  private static final String CONFIG_OPTION = "c";
  private static final String HELP_OPTION = "h";
  private static final String DAYS_OPTION = "days";
  private static final String UPLOAD_ALL_WEEKS_OPTION = "upload-all-weeks";
  private static final String BUILD_FULL_OPTION = "build-full";
  private static final String NO_UPLOAD_OPTION = "no-upload";
  private static final String REPROCESS_OPTION = "reprocess";
  private boolean helpRequested = false;
  private Integer recencyBoundDays;
  private boolean uploadAllWeeks = false;
  private boolean buildFull = false;
  private boolean noUpload = false;
  private List<String> reprocessPartitionNames = Collections.emptyList();

  public void parse(String[] args) throws ParseException {
    Options options = new Options();

    Option pathOption =
        Option.builder(PATH_OPTION)
            .longOpt("path")
            .hasArg()
            .desc("The file path to the configuration file")
            .build();
    options.addOption(pathOption);

    Option configOption =
        Option.builder(CONFIG_OPTION)
            .longOpt("config")
            .hasArg()
            .desc("The YAML configuration string")
            .build();
    options.addOption(configOption);

    Option helpOption =
        Option.builder(HELP_OPTION).longOpt("help").desc("Display help information").build();
    options.addOption(helpOption);

    options.addOption(
        Option.builder()
            .longOpt(DAYS_OPTION)
            .hasArg()
            .argName("N")
            .desc("Only schedule the N most recent partitions, plus the whole current week")
            .build());
    options.addOption(
        Option.builder()
            .longOpt(UPLOAD_ALL_WEEKS_OPTION)
            .desc("Materialize and publish every weekly timelapse, not only rebuilt ones")
            .build());
    options.addOption(
        Option.builder()
            .longOpt(BUILD_FULL_OPTION)
            .desc("Also build the full timelapse from all daily timelapses")
            .build());
    options.addOption(
        Option.builder()
            .longOpt(NO_UPLOAD_OPTION)
            .desc("Build locally without writing to the remote store")
            .build());
    options.addOption(
        Option.builder()
            .longOpt(REPROCESS_OPTION)
            .hasArg()
            .argName("NAME")
            .desc("Rebuild the named partition and its week, may be repeated")
            .build());

    CommandLineParser parser = new DefaultParser();
    CommandLine cmd = parser.parse(options, args);

    if (cmd.hasOption(HELP_OPTION)) {
      HelpFormatter formatter = new HelpFormatter();
      helpRequested = true;
      formatter.printHelp("Timelapse Builder", options);
      return;
    }

    if (cmd.hasOption(PATH_OPTION) && cmd.hasOption(CONFIG_OPTION)) {
      throw new ParseException("Cannot specify both a file path and a config string.");
    }

    if (cmd.hasOption(PATH_OPTION)) {
      configFilePath = cmd.getOptionValue(PATH_OPTION);
    }

    if (cmd.hasOption(CONFIG_OPTION)) {
      configYamlString = cmd.getOptionValue(CONFIG_OPTION);
    }

    if (cmd.hasOption(DAYS_OPTION)) {
      recencyBoundDays = parsePositiveInt(DAYS_OPTION, cmd.getOptionValue(DAYS_OPTION));
    }

    uploadAllWeeks = cmd.hasOption(UPLOAD_ALL_WEEKS_OPTION);
    buildFull = cmd.hasOption(BUILD_FULL_OPTION);
    noUpload = cmd.hasOption(NO_UPLOAD_OPTION);

    if (cmd.hasOption(REPROCESS_OPTION)) {
      reprocessPartitionNames = Arrays.asList(cmd.getOptionValues(REPROCESS_OPTION));
    }
  }

  private static int parsePositiveInt(String optionName, String value) throws ParseException {
    int parsed;
    try {
      parsed = Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new ParseException(
          String.format("--%s expects a number but got: %s", optionName, value));
    }
    if (parsed <= 0) {
      throw new ParseException(
          String.format("--%s expects a positive number but got: %s", optionName, value));
    }
    return parsed;
  }

  public boolean isHelpRequested() {
    return helpRequested;
  }

  public String getConfigFilePath() {
    return configFilePath;
  }

  public String getConfigYamlString() {
    return configYamlString;
  }

  public Optional<Integer> getRecencyBoundDays() {
    return Optional.ofNullable(recencyBoundDays);
  }

  public boolean isUploadAllWeeks() {
    return uploadAllWeeks;
  }

  public boolean isBuildFull() {
    return buildFull;
  }

  public boolean isNoUpload() {
    return noUpload;
  }

  public List<String> getReprocessPartitionNames() {
    return reprocessPartitionNames;
  }
}
