package com.sitecam.timelapse.config;

import static com.sitecam.timelapse.constants.BuildConstants.OBJECT_STORAGE_URI_PATTERN;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.google.common.annotations.VisibleForTesting;
import com.sitecam.timelapse.config.models.configv1.BuildConfig;
import com.sitecam.timelapse.config.models.configv1.ConfigV1;
import com.sitecam.timelapse.env.EnvironmentLookupProvider;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

public class ConfigLoader {
  private static final Pattern ENV_PLACEHOLDER_PATTERN =
      Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");
  private final ObjectMapper MAPPER;
  private final EnvironmentLookupProvider environmentLookupProvider;

  public ConfigLoader() {
    this(new EnvironmentLookupProvider.System());
  }

  @VisibleForTesting
  public ConfigLoader(EnvironmentLookupProvider environmentLookupProvider) {
    this.MAPPER = new ObjectMapper(new YAMLFactory());
    MAPPER.registerModule(new Jdk8Module());
    this.environmentLookupProvider = environmentLookupProvider;
  }

  public Config loadConfigFromConfigFile(String configFilePath) {
    try {
      String configYaml =
          new String(Files.readAllBytes(Paths.get(configFilePath)), StandardCharsets.UTF_8);
      return loadConfigFromJsonNode(MAPPER.readTree(expandEnvironmentPlaceholders(configYaml)));
    } catch (Exception e) {
      throw new RuntimeException("Failed to load config", e);
    }
  }

  public Config loadConfigFromString(String configYaml) {
    try {
      return loadConfigFromJsonNode(MAPPER.readTree(expandEnvironmentPlaceholders(configYaml)));
    } catch (Exception e) {
      throw new RuntimeException("Failed to load config", e);
    }
  }

  private Config loadConfigFromJsonNode(JsonNode jsonNode) throws IOException {
    JsonNode versionNode = jsonNode.get("version");
    if (versionNode == null) {
      throw new IllegalArgumentException("Missing config param: version");
    }
    ConfigVersion version = ConfigVersion.valueOf(versionNode.asText());
    switch (version) {
      case V1:
        ConfigV1 configV1 = MAPPER.treeToValue(jsonNode, ConfigV1.class);
        validateConfigV1(configV1);
        return configV1;
      default:
        throw new UnsupportedOperationException("Unsupported config version: " + version);
    }
  }

  @VisibleForTesting
  String expandEnvironmentPlaceholders(String configYaml) {
    Matcher matcher = ENV_PLACEHOLDER_PATTERN.matcher(configYaml);
    StringBuilder expanded = new StringBuilder();
    while (matcher.find()) {
      String variableName = matcher.group(1);
      String value = environmentLookupProvider.getValue(variableName);
      if (value == null) {
        throw new IllegalArgumentException(
            String.format("Environment variable %s referenced in config is not set", variableName));
      }
      matcher.appendReplacement(expanded, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(expanded);
    return expanded.toString();
  }

  private void validateConfigV1(ConfigV1 configV1) {
    List<String> invalidFields = new ArrayList<>();
    if (!isObjectStorageUri(configV1.getSourceConfig().getRootUri())) {
      invalidFields.add("sourceConfig.rootUri");
    }
    if (!isObjectStorageUri(configV1.getArtifactStoreConfig().getRemoteBaseUri())) {
      invalidFields.add("artifactStoreConfig.remoteBaseUri");
    }
    if (StringUtils.isBlank(configV1.getArtifactStoreConfig().getLocalBaseDir())) {
      invalidFields.add("artifactStoreConfig.localBaseDir");
    }
    BuildConfig buildConfig = configV1.getBuildConfig();
    if (buildConfig.getFetchParallelism() <= 0) {
      invalidFields.add("buildConfig.fetchParallelism");
    }
    if (buildConfig.getMaxConcurrentBuilds() <= 0) {
      invalidFields.add("buildConfig.maxConcurrentBuilds");
    }
    if (buildConfig.getRecencyBoundDays().isPresent()
        && buildConfig.getRecencyBoundDays().get() <= 0) {
      invalidFields.add("buildConfig.recencyBoundDays");
    }
    if (buildConfig.getRetentionDays().isPresent() && buildConfig.getRetentionDays().get() < 0) {
      invalidFields.add("buildConfig.retentionDays");
    }
    if (configV1.getVideoConfig().getFps() <= 0) {
      invalidFields.add("videoConfig.fps");
    }
    if (!invalidFields.isEmpty()) {
      throw new IllegalArgumentException(
          String.format("Invalid config params: %s", String.join(", ", invalidFields)));
    }
  }

  private static boolean isObjectStorageUri(String uri) {
    return StringUtils.isNotBlank(uri) && OBJECT_STORAGE_URI_PATTERN.matcher(uri).matches();
  }
}
