package com.sitecam.timelapse.config;

import java.util.concurrent.atomic.AtomicReference;

public class ConfigProvider {
  private final AtomicReference<Config> configRef;

  public ConfigProvider(Config config) {
    configRef = new AtomicReference<>();
    setConfig(config);
  }

  public Config getConfig() {
    return configRef.get();
  }

  public void setConfig(Config config) {
    configRef.set(config);
  }
}
