package com.sitecam.timelapse.config;

public enum ConfigVersion {
  V1
}
