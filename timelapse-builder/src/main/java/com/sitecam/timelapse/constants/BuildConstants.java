package com.sitecam.timelapse.constants;

import java.util.regex.Pattern;

public class BuildConstants {

  private BuildConstants() {}

  public static final String PARTITION_NAME_SEPARATOR = "_";
  public static final int DATE_TOKEN_LENGTH = 6;
  public static final int CENTURY_BASE_YEAR = 2000;

  public static final String DAILY_KEY_PREFIX = "daily";
  public static final String WEEKLY_KEY_PREFIX = "weekly";

  // layout of artifacts below the local base dir and the remote base uri
  public static final String DAILY_ARTIFACT_DIR = "daily";
  public static final String WEEKLY_ARTIFACT_DIR = "weeks";
  public static final String WEEKLY_ARTIFACT_FILE_PREFIX = "timelapse_week_";
  public static final String VIDEO_FILE_EXTENSION = ".mp4";

  public static final String FULL_ARTIFACT_FILE = "timelapse_full.mp4";
  public static final String FULL_ARTIFACT_REMOTE_NAME = "full.mp4";
  public static final String CURRENT_WEEK_ALIAS = "week.mp4";
  public static final String LATEST_DAY_ALIAS = "day.mp4";
  public static final String LATEST_IMAGE_ALIAS = "latest.jpg";
  public static final String METADATA_FILE = "metadata.json";
  public static final String FULL_ARTIFACT_REPORT_KEY = "full";

  public static final String DEFAULT_STATE_OBJECT_PATH = "state/state.json";
  public static final String DEFAULT_LOCAL_BASE_DIR = "./videos";
  public static final String DEFAULT_PARTITION_NAME_PREFIX = "TLST04A00879_";
  public static final String DEFAULT_ITEM_NAME_PREFIX = "TLS_";
  public static final String DEFAULT_ITEM_NAME_SUFFIX = ".jpg";

  public static final int DEFAULT_FETCH_PARALLELISM = 10;
  public static final int DEFAULT_MAX_CONCURRENT_BUILDS = 2;
  public static final int DEFAULT_RUN_INTERVAL_MINUTES = 60;
  public static final int WAIT_TIME_BEFORE_SHUTDOWN = 0;

  public static final int DEFAULT_VIDEO_FPS = 30;
  public static final String DEFAULT_VIDEO_CODEC = "libx264";
  public static final String DEFAULT_VIDEO_PRESET = "slow";
  public static final int DEFAULT_VIDEO_CRF = 28;
  public static final int DEFAULT_VIDEO_MAX_WIDTH = 1920;
  public static final int DEFAULT_FULL_VIDEO_CRF = 32;
  public static final int DEFAULT_FULL_VIDEO_MAX_WIDTH = 1280;
  public static final int DEFAULT_FULL_VIDEO_FPS = 20;
  public static final long DEFAULT_ENCODE_TIMEOUT_SECONDS = 3600L;

  // typical s3 path: "s3://bucket-name/path/to/object"
  // gcs path format "gs:// [bucket] /path/to/file"
  public static final Pattern OBJECT_STORAGE_URI_PATTERN =
      Pattern.compile("^(s3://|gs://)([^/]+)(/.*)?");

  // https://cloud.google.com/compute/docs/naming-resources#resource-name-format
  public static final String GCP_RESOURCE_NAME_FORMAT = "^[a-z]([-a-z0-9]*[a-z0-9])$";
}
