package com.sitecam.timelapse.constants;

public class MetricsConstants {
  public static final int PROMETHEUS_METRICS_SCRAPING_DISABLED = 0;
  public static final int PROMETHEUS_METRICS_SCRAPE_PORT =
      Integer.parseInt(
          System.getenv()
              .getOrDefault(
                  "PROMETHEUS_METRICS_SCRAPE_PORT",
                  String.valueOf(PROMETHEUS_METRICS_SCRAPING_DISABLED)));

  public enum BuildFailureReasons {
    PARSE_ERROR,
    FETCH_ERROR,
    ENCODE_ERROR,
    TIER_UNAVAILABLE,
    RATE_LIMITING,
    NO_SUCH_KEY,
    PROCESSING_STATE_ERROR,
    UNKNOWN,
  }
}
