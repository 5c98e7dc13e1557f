package com.sitecam.timelapse.artifact_builder;

import com.sitecam.timelapse.constants.MetricsConstants.BuildFailureReasons;
import com.sitecam.timelapse.exceptions.EncodeException;
import com.sitecam.timelapse.exceptions.NoSuchKeyException;
import com.sitecam.timelapse.exceptions.ObjectStorageClientException;
import com.sitecam.timelapse.exceptions.PartitionNameParseException;
import com.sitecam.timelapse.exceptions.ProcessingStateException;
import com.sitecam.timelapse.exceptions.RateLimitException;
import com.sitecam.timelapse.exceptions.RawInputFetchException;
import com.sitecam.timelapse.exceptions.TierUnavailableException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class ArtifactBuilderUtils {

  private ArtifactBuilderUtils() {}

  public static BuildFailureReasons getBuildFailureReason(
      Throwable ex, BuildFailureReasons defaultReason) {
    Throwable cause = unwrap(ex);

    if (cause instanceof ProcessingStateException) {
      return BuildFailureReasons.PROCESSING_STATE_ERROR;
    }

    if (cause instanceof PartitionNameParseException) {
      return BuildFailureReasons.PARSE_ERROR;
    }

    if (cause instanceof RawInputFetchException) {
      return BuildFailureReasons.FETCH_ERROR;
    }

    if (cause instanceof EncodeException) {
      return BuildFailureReasons.ENCODE_ERROR;
    }

    if (cause instanceof RateLimitException) {
      return BuildFailureReasons.RATE_LIMITING;
    }

    if (cause instanceof NoSuchKeyException) {
      return BuildFailureReasons.NO_SUCH_KEY;
    }

    if (cause instanceof TierUnavailableException
        || cause instanceof ObjectStorageClientException
        || cause instanceof UncheckedIOException) {
      return BuildFailureReasons.TIER_UNAVAILABLE;
    }

    return defaultReason;
  }

  public static Throwable unwrap(Throwable ex) {
    Throwable current = ex;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  public static String describe(Throwable ex) {
    Throwable cause = unwrap(ex);
    return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
  }
}
