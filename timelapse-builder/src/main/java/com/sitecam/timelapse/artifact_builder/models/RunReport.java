package com.sitecam.timelapse.artifact_builder.models;

import com.sitecam.timelapse.constants.MetricsConstants.BuildFailureReasons;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder
@Value
public class RunReport {
  @NonNull List<String> builtKeys;
  @NonNull List<String> skippedKeys;
  @NonNull List<String> evictedKeys;
  @NonNull List<String> outOfBoundKeys;
  @NonNull Map<String, BuildFailure> failures;
  boolean cancelled;

  public boolean isSuccessful() {
    return failures.isEmpty() && !cancelled;
  }

  /** Thread safe accumulator used while builds complete concurrently. */
  public static class Collector {
    private final Queue<String> builtKeys = new ConcurrentLinkedQueue<>();
    private final Queue<String> skippedKeys = new ConcurrentLinkedQueue<>();
    private final Queue<String> evictedKeys = new ConcurrentLinkedQueue<>();
    private final Queue<String> outOfBoundKeys = new ConcurrentLinkedQueue<>();
    private final Map<String, BuildFailure> failures = new ConcurrentHashMap<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void recordBuilt(ArtifactKey key) {
      builtKeys.add(key.toString());
    }

    public void recordBuilt(String key) {
      builtKeys.add(key);
    }

    public void recordSkipped(ArtifactKey key) {
      skippedKeys.add(key.toString());
    }

    public void recordEvicted(ArtifactKey key) {
      evictedKeys.add(key.toString());
    }

    public void recordOutOfBound(ArtifactKey key) {
      outOfBoundKeys.add(key.toString());
    }

    public void recordFailure(String key, BuildFailureReasons reason, String message) {
      failures.put(key, BuildFailure.builder().reason(reason).message(message).build());
    }

    public void recordFailure(ArtifactKey key, BuildFailureReasons reason, String message) {
      recordFailure(key.toString(), reason, message);
    }

    public void markCancelled() {
      cancelled.set(true);
    }

    public RunReport build() {
      return RunReport.builder()
          .builtKeys(sorted(builtKeys))
          .skippedKeys(sorted(skippedKeys))
          .evictedKeys(sorted(evictedKeys))
          .outOfBoundKeys(sorted(outOfBoundKeys))
          .failures(Collections.unmodifiableMap(new TreeMap<>(failures)))
          .cancelled(cancelled.get())
          .build();
    }

    private static List<String> sorted(Queue<String> keys) {
      List<String> result = new ArrayList<>(keys);
      Collections.sort(result);
      return Collections.unmodifiableList(result);
    }
  }
}
