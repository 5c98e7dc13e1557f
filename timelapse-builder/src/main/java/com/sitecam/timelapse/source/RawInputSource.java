package com.sitecam.timelapse.source;

import com.sitecam.timelapse.artifact_builder.models.ItemRef;
import com.sitecam.timelapse.artifact_builder.models.SourcePartition;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Read-only access to the raw image tier, one partition per capture day. */
public interface RawInputSource {
  CompletableFuture<List<SourcePartition>> listPartitions(String rootId);

  /** Items of a partition in playback order. */
  CompletableFuture<List<ItemRef>> listItems(SourcePartition partition);

  CompletableFuture<byte[]> fetchItem(ItemRef itemRef);
}
