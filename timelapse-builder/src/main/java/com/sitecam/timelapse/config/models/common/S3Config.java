package com.sitecam.timelapse.config.models.common;

import java.util.Optional;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.jackson.Jacksonized;

@Builder
@Getter
@Jacksonized
@EqualsAndHashCode
public class S3Config {
  @NonNull private String region;

  // falls back to the default credential chain when absent
  @Builder.Default private Optional<String> accessKey = Optional.empty();
  @Builder.Default private Optional<String> accessSecret = Optional.empty();
  // S3 compatible stores (R2, MinIO) need an explicit endpoint
  @Builder.Default private Optional<String> endpoint = Optional.empty();
  @Builder.Default private Optional<Boolean> forcePathStyle = Optional.empty();
}
