package com.sitecam.timelapse.exceptions;

public class RateLimitException extends ObjectStorageClientException {
  public RateLimitException(String message) {
    super(message);
  }
}
