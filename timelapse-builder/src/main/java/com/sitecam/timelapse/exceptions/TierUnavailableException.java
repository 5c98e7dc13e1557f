package com.sitecam.timelapse.exceptions;

public class TierUnavailableException extends RuntimeException {
  public TierUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
