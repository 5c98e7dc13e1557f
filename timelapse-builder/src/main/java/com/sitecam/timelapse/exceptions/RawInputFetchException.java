package com.sitecam.timelapse.exceptions;

public class RawInputFetchException extends RuntimeException {
  public RawInputFetchException(String message, Throwable cause) {
    super(message, cause);
  }

  public RawInputFetchException(String message) {
    super(message);
  }
}
