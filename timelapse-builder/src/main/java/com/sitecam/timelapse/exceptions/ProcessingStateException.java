package com.sitecam.timelapse.exceptions;

public class ProcessingStateException extends RuntimeException {
  public ProcessingStateException(String message, Throwable cause) {
    super(message, cause);
  }
}
