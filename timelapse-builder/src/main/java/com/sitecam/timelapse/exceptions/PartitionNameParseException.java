package com.sitecam.timelapse.exceptions;

public class PartitionNameParseException extends RuntimeException {
  public PartitionNameParseException(String message) {
    super(message);
  }

  public PartitionNameParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
