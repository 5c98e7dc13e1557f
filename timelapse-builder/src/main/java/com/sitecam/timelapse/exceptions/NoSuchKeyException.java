package com.sitecam.timelapse.exceptions;

public class NoSuchKeyException extends ObjectStorageClientException {
  public NoSuchKeyException(String message) {
    super(message);
  }
}
