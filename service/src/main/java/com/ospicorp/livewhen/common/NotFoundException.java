package com.ospicorp.livewhen.common;

public class NotFoundException extends RuntimeException {
  public NotFoundException(String message) {
    super(message);
  }

  public static NotFoundException user(String userId) {
    return new NotFoundException("User not found: " + userId);
  }

  public static NotFoundException streamer(String streamerId) {
    return new NotFoundException("Streamer not found: " + streamerId);
  }

  public static NotFoundException customProgramme(String userId) {
    return new NotFoundException("Custom programme not found for user: " + userId);
  }
}
