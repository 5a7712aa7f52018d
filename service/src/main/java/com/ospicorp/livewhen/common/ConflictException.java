package com.ospicorp.livewhen.common;

public class ConflictException extends RuntimeException {
  public ConflictException(String message, Throwable cause) {
    super(message, cause);
  }

  public static ConflictException customProgrammeExists(String userId, Throwable cause) {
    return new ConflictException("Custom programme already exists for user: " + userId, cause);
  }
}
