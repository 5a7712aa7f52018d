package com.ospicorp.livewhen.common;

public class InsufficientDataException extends RuntimeException {
  private final String streamerId;

  public InsufficientDataException(String streamerId) {
    super("Insufficient historical data for streamer: " + streamerId);
    this.streamerId = streamerId;
  }

  public String streamerId() {
    return streamerId;
  }
}
