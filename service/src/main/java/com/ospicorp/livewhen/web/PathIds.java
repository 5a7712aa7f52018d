package com.ospicorp.livewhen.web;

/** Shape of streamer and user identifiers accepted in request paths. */
public final class PathIds {
  public static final String ID_REGEX = "^[A-Za-z0-9_.-]{1,64}$";

  private PathIds() {
  }
}
