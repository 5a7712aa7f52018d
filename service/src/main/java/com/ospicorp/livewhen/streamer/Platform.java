package com.ospicorp.livewhen.streamer;

import java.util.Locale;

public enum Platform {
  YOUTUBE,
  TWITCH,
  KICK;

  public static Platform fromCode(String code) {
    if (code == null || code.isBlank()) {
      return null;
    }
    return Platform.valueOf(code.trim().toUpperCase(Locale.ROOT));
  }

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
