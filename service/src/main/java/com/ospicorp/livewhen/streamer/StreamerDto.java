package com.ospicorp.livewhen.streamer;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record StreamerDto(
    String id,
    String name,
    List<String> platforms,
    Map<String, String> handles,
    @JsonProperty("created_at") Instant createdAt
) {

  public static StreamerDto from(Streamer streamer) {
    Map<String, String> handles = new LinkedHashMap<>();
    streamer.getHandles().forEach((platform, handle) -> handles.put(platform.code(), handle));
    return new StreamerDto(
        streamer.getId(),
        streamer.getName(),
        List.copyOf(handles.keySet()),
        handles,
        streamer.getCreatedAt());
  }
}
