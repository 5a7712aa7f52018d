package com.ospicorp.livewhen.activity;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.livewhen.streamer.Platform;
import java.time.Duration;
import java.time.Instant;

// One live sample or session; platform is null when the caller did not know it
public record ActivityRecord(
    String id,
    @JsonProperty("streamer_id") String streamerId,
    @JsonProperty("start_time") Instant startTime,
    @JsonProperty("end_time") Instant endTime,
    Platform platform,
    @JsonProperty("created_at") Instant createdAt
) {

  public Duration duration() {
    return Duration.between(startTime, endTime);
  }
}
