package com.ospicorp.livewhen.activity;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.time.Instant;

public record ActivityStats(
    @JsonProperty("streamer_id") String streamerId,
    @JsonProperty("total_sessions") int totalSessions,
    @JsonProperty("average_session_duration") Duration averageSessionDuration,
    @JsonProperty("last_active") Instant lastActive,
    @JsonProperty("most_active_hour") int mostActiveHour,
    @JsonProperty("most_active_day") int mostActiveDay
) {

  public static ActivityStats empty(String streamerId) {
    return new ActivityStats(streamerId, 0, Duration.ZERO, null, 0, 0);
  }
}
