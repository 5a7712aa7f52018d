package com.ospicorp.livewhen.streamer;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RankedStreamerDto(
    StreamerDto streamer,
    @JsonProperty("follower_count") int followerCount
) {
  public static RankedStreamerDto from(StreamerWithFollowers ranked) {
    return new RankedStreamerDto(StreamerDto.from(ranked.streamer()), ranked.followerCount());
  }
}
