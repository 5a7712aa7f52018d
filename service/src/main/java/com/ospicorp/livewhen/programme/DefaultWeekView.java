package com.ospicorp.livewhen.programme;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.livewhen.streamer.StreamerDto;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

public record DefaultWeekView(
    ZonedDateTime week,
    List<StreamerDto> streamers,
    List<ProgrammeEntry> entries,
    @JsonProperty("follower_counts") Map<String, Integer> followerCounts
) {}
