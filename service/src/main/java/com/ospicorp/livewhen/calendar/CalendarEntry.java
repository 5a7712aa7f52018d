package com.ospicorp.livewhen.calendar;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CalendarEntry(
    @JsonProperty("streamer_id") String streamerId,
    @JsonProperty("streamer_name") String streamerName,
    double probability,
    int hour,
    @JsonProperty("day_of_week") int dayOfWeek
) {}
