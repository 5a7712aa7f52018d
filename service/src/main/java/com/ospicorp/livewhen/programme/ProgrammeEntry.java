package com.ospicorp.livewhen.programme;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProgrammeEntry(
    @JsonProperty("streamer_id") String streamerId,
    @JsonProperty("day_of_week") int dayOfWeek,
    int hour,
    double probability
) {}
