package com.ospicorp.livewhen.programme;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;

public record TvProgramme(
    @JsonProperty("user_id") String userId,
    ZonedDateTime week,
    List<ProgrammeEntry> entries,
    @JsonProperty("generated_at") Instant generatedAt
) {}
