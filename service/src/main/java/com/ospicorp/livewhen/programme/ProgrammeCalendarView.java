package com.ospicorp.livewhen.programme;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.livewhen.streamer.Streamer;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Predicted week for a custom streamer set or the global ranking.
 *
 * <p>{@code guestSession} is only ever true for custom programmes without an owning user.
 */
public record ProgrammeCalendarView(
    ZonedDateTime week,
    List<Streamer> streamers,
    List<ProgrammeEntry> entries,
    @JsonProperty("is_custom") boolean custom,
    @JsonProperty("is_guest_session") boolean guestSession
) {}
