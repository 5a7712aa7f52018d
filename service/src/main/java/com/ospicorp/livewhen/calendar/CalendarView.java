package com.ospicorp.livewhen.calendar;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.livewhen.programme.ProgrammeEntry;
import com.ospicorp.livewhen.streamer.StreamerDto;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

public record CalendarView(
    ZonedDateTime week,
    @JsonProperty("prev_week") ZonedDateTime prevWeek,
    @JsonProperty("next_week") ZonedDateTime nextWeek,
    List<ProgrammeEntry> entries,
    @JsonProperty("streamer_map") Map<String, StreamerDto> streamerMap,
    @JsonProperty("time_slots") List<List<List<CalendarEntry>>> timeSlots,
    @JsonProperty("is_custom") boolean custom,
    @JsonProperty("is_guest_session") boolean guestSession
) {}
