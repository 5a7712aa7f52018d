package com.ospicorp.livewhen.calendar;

import com.ospicorp.livewhen.common.Stores;
import com.ospicorp.livewhen.programme.ProgrammeCalendarView;
import com.ospicorp.livewhen.programme.ProgrammeEntry;
import com.ospicorp.livewhen.programme.ProgrammeService;
import com.ospicorp.livewhen.programme.TvProgramme;
import com.ospicorp.livewhen.programme.TvProgrammeService;
import com.ospicorp.livewhen.streamer.FollowStore;
import com.ospicorp.livewhen.streamer.Streamer;
import com.ospicorp.livewhen.streamer.StreamerDto;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class CalendarService {
  private final TvProgrammeService tvProgrammeService;
  private final ProgrammeService programmeService;
  private final FollowStore followStore;

  public CalendarService(TvProgrammeService tvProgrammeService,
      ProgrammeService programmeService, FollowStore followStore) {
    this.tvProgrammeService = tvProgrammeService;
    this.programmeService = programmeService;
    this.followStore = followStore;
  }

  /** The user's followed-streamer programme laid out as a 24x7 grid. */
  public CalendarView getCalendarView(String userId, ZonedDateTime week) {
    TvProgramme programme = tvProgrammeService.generateProgramme(userId, week);
    List<Streamer> followed = Stores.call("read followed streamers",
        () -> followStore.findFollowedStreamers(userId));
    return render(programme.week(), programme.entries(), followed, false, false);
  }

  /** The custom-or-global programme view of a user laid out as a 24x7 grid. */
  public CalendarView getProgrammeCalendar(String userId, ZonedDateTime week) {
    return fromProgrammeView(programmeService.getProgrammeView(userId, week));
  }

  public CalendarView fromProgrammeView(ProgrammeCalendarView view) {
    return render(view.week(), view.entries(), view.streamers(), view.custom(),
        view.guestSession());
  }

  private static CalendarView render(ZonedDateTime week, List<ProgrammeEntry> entries,
      List<Streamer> streamers, boolean custom, boolean guestSession) {
    Map<String, Streamer> streamerMap = new LinkedHashMap<>();
    for (Streamer streamer : streamers) {
      streamerMap.put(streamer.getId(), streamer);
    }
    Map<String, StreamerDto> streamerDtos = new LinkedHashMap<>();
    streamerMap.forEach((id, streamer) -> streamerDtos.put(id, StreamerDto.from(streamer)));

    ZonedDateTime weekStart = WeekNavigator.normalizeWeekStart(week);
    return new CalendarView(
        weekStart,
        WeekNavigator.previousWeek(weekStart),
        WeekNavigator.nextWeek(weekStart),
        entries,
        streamerDtos,
        CalendarGridBuilder.buildTimeSlotGrid(entries, streamerMap),
        custom,
        guestSession);
  }
}
