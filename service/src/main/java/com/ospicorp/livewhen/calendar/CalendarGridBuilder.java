package com.ospicorp.livewhen.calendar;

import com.ospicorp.livewhen.heatmap.Heatmap;
import com.ospicorp.livewhen.programme.ProgrammeEntry;
import com.ospicorp.livewhen.streamer.Streamer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public final class CalendarGridBuilder {
  private CalendarGridBuilder() {
  }

  /**
   * Lays entries out as {@code grid[hour][dayOfWeek]}, 24 rows of 7 cells. Entries of streamers
   * missing from {@code streamerMap} and entries outside the week are dropped.
   */
  public static List<List<List<CalendarEntry>>> buildTimeSlotGrid(
      Collection<ProgrammeEntry> entries, Map<String, Streamer> streamerMap) {
    List<List<List<CalendarEntry>>> grid = new ArrayList<>(Heatmap.HOURS);
    for (int hour = 0; hour < Heatmap.HOURS; hour++) {
      List<List<CalendarEntry>> row = new ArrayList<>(Heatmap.DAYS);
      for (int day = 0; day < Heatmap.DAYS; day++) {
        row.add(new ArrayList<>());
      }
      grid.add(row);
    }
    if (entries == null || streamerMap == null) {
      return grid;
    }

    for (ProgrammeEntry entry : entries) {
      int hour = entry.hour();
      int day = entry.dayOfWeek();
      if (hour < 0 || hour >= Heatmap.HOURS || day < 0 || day >= Heatmap.DAYS) continue;
      Streamer streamer = streamerMap.get(entry.streamerId());
      if (streamer == null) continue;
      grid.get(hour).get(day).add(new CalendarEntry(entry.streamerId(), streamer.getName(),
          entry.probability(), hour, day));
    }
    return grid;
  }
}
