package com.ospicorp.livewhen.programme;

import com.ospicorp.livewhen.heatmap.Heatmap;
import java.util.ArrayList;
import java.util.List;

/** Turns a heatmap into predicted weekly slots. Both thresholds are exclusive. */
public final class ProgrammeSlots {
  public static final double DAY_THRESHOLD = 0.10;
  public static final double SLOT_THRESHOLD = 0.05;

  private ProgrammeSlots() {
  }

  public static List<ProgrammeEntry> slots(Heatmap heatmap) {
    List<ProgrammeEntry> out = new ArrayList<>();
    for (int day = 0; day < Heatmap.DAYS; day++) {
      double dayProbability = heatmap.day(day);
      if (dayProbability <= DAY_THRESHOLD) continue;
      for (int hour = 0; hour < Heatmap.HOURS; hour++) {
        double combined = dayProbability * heatmap.hour(hour);
        if (combined > SLOT_THRESHOLD) {
          out.add(new ProgrammeEntry(heatmap.streamerId(), day, hour, combined));
        }
      }
    }
    return out;
  }

  /** Most probable hour of one day; the lowest hour wins ties and an empty day yields hour 0. */
  public static PredictedTime mostLikelyHour(Heatmap heatmap, int dayOfWeek) {
    double dayProbability = heatmap.day(dayOfWeek);
    double max = 0d;
    int best = 0;
    for (int hour = 0; hour < Heatmap.HOURS; hour++) {
      double combined = dayProbability * heatmap.hour(hour);
      if (combined > max) {
        max = combined;
        best = hour;
      }
    }
    return new PredictedTime(dayOfWeek, best, max);
  }
}
