package com.ospicorp.livewhen.calendar;

import java.time.ZonedDateTime;

public final class WeekNavigator {
  private WeekNavigator() {
  }

  /** The Sunday 00:00:00 starting the week of {@code time}, in the same zone. */
  public static ZonedDateTime normalizeWeekStart(ZonedDateTime time) {
    int daysSinceSunday = time.getDayOfWeek().getValue() % 7;
    return time.toLocalDate()
        .minusDays(daysSinceSunday)
        .atStartOfDay(time.getZone());
  }

  /**
   * Moves one week back for {@code prev}/{@code previous} and one week forward for
   * {@code next}. Any other direction returns the normalized week unchanged.
   */
  public static ZonedDateTime navigateWeek(ZonedDateTime week, String direction) {
    ZonedDateTime weekStart = normalizeWeekStart(week);
    if (direction == null) {
      return weekStart;
    }
    return switch (direction) {
      case "prev", "previous" -> shift(weekStart, -1);
      case "next" -> shift(weekStart, 1);
      default -> weekStart;
    };
  }

  public static ZonedDateTime previousWeek(ZonedDateTime week) {
    return navigateWeek(week, "prev");
  }

  public static ZonedDateTime nextWeek(ZonedDateTime week) {
    return navigateWeek(week, "next");
  }

  // through LocalDate so a DST change never moves the result off midnight
  private static ZonedDateTime shift(ZonedDateTime weekStart, int weeks) {
    return weekStart.toLocalDate().plusWeeks(weeks).atStartOfDay(weekStart.getZone());
  }
}
