package com.ospicorp.livewhen.calendar;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

class WeekNavigatorTest {

  private static final ZonedDateTime MONDAY_AFTERNOON =
      ZonedDateTime.of(2024, 1, 15, 15, 42, 7, 0, ZoneOffset.UTC);

  @Test
  void normalizesToSundayMidnight() {
    ZonedDateTime start = WeekNavigator.normalizeWeekStart(MONDAY_AFTERNOON);

    assertThat(start).isEqualTo(ZonedDateTime.of(2024, 1, 14, 0, 0, 0, 0, ZoneOffset.UTC));
    assertThat(start.getDayOfWeek()).isEqualTo(DayOfWeek.SUNDAY);
  }

  @Test
  void normalizationIsIdempotent() {
    ZonedDateTime once = WeekNavigator.normalizeWeekStart(MONDAY_AFTERNOON);

    assertThat(WeekNavigator.normalizeWeekStart(once)).isEqualTo(once);
  }

  @Test
  void sundayStaysInItsOwnWeek() {
    ZonedDateTime sundayEvening = ZonedDateTime.of(2024, 1, 14, 23, 59, 0, 0, ZoneOffset.UTC);

    assertThat(WeekNavigator.normalizeWeekStart(sundayEvening).toLocalDate())
        .isEqualTo("2024-01-14");
  }

  @Test
  void navigatesBackAndForward() {
    assertThat(WeekNavigator.navigateWeek(MONDAY_AFTERNOON, "prev").toLocalDate())
        .isEqualTo("2024-01-07");
    assertThat(WeekNavigator.navigateWeek(MONDAY_AFTERNOON, "previous").toLocalDate())
        .isEqualTo("2024-01-07");
    assertThat(WeekNavigator.navigateWeek(MONDAY_AFTERNOON, "next").toLocalDate())
        .isEqualTo("2024-01-21");
  }

  @Test
  void unknownDirectionStaysOnNormalizedWeek() {
    ZonedDateTime start = WeekNavigator.normalizeWeekStart(MONDAY_AFTERNOON);

    assertThat(WeekNavigator.navigateWeek(MONDAY_AFTERNOON, "sideways")).isEqualTo(start);
    assertThat(WeekNavigator.navigateWeek(MONDAY_AFTERNOON, "")).isEqualTo(start);
    assertThat(WeekNavigator.navigateWeek(MONDAY_AFTERNOON, null)).isEqualTo(start);
  }

  @Test
  void nextThenPreviousReturnsToStart() {
    ZonedDateTime start = WeekNavigator.normalizeWeekStart(MONDAY_AFTERNOON);

    assertThat(WeekNavigator.previousWeek(WeekNavigator.nextWeek(start))).isEqualTo(start);
  }

  @Test
  void staysOnMidnightAcrossDaylightSavingChange() {
    ZoneId berlin = ZoneId.of("Europe/Berlin");
    // clocks go forward on Sunday 2024-03-31
    ZonedDateTime weekBefore = ZonedDateTime.of(2024, 3, 24, 0, 0, 0, 0, berlin);

    ZonedDateTime next = WeekNavigator.nextWeek(weekBefore);

    assertThat(next.toLocalDate()).isEqualTo("2024-03-31");
    assertThat(next.getHour()).isZero();
    assertThat(next.getZone()).isEqualTo(berlin);
  }
}
