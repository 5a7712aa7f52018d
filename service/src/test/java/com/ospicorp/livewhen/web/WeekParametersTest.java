package com.ospicorp.livewhen.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.livewhen.common.InvalidInputException;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

class WeekParametersTest {

  private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");

  private final WeekParameters weeks =
      new WeekParameters(Clock.fixed(FixedClockConfig.NOW, TOKYO));

  @Test
  void dateIsMidnightInClockZone() {
    assertThat(weeks.resolve("2024-03-05"))
        .isEqualTo(ZonedDateTime.of(2024, 3, 5, 0, 0, 0, 0, TOKYO));
  }

  @Test
  void blankMeansNow() {
    assertThat(weeks.resolve(null)).isEqualTo(FixedClockConfig.NOW.atZone(TOKYO));
    assertThat(weeks.resolve(" ")).isEqualTo(FixedClockConfig.NOW.atZone(TOKYO));
  }

  @Test
  void malformedDateIsInvalidWeek() {
    assertThatThrownBy(() -> weeks.resolve("2024-13-01"))
        .isInstanceOfSatisfying(InvalidInputException.class,
            ex -> assertThat(ex.errorCode()).isEqualTo(InvalidInputException.INVALID_WEEK));
  }
}
