package com.ospicorp.livewhen.web;

import com.ospicorp.livewhen.common.InvalidInputException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Turns the {@code week} query parameter into an instant in the configured zone. */
@Component
public class WeekParameters {
  private final Clock clock;

  public WeekParameters(Clock clock) {
    this.clock = clock;
  }

  /**
   * Parses an ISO {@code yyyy-MM-dd} date at midnight in the clock's zone. An absent value means
   * the current time; callers normalize to the week start.
   */
  public ZonedDateTime resolve(String week) {
    if (!StringUtils.hasText(week)) {
      return ZonedDateTime.now(clock);
    }
    try {
      return LocalDate.parse(week.trim()).atStartOfDay(clock.getZone());
    } catch (DateTimeParseException ex) {
      throw new InvalidInputException("week must be an ISO date (yyyy-MM-dd): " + week,
          InvalidInputException.INVALID_WEEK);
    }
  }
}
