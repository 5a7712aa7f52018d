package com.ospicorp.livewhen.heatmap;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Hour-of-day and day-of-week activity marginals of one streamer.
 *
 * <p>The two arrays are independent distributions, not a joint one. Day index 0 is Sunday.
 */
public record Heatmap(
    @JsonProperty("streamer_id") String streamerId,
    double[] hours,
    @JsonProperty("days_of_week") double[] daysOfWeek,
    @JsonProperty("data_points") int dataPoints,
    @JsonProperty("generated_at") Instant generatedAt
) {
  public static final int HOURS = 24;
  public static final int DAYS = 7;

  public Heatmap {
    if (hours.length != HOURS || daysOfWeek.length != DAYS) {
      throw new IllegalArgumentException("heatmap needs 24 hour bins and 7 day bins");
    }
    hours = hours.clone();
    daysOfWeek = daysOfWeek.clone();
  }

  public double hour(int hour) {
    return hours[hour];
  }

  public double day(int dayOfWeek) {
    return daysOfWeek[dayOfWeek];
  }

  @Override
  public double[] hours() {
    return hours.clone();
  }

  @Override
  @JsonProperty("days_of_week")
  public double[] daysOfWeek() {
    return daysOfWeek.clone();
  }
}
