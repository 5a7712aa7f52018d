package com.ospicorp.livewhen.activity;

import java.time.Instant;
import java.util.List;

public interface ActivityStore {
  void append(ActivityRecord record);

  /** Records whose start time is at or after {@code since}, oldest first. */
  List<ActivityRecord> findByStreamerSince(String streamerId, Instant since);
}
