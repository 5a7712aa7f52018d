package com.ospicorp.livewhen.programme;

import com.ospicorp.livewhen.calendar.WeekNavigator;
import com.ospicorp.livewhen.common.InvalidInputException;
import com.ospicorp.livewhen.common.NotFoundException;
import com.ospicorp.livewhen.common.Stores;
import com.ospicorp.livewhen.heatmap.Heatmap;
import com.ospicorp.livewhen.heatmap.HeatmapService;
import com.ospicorp.livewhen.streamer.FollowStore;
import com.ospicorp.livewhen.streamer.Streamer;
import com.ospicorp.livewhen.user.UserStore;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class TvProgrammeService {
  private static final Logger log = LoggerFactory.getLogger(TvProgrammeService.class);

  private final HeatmapService heatmapService;
  private final SlotCollector slotCollector;
  private final UserStore userStore;
  private final FollowStore followStore;
  private final Clock clock;

  public TvProgrammeService(HeatmapService heatmapService, SlotCollector slotCollector,
      UserStore userStore, FollowStore followStore, Clock clock) {
    this.heatmapService = heatmapService;
    this.slotCollector = slotCollector;
    this.userStore = userStore;
    this.followStore = followStore;
    this.clock = clock;
  }

  /** Predicted week of every streamer the user follows. */
  public TvProgramme generateProgramme(String userId, ZonedDateTime week) {
    if (!StringUtils.hasText(userId)) {
      throw InvalidInputException.blankUserId();
    }
    Stores.call("read user", () -> userStore.findById(userId))
        .orElseThrow(() -> NotFoundException.user(userId));

    List<Streamer> followed = Stores.call("read followed streamers",
        () -> followStore.findFollowedStreamers(userId));
    ZonedDateTime weekStart = WeekNavigator.normalizeWeekStart(week);

    List<ProgrammeEntry> entries = new ArrayList<>();
    for (Streamer streamer : followed) {
      slotCollector.collect(streamer.getId()).ifPresent(entries::addAll);
    }
    log.debug("Programme for user {} week {}: {} entries from {} followed streamers",
        userId, weekStart.toLocalDate(), entries.size(), followed.size());
    return new TvProgramme(userId, weekStart, entries, clock.instant());
  }

  /**
   * Most probable hour of one day for a single streamer. Unlike the batch programmes this
   * propagates every failure, including a missing activity history.
   */
  public PredictedTime getPredictedLiveTime(String streamerId, int dayOfWeek) {
    if (!StringUtils.hasText(streamerId)) {
      throw InvalidInputException.blankStreamerId();
    }
    if (dayOfWeek < 0 || dayOfWeek >= Heatmap.DAYS) {
      throw new InvalidInputException("day of week must be between 0 and 6",
          InvalidInputException.DAY_OF_WEEK_OUT_OF_RANGE);
    }
    Heatmap heatmap = heatmapService.generateHeatmap(streamerId);
    return ProgrammeSlots.mostLikelyHour(heatmap, dayOfWeek);
  }
}
