package com.ospicorp.livewhen.programme;

import com.ospicorp.livewhen.calendar.WeekNavigator;
import com.ospicorp.livewhen.common.ConflictException;
import com.ospicorp.livewhen.common.InvalidInputException;
import com.ospicorp.livewhen.common.NotFoundException;
import com.ospicorp.livewhen.common.StoreFailureException;
import com.ospicorp.livewhen.common.Stores;
import com.ospicorp.livewhen.streamer.FollowerRanker;
import com.ospicorp.livewhen.streamer.Streamer;
import com.ospicorp.livewhen.streamer.StreamerDto;
import com.ospicorp.livewhen.streamer.StreamerStore;
import com.ospicorp.livewhen.streamer.StreamerWithFollowers;
import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class ProgrammeService {
  private static final Logger log = LoggerFactory.getLogger(ProgrammeService.class);

  private final CustomProgrammeStore programmeStore;
  private final StreamerStore streamerStore;
  private final FollowerRanker followerRanker;
  private final SlotCollector slotCollector;
  private final Clock clock;

  public ProgrammeService(CustomProgrammeStore programmeStore, StreamerStore streamerStore,
      FollowerRanker followerRanker, SlotCollector slotCollector, Clock clock) {
    this.programmeStore = programmeStore;
    this.streamerStore = streamerStore;
    this.followerRanker = followerRanker;
    this.slotCollector = slotCollector;
    this.clock = clock;
  }

  public CustomProgramme createCustomProgramme(String userId, List<String> streamerIds) {
    requireUserId(userId);
    Instant now = clock.instant();
    CustomProgramme programme = new CustomProgramme(UUID.randomUUID().toString(), userId,
        streamerIds, now, now);
    try {
      programmeStore.create(programme);
    } catch (DuplicateKeyException ex) {
      throw ConflictException.customProgrammeExists(userId, ex);
    } catch (DataAccessException ex) {
      throw StoreFailureException.wrap("create custom programme", ex);
    }
    log.info("Created custom programme {} for user {} with {} streamers",
        programme.id(), userId, programme.streamerIds().size());
    return programme;
  }

  public CustomProgramme getCustomProgramme(String userId) {
    requireUserId(userId);
    return Stores.call("read custom programme", () -> programmeStore.findByUserId(userId))
        .orElseThrow(() -> NotFoundException.customProgramme(userId));
  }

  public CustomProgramme updateCustomProgramme(String userId, List<String> streamerIds) {
    CustomProgramme updated = getCustomProgramme(userId).withStreamerIds(streamerIds,
        clock.instant());
    Stores.run("update custom programme", () -> programmeStore.update(updated));
    return updated;
  }

  public void deleteCustomProgramme(String userId) {
    requireUserId(userId);
    Stores.run("delete custom programme", () -> programmeStore.delete(userId));
    log.info("Deleted custom programme of user {}", userId);
  }

  public CustomProgramme addStreamerToProgramme(String userId, String streamerId) {
    requireStreamerId(streamerId);
    CustomProgramme programme = getCustomProgramme(userId);
    if (programme.streamerIds().contains(streamerId)) {
      return programme;
    }
    List<String> ids = new ArrayList<>(programme.streamerIds());
    ids.add(streamerId);
    CustomProgramme updated = programme.withStreamerIds(ids, clock.instant());
    Stores.run("update custom programme", () -> programmeStore.update(updated));
    return updated;
  }

  public CustomProgramme removeStreamerFromProgramme(String userId, String streamerId) {
    requireStreamerId(streamerId);
    CustomProgramme programme = getCustomProgramme(userId);
    List<String> ids = new ArrayList<>(programme.streamerIds());
    ids.removeIf(streamerId::equals);
    CustomProgramme updated = programme.withStreamerIds(ids, clock.instant());
    Stores.run("update custom programme", () -> programmeStore.update(updated));
    return updated;
  }

  /** A session-scoped programme; nothing is persisted. */
  public CustomProgramme createGuestProgramme(List<String> streamerIds) {
    Instant now = clock.instant();
    return new CustomProgramme(UUID.randomUUID().toString(), "", streamerIds, now, now);
  }

  /**
   * Predicted week restricted to the streamers of a custom programme. Streamers that cannot be
   * resolved or predicted are skipped.
   */
  public ProgrammeCalendarView generateCalendarFromProgramme(CustomProgramme programme,
      ZonedDateTime week) {
    if (programme == null) {
      throw new InvalidInputException("programme cannot be null",
          InvalidInputException.INVALID_PROGRAMME);
    }
    ZonedDateTime weekStart = WeekNavigator.normalizeWeekStart(week);

    List<Streamer> streamers = new ArrayList<>();
    List<ProgrammeEntry> entries = new ArrayList<>();
    for (String streamerId : programme.streamerIds()) {
      Optional<Streamer> streamer = resolve(streamerId);
      if (streamer.isEmpty()) {
        continue;
      }
      streamers.add(streamer.get());
      slotCollector.collect(streamerId).ifPresent(entries::addAll);
    }
    return new ProgrammeCalendarView(weekStart, streamers, entries, true, programme.isGuest());
  }

  public ProgrammeCalendarView generateGlobalProgramme(ZonedDateTime week, int limit) {
    ZonedDateTime weekStart = WeekNavigator.normalizeWeekStart(week);
    List<Streamer> top = followerRanker.getStreamersRankedByFollowers(limit).stream()
        .map(StreamerWithFollowers::streamer)
        .toList();

    List<ProgrammeEntry> entries = new ArrayList<>();
    for (Streamer streamer : top) {
      slotCollector.collect(streamer.getId()).ifPresent(entries::addAll);
    }
    return new ProgrammeCalendarView(weekStart, top, entries, false, false);
  }

  /**
   * The custom calendar when the user has a custom programme with at least one streamer,
   * otherwise the global top ten.
   */
  public ProgrammeCalendarView getProgrammeView(String userId, ZonedDateTime week) {
    if (StringUtils.hasText(userId)) {
      Optional<CustomProgramme> programme = Stores.call("read custom programme",
          () -> programmeStore.findByUserId(userId));
      if (programme.isPresent() && !programme.get().streamerIds().isEmpty()) {
        return generateCalendarFromProgramme(programme.get(), week);
      }
    }
    return generateGlobalProgramme(week, FollowerRanker.DEFAULT_LIMIT);
  }

  /** Home page view: the global programme of the current week with follower counts. */
  public DefaultWeekView getDefaultWeekView() {
    ZonedDateTime weekStart = WeekNavigator.normalizeWeekStart(ZonedDateTime.now(clock));
    List<StreamerWithFollowers> ranked =
        followerRanker.getStreamersRankedByFollowers(FollowerRanker.DEFAULT_LIMIT);

    List<StreamerDto> streamers = new ArrayList<>(ranked.size());
    Map<String, Integer> followerCounts = new LinkedHashMap<>();
    List<ProgrammeEntry> entries = new ArrayList<>();
    for (StreamerWithFollowers item : ranked) {
      Streamer streamer = item.streamer();
      streamers.add(StreamerDto.from(streamer));
      followerCounts.put(streamer.getId(), item.followerCount());
      slotCollector.collect(streamer.getId()).ifPresent(entries::addAll);
    }
    return new DefaultWeekView(weekStart, streamers, entries, followerCounts);
  }

  private Optional<Streamer> resolve(String streamerId) {
    if (!StringUtils.hasText(streamerId)) {
      return Optional.empty();
    }
    try {
      return Stores.call("read streamer", () -> streamerStore.findById(streamerId));
    } catch (StoreFailureException ex) {
      if (ex.isCancelled()) {
        throw ex;
      }
      log.warn("Skipping unresolvable streamer {}: {}", streamerId, ex.getMessage());
      return Optional.empty();
    }
  }

  private static void requireUserId(String userId) {
    if (!StringUtils.hasText(userId)) {
      throw InvalidInputException.blankUserId();
    }
  }

  private static void requireStreamerId(String streamerId) {
    if (!StringUtils.hasText(streamerId)) {
      throw InvalidInputException.blankStreamerId();
    }
  }
}
