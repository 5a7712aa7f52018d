package com.ospicorp.livewhen.heatmap;

import com.ospicorp.livewhen.activity.ActivityRecord;
import com.ospicorp.livewhen.activity.ActivityStats;
import com.ospicorp.livewhen.activity.ActivityStore;
import com.ospicorp.livewhen.common.InsufficientDataException;
import com.ospicorp.livewhen.common.InvalidInputException;
import com.ospicorp.livewhen.common.StoreFailureException;
import com.ospicorp.livewhen.common.Stores;
import com.ospicorp.livewhen.streamer.Platform;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class HeatmapService {
  private static final Logger log = LoggerFactory.getLogger(HeatmapService.class);

  static final Duration LOOKBACK = Duration.ofDays(365);
  static final Duration RECENT_WINDOW = Duration.ofDays(90);
  static final double RECENT_WEIGHT = 0.8;
  static final double OLDER_WEIGHT = 0.2;

  private final ActivityStore activityStore;
  private final HeatmapStore heatmapStore;
  private final Clock clock;

  public HeatmapService(ActivityStore activityStore, HeatmapStore heatmapStore, Clock clock) {
    this.activityStore = activityStore;
    this.heatmapStore = heatmapStore;
    this.clock = clock;
  }

  /**
   * Recomputes the heatmap of a streamer from the last year of activity and stores it.
   *
   * <p>Each bin is {@code 0.8 * recentShare + 0.2 * olderShare}, where recent means the last 90
   * days. A window without records contributes nothing, so a streamer seen only recently has a
   * total mass of 0.8 rather than 1.0.
   *
   * @throws InvalidInputException when the streamer ID is blank
   * @throws InsufficientDataException when the streamer has no activity in the last year
   */
  public Heatmap generateHeatmap(String streamerId) {
    requireStreamerId(streamerId);

    Instant now = clock.instant();
    List<ActivityRecord> records = Stores.call("read activity records",
        () -> activityStore.findByStreamerSince(streamerId, now.minus(LOOKBACK)));
    if (records.isEmpty()) {
      log.debug("No activity in the last year for streamer {}", streamerId);
      throw new InsufficientDataException(streamerId);
    }

    Instant recentCutoff = now.minus(RECENT_WINDOW);
    List<ActivityRecord> recent = new ArrayList<>();
    List<ActivityRecord> older = new ArrayList<>();
    for (ActivityRecord record : records) {
      if (record.startTime().isAfter(recentCutoff)) {
        recent.add(record);
      } else {
        older.add(record);
      }
    }

    ZoneId zone = clock.getZone();
    Heatmap heatmap = new Heatmap(
        streamerId,
        weightedBins(countHours(recent, zone), recent.size(), countHours(older, zone), older.size()),
        weightedBins(countDays(recent, zone), recent.size(), countDays(older, zone), older.size()),
        records.size(),
        now);

    upsert(heatmap);
    log.debug("Generated heatmap for streamer {} from {} records ({} recent, {} older)",
        streamerId, records.size(), recent.size(), older.size());
    return heatmap;
  }

  public ActivityStats getActivityStats(String streamerId) {
    requireStreamerId(streamerId);

    Instant since = clock.instant().minus(LOOKBACK);
    List<ActivityRecord> records = Stores.call("read activity records",
        () -> activityStore.findByStreamerSince(streamerId, since));
    if (records.isEmpty()) {
      return ActivityStats.empty(streamerId);
    }

    ZoneId zone = clock.getZone();
    Duration total = Duration.ZERO;
    Instant lastActive = null;
    for (ActivityRecord record : records) {
      total = total.plus(record.duration());
      if (lastActive == null || record.startTime().isAfter(lastActive)) {
        lastActive = record.startTime();
      }
    }

    return new ActivityStats(
        streamerId,
        records.size(),
        total.dividedBy(records.size()),
        lastActive,
        firstMaxIndex(countHours(records, zone)),
        firstMaxIndex(countDays(records, zone)));
  }

  public ActivityRecord recordActivity(String streamerId, Instant timestamp) {
    return recordActivity(streamerId, timestamp, null);
  }

  /** Appends a point-in-time live sample: start and end are both {@code timestamp}. */
  public ActivityRecord recordActivity(String streamerId, Instant timestamp, Platform platform) {
    requireStreamerId(streamerId);
    if (timestamp == null) {
      throw new InvalidInputException("timestamp must be provided",
          InvalidInputException.MISSING_TIMESTAMP);
    }

    ActivityRecord record = new ActivityRecord(
        UUID.randomUUID().toString(),
        streamerId,
        timestamp,
        timestamp,
        platform,
        clock.instant());
    Stores.run("append activity record", () -> activityStore.append(record));
    return record;
  }

  static int dayIndex(ZonedDateTime time) {
    // DayOfWeek runs MONDAY=1..SUNDAY=7, bins run Sunday=0..Saturday=6
    return time.getDayOfWeek().getValue() % 7;
  }

  private void upsert(Heatmap heatmap) {
    boolean exists = Stores.call("read heatmap",
        () -> heatmapStore.findByStreamerId(heatmap.streamerId())).isPresent();
    if (exists) {
      Stores.run("update heatmap", () -> heatmapStore.update(heatmap));
      return;
    }
    try {
      heatmapStore.create(heatmap);
    } catch (DuplicateKeyException ex) {
      // a concurrent generation created the row first; overwrite it
      Stores.run("update heatmap", () -> heatmapStore.update(heatmap));
    } catch (DataAccessException ex) {
      throw StoreFailureException.wrap("create heatmap", ex);
    }
  }

  private static double[] weightedBins(int[] recentCounts, int recentTotal, int[] olderCounts,
      int olderTotal) {
    double[] bins = new double[recentCounts.length];
    for (int i = 0; i < bins.length; i++) {
      double probability = 0d;
      if (recentTotal > 0) {
        probability += (double) recentCounts[i] / recentTotal * RECENT_WEIGHT;
      }
      if (olderTotal > 0) {
        probability += (double) olderCounts[i] / olderTotal * OLDER_WEIGHT;
      }
      bins[i] = probability;
    }
    return bins;
  }

  private static int[] countHours(List<ActivityRecord> records, ZoneId zone) {
    int[] counts = new int[Heatmap.HOURS];
    for (ActivityRecord record : records) {
      counts[record.startTime().atZone(zone).getHour()]++;
    }
    return counts;
  }

  private static int[] countDays(List<ActivityRecord> records, ZoneId zone) {
    int[] counts = new int[Heatmap.DAYS];
    for (ActivityRecord record : records) {
      counts[dayIndex(record.startTime().atZone(zone))]++;
    }
    return counts;
  }

  private static int firstMaxIndex(int[] counts) {
    int best = 0;
    int max = 0;
    for (int i = 0; i < counts.length; i++) {
      if (counts[i] > max) {
        max = counts[i];
        best = i;
      }
    }
    return best;
  }

  private static void requireStreamerId(String streamerId) {
    if (!StringUtils.hasText(streamerId)) {
      throw InvalidInputException.blankStreamerId();
    }
  }
}
