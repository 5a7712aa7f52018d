package com.ospicorp.livewhen.config;

import com.ospicorp.livewhen.streamer.Platform;
import com.ospicorp.livewhen.streamer.Streamer;
import com.ospicorp.livewhen.streamer.StreamerRepository;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Fills an empty development database with a handful of streamers, users, follows and a year of
 * live sessions. Each streamer streams on fixed weekdays around a fixed hour with some jitter, so
 * heatmaps and programmes have a recognisable shape.
 */
@Component
public class DatabaseSeeder implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(DatabaseSeeder.class);
  private static final int HISTORY_DAYS = 365;

  private final StreamerRepository streamerRepository;
  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final Environment environment;
  private final Clock clock;
  private final boolean seedEnabled;
  private final Random random = new Random(8675309L);

  public DatabaseSeeder(StreamerRepository streamerRepository,
      JdbcTemplate jdbcTemplate,
      PlatformTransactionManager transactionManager,
      Environment environment,
      Clock clock,
      @Value("${livewhen.seed.enabled:true}") boolean seedEnabled) {
    this.streamerRepository = streamerRepository;
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.environment = environment;
    this.clock = clock;
    this.seedEnabled = seedEnabled;
  }

  @Override
  public void run(String... args) {
    if (!seedEnabled) {
      log.info("Database seeding disabled via property livewhen.seed.enabled=false");
      return;
    }
    if (environment.acceptsProfiles(Profiles.of("prod"))) {
      log.info("Skipping database seeding because active profile includes prod");
      return;
    }
    long existing = streamerRepository.count();
    if (existing > 0) {
      log.info("Database already contains {} streamers; skipping seeding", existing);
      return;
    }
    transactionTemplate.executeWithoutResult(status -> seedDatabase());
  }

  void seedDatabase() {
    log.info("Seeding database with development streamers and activity");
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    List<SeedStreamer> seeds = buildSeedDefinitions();

    List<Streamer> streamers = new ArrayList<>(seeds.size());
    for (SeedStreamer seed : seeds) {
      streamers.add(new Streamer(seed.id(), seed.name(), seed.handles(), now));
    }
    streamerRepository.saveAll(streamers);

    List<String> userIds = insertUsers(now);
    int follows = insertFollows(userIds, seeds, now);
    int sessions = 0;
    for (SeedStreamer seed : seeds) {
      sessions += insertSessions(seed, now);
    }
    log.info("Inserted {} streamers, {} users, {} follows and {} activity records",
        streamers.size(), userIds.size(), follows, sessions);
  }

  private List<SeedStreamer> buildSeedDefinitions() {
    List<SeedStreamer> seeds = new ArrayList<>();
    // day indexes: 0 = Sunday
    seeds.add(new SeedStreamer("nightowl", "Night Owl",
        Map.of(Platform.TWITCH, "nightowl_tv"), new int[]{1, 3, 5}, 21, Duration.ofHours(4), 0.9));
    seeds.add(new SeedStreamer("speedrunsam", "Speedrun Sam",
        Map.of(Platform.TWITCH, "speedrunsam", Platform.YOUTUBE, "@speedrunsam"),
        new int[]{0, 6}, 14, Duration.ofHours(6), 0.8));
    seeds.add(new SeedStreamer("morningbrew", "Morning Brew",
        Map.of(Platform.YOUTUBE, "@morningbrewlive"), new int[]{1, 2, 3, 4, 5}, 7,
        Duration.ofHours(2), 0.85));
    seeds.add(new SeedStreamer("kickclips", "Kick Clips",
        Map.of(Platform.KICK, "kickclips"), new int[]{2, 4}, 18, Duration.ofHours(3), 0.7));
    seeds.add(new SeedStreamer("chessclub", "Chess Club",
        Map.of(Platform.TWITCH, "chessclub", Platform.KICK, "chessclub"), new int[]{0, 3}, 19,
        Duration.ofHours(3), 0.6));
    seeds.add(new SeedStreamer("retroroom", "Retro Room",
        Map.of(Platform.YOUTUBE, "@retroroom"), new int[]{5, 6}, 23, Duration.ofHours(5), 0.75));
    return seeds;
  }

  private List<String> insertUsers(Instant now) {
    List<String> userIds = List.of("demo-user", "casual-viewer", "night-shift");
    List<Object[]> batchArgs = new ArrayList<>(userIds.size());
    for (String userId : userIds) {
      batchArgs.add(new Object[]{userId, userId + "@example.com", Timestamp.from(now)});
    }
    jdbcTemplate.batchUpdate("INSERT INTO users(id, email, created_at) VALUES (?, ?, ?)",
        batchArgs);
    return userIds;
  }

  // Follower counts fall off with the streamer's position so the ranking is not flat
  private int insertFollows(List<String> userIds, List<SeedStreamer> seeds, Instant now) {
    List<Object[]> batchArgs = new ArrayList<>();
    for (int s = 0; s < seeds.size(); s++) {
      for (int u = 0; u < userIds.size(); u++) {
        if (u + s < userIds.size() + 1) {
          batchArgs.add(new Object[]{userIds.get(u), seeds.get(s).id(), Timestamp.from(now)});
        }
      }
    }
    jdbcTemplate.batchUpdate(
        "INSERT INTO follows(user_id, streamer_id, created_at) VALUES (?, ?, ?)", batchArgs);
    return batchArgs.size();
  }

  private int insertSessions(SeedStreamer seed, Instant now) {
    ZonedDateTime today = now.atZone(clock.getZone());
    List<Object[]> batchArgs = new ArrayList<>();
    Platform platform = seed.handles().keySet().iterator().next();
    for (int back = 1; back <= HISTORY_DAYS; back++) {
      LocalDate date = today.toLocalDate().minusDays(back);
      int dayIndex = date.getDayOfWeek().getValue() % 7;
      if (!streamsOn(seed, dayIndex) || random.nextDouble() > seed.reliability()) {
        continue;
      }
      int hour = Math.floorMod(seed.hour() + (int) Math.round(random.nextGaussian()), 24);
      Instant start = date.atTime(hour, random.nextInt(4) * 15).atZone(clock.getZone())
          .toInstant();
      Instant end = start.plus(seed.sessionLength());
      batchArgs.add(new Object[]{
          UUID.randomUUID().toString(),
          seed.id(),
          Timestamp.from(start),
          Timestamp.from(end),
          platform.name(),
          Timestamp.from(now)
      });
    }
    jdbcTemplate.batchUpdate("""
        INSERT INTO activity_records(id, streamer_id, start_time, end_time, platform, created_at)
        VALUES (?, ?, ?, ?, ?, ?)
        """, batchArgs);
    return batchArgs.size();
  }

  private static boolean streamsOn(SeedStreamer seed, int dayIndex) {
    for (int day : seed.days()) {
      if (day == dayIndex) {
        return true;
      }
    }
    return false;
  }

  private record SeedStreamer(String id, String name, Map<Platform, String> handles, int[] days,
      int hour, Duration sessionLength, double reliability) {}
}
