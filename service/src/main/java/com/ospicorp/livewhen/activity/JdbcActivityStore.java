package com.ospicorp.livewhen.activity;

import com.ospicorp.livewhen.streamer.Platform;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcActivityStore implements ActivityStore {
  private final JdbcTemplate jdbc;

  public JdbcActivityStore(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  @Override
  public void append(ActivityRecord record) {
    String sql = """
      INSERT INTO activity_records (id, streamer_id, start_time, end_time, platform, created_at)
      VALUES (?, ?, ?, ?, ?, ?)
    """;
    jdbc.update(sql,
        record.id(),
        record.streamerId(),
        Timestamp.from(record.startTime()),
        Timestamp.from(record.endTime()),
        record.platform() != null ? record.platform().name() : null,
        Timestamp.from(record.createdAt()));
  }

  @Override
  public List<ActivityRecord> findByStreamerSince(String streamerId, Instant since) {
    String sql = """
      SELECT id, streamer_id, start_time, end_time, platform, created_at
      FROM activity_records
      WHERE streamer_id = ? AND start_time >= ?
      ORDER BY start_time
    """;
    return jdbc.query(sql, (rs, i) -> map(rs), streamerId, Timestamp.from(since));
  }

  private static ActivityRecord map(ResultSet rs) throws SQLException {
    String platform = rs.getString(5);
    return new ActivityRecord(
        rs.getString(1),
        rs.getString(2),
        rs.getTimestamp(3).toInstant(),
        rs.getTimestamp(4).toInstant(),
        platform != null ? Platform.valueOf(platform) : null,
        rs.getTimestamp(6).toInstant());
  }
}
