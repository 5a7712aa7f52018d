package com.ospicorp.livewhen.programme;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class JdbcCustomProgrammeStore implements CustomProgrammeStore {
  private final JdbcTemplate jdbc;

  public JdbcCustomProgrammeStore(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  @Override
  public Optional<CustomProgramme> findByUserId(String userId) {
    String sql = """
      SELECT id, user_id, created_at, updated_at
      FROM custom_programmes
      WHERE user_id = ?
    """;
    return jdbc.query(sql, (rs, i) -> {
          String id = rs.getString(1);
          return new CustomProgramme(id, rs.getString(2), streamerIds(id),
              rs.getTimestamp(3).toInstant(), rs.getTimestamp(4).toInstant());
        }, userId)
        .stream()
        .findFirst();
  }

  @Override
  @Transactional
  public void create(CustomProgramme programme) {
    jdbc.update("""
      INSERT INTO custom_programmes (id, user_id, created_at, updated_at)
      VALUES (?, ?, ?, ?)
    """,
        programme.id(),
        programme.userId(),
        Timestamp.from(programme.createdAt()),
        Timestamp.from(programme.updatedAt()));
    insertStreamers(programme);
  }

  @Override
  @Transactional
  public void update(CustomProgramme programme) {
    jdbc.update("UPDATE custom_programmes SET updated_at = ? WHERE id = ?",
        Timestamp.from(programme.updatedAt()), programme.id());
    jdbc.update("DELETE FROM custom_programme_streamers WHERE programme_id = ?", programme.id());
    insertStreamers(programme);
  }

  @Override
  @Transactional
  public void delete(String userId) {
    jdbc.update("""
      DELETE FROM custom_programme_streamers
      WHERE programme_id IN (SELECT id FROM custom_programmes WHERE user_id = ?)
    """, userId);
    jdbc.update("DELETE FROM custom_programmes WHERE user_id = ?", userId);
  }

  private List<String> streamerIds(String programmeId) {
    String sql = """
      SELECT streamer_id
      FROM custom_programme_streamers
      WHERE programme_id = ?
      ORDER BY position
    """;
    return jdbc.queryForList(sql, String.class, programmeId);
  }

  private void insertStreamers(CustomProgramme programme) {
    List<String> ids = programme.streamerIds();
    String sql = """
      INSERT INTO custom_programme_streamers (programme_id, streamer_id, position)
      VALUES (?, ?, ?)
    """;
    for (int position = 0; position < ids.size(); position++) {
      jdbc.update(sql, programme.id(), ids.get(position), position);
    }
  }
}
