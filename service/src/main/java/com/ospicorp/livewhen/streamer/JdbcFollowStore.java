package com.ospicorp.livewhen.streamer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcFollowStore implements FollowStore {
  private final JdbcTemplate jdbc;
  private final StreamerStore streamers;

  public JdbcFollowStore(JdbcTemplate jdbc, StreamerStore streamers) {
    this.jdbc = jdbc;
    this.streamers = streamers;
  }

  @Override
  public List<Streamer> findFollowedStreamers(String userId) {
    String sql = """
      SELECT streamer_id
      FROM follows
      WHERE user_id = ?
      ORDER BY created_at, streamer_id
    """;
    List<String> ids = jdbc.queryForList(sql, String.class, userId);
    Map<String, Streamer> byId = streamers.findByIds(ids).stream()
        .collect(Collectors.toMap(Streamer::getId, Function.identity()));
    List<Streamer> ordered = new ArrayList<>(ids.size());
    for (String id : ids) {
      Streamer streamer = byId.get(id);
      if (streamer != null) {
        ordered.add(streamer);
      }
    }
    return ordered;
  }

  @Override
  public int countFollowers(String streamerId) {
    Integer count = jdbc.queryForObject(
        "SELECT COUNT(*) FROM follows WHERE streamer_id = ?", Integer.class, streamerId);
    return count == null ? 0 : count;
  }
}
