package com.ospicorp.livewhen.user;

import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcUserStore implements UserStore {
  private final JdbcTemplate jdbc;

  public JdbcUserStore(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  @Override
  public Optional<UserAccount> findById(String userId) {
    String sql = """
      SELECT id, email, created_at
      FROM users
      WHERE id = ?
    """;
    return jdbc.query(sql, (rs, i) -> new UserAccount(rs.getString(1), rs.getString(2),
                                                      rs.getTimestamp(3).toInstant()),
                      userId)
        .stream()
        .findFirst();
  }
}
