package com.ospicorp.livewhen.heatmap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Optional;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

// Bins are stored as JSON arrays in text columns
@Repository
public class JdbcHeatmapStore implements HeatmapStore {
  private final JdbcTemplate jdbc;
  private final ObjectMapper mapper;

  public JdbcHeatmapStore(JdbcTemplate jdbc, ObjectMapper mapper) {
    this.jdbc = jdbc;
    this.mapper = mapper;
  }

  @Override
  public Optional<Heatmap> findByStreamerId(String streamerId) {
    String sql = """
      SELECT streamer_id, hours, days_of_week, data_points, generated_at
      FROM heatmaps
      WHERE streamer_id = ?
    """;
    return jdbc.query(sql, (rs, i) -> map(rs), streamerId).stream().findFirst();
  }

  @Override
  public void create(Heatmap heatmap) {
    String sql = """
      INSERT INTO heatmaps (streamer_id, hours, days_of_week, data_points, generated_at)
      VALUES (?, ?, ?, ?, ?)
    """;
    jdbc.update(sql,
        heatmap.streamerId(),
        write(heatmap.hours()),
        write(heatmap.daysOfWeek()),
        heatmap.dataPoints(),
        Timestamp.from(heatmap.generatedAt()));
  }

  @Override
  public void update(Heatmap heatmap) {
    String sql = """
      UPDATE heatmaps
      SET hours = ?, days_of_week = ?, data_points = ?, generated_at = ?
      WHERE streamer_id = ?
    """;
    jdbc.update(sql,
        write(heatmap.hours()),
        write(heatmap.daysOfWeek()),
        heatmap.dataPoints(),
        Timestamp.from(heatmap.generatedAt()),
        heatmap.streamerId());
  }

  private Heatmap map(ResultSet rs) throws SQLException {
    return new Heatmap(
        rs.getString(1),
        read(rs.getString(2)),
        read(rs.getString(3)),
        rs.getInt(4),
        rs.getTimestamp(5).toInstant());
  }

  private String write(double[] bins) {
    try {
      return mapper.writeValueAsString(bins);
    } catch (JsonProcessingException ex) {
      throw new InvalidDataAccessApiUsageException("Unable to serialize heatmap bins", ex);
    }
  }

  private double[] read(String json) {
    try {
      return mapper.readValue(json, double[].class);
    } catch (JsonProcessingException ex) {
      throw new DataRetrievalFailureException("Corrupt heatmap bins: " + json, ex);
    }
  }
}
