package com.ospicorp.livewhen.streamer;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapKeyColumn;
import jakarta.persistence.MapKeyEnumerated;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

@Entity
@Table(name = "streamers")
public class Streamer {

  @Id
  private String id;
  private String name;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "streamer_platforms", joinColumns = @JoinColumn(name = "streamer_id"))
  @MapKeyColumn(name = "platform")
  @MapKeyEnumerated(EnumType.STRING)
  @Column(name = "handle")
  private Map<Platform, String> handles = new HashMap<>();

  @Column(name = "created_at")
  private Instant createdAt;

  @Column(name = "updated_at")
  private Instant updatedAt;

  protected Streamer() {
    // JPA default constructor
  }

  public Streamer(String id, String name, Map<Platform, String> handles, Instant createdAt) {
    this.id = id;
    this.name = name;
    this.handles = new HashMap<>(handles);
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public Map<Platform, String> getHandles() {
    return handles.isEmpty() ? Map.of() : new EnumMap<>(handles);
  }

  public Set<Platform> getPlatforms() {
    return getHandles().keySet();
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Streamer other)) {
      return false;
    }
    return Objects.equals(id, other.id);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id);
  }

  @Override
  public String toString() {
    return "Streamer{id=" + id + ", name=" + name + "}";
  }
}
