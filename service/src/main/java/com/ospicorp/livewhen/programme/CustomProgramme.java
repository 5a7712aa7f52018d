package com.ospicorp.livewhen.programme;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import org.springframework.util.StringUtils;

// An empty userId marks a guest programme that lives in the caller's session only.
// Streamer ids keep their first occurrence only.
public record CustomProgramme(
    String id,
    @JsonProperty("user_id") String userId,
    @JsonProperty("streamer_ids") List<String> streamerIds,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

  public CustomProgramme {
    userId = userId == null ? "" : userId;
    streamerIds = streamerIds == null ? List.of() : List.copyOf(new LinkedHashSet<>(streamerIds));
  }

  @JsonIgnore
  public boolean isGuest() {
    return !StringUtils.hasText(userId);
  }

  public CustomProgramme withStreamerIds(List<String> ids, Instant now) {
    return new CustomProgramme(id, userId, ids, createdAt, now);
  }
}
