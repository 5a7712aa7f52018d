package com.ospicorp.livewhen.programme;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record CustomProgrammeRequest(
    @JsonProperty("streamer_ids") @JsonAlias("streamerIds") List<String> streamerIds
) {
  public List<String> streamerIdsOrEmpty() {
    return streamerIds == null ? List.of() : streamerIds;
  }
}
