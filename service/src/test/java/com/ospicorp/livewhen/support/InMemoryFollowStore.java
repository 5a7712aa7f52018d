package com.ospicorp.livewhen.support;

import com.ospicorp.livewhen.streamer.FollowStore;
import com.ospicorp.livewhen.streamer.Streamer;
import com.ospicorp.livewhen.streamer.StreamerStore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class InMemoryFollowStore implements FollowStore {
  private final StreamerStore streamers;
  private final Map<String, List<String>> followsByUser = new HashMap<>();
  private final Map<String, RuntimeException> countFailures = new HashMap<>();

  public InMemoryFollowStore(StreamerStore streamers) {
    this.streamers = streamers;
  }

  public InMemoryFollowStore follow(String userId, String streamerId) {
    followsByUser.computeIfAbsent(userId, key -> new ArrayList<>()).add(streamerId);
    return this;
  }

  public InMemoryFollowStore failCountFor(String streamerId, RuntimeException failure) {
    countFailures.put(streamerId, failure);
    return this;
  }

  @Override
  public List<Streamer> findFollowedStreamers(String userId) {
    return streamers.findByIds(followsByUser.getOrDefault(userId, List.of()));
  }

  @Override
  public int countFollowers(String streamerId) {
    RuntimeException failure = countFailures.get(streamerId);
    if (failure != null) {
      throw failure;
    }
    return (int) followsByUser.values().stream()
        .filter(ids -> ids.contains(streamerId))
        .count();
  }
}
