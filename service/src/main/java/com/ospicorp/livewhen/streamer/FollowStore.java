package com.ospicorp.livewhen.streamer;

import java.util.List;

public interface FollowStore {
  List<Streamer> findFollowedStreamers(String userId);

  int countFollowers(String streamerId);
}
