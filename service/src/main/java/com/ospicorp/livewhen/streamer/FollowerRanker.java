package com.ospicorp.livewhen.streamer;

import com.ospicorp.livewhen.common.StoreFailureException;
import com.ospicorp.livewhen.common.Stores;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class FollowerRanker {
  private static final Logger log = LoggerFactory.getLogger(FollowerRanker.class);

  public static final int DEFAULT_LIMIT = 10;
  static final int MAX_STREAMERS = 10_000;

  private final StreamerStore streamerStore;
  private final FollowStore followStore;

  public FollowerRanker(StreamerStore streamerStore, FollowStore followStore) {
    this.streamerStore = streamerStore;
    this.followStore = followStore;
  }

  public List<StreamerWithFollowers> getStreamersRankedByFollowers(int limit) {
    int effectiveLimit = limit <= 0 ? DEFAULT_LIMIT : limit;

    List<Streamer> all = Stores.call("list streamers", () -> streamerStore.list(MAX_STREAMERS));
    List<StreamerWithFollowers> ranked = new ArrayList<>(all.size());
    for (Streamer streamer : all) {
      ranked.add(new StreamerWithFollowers(streamer, followerCount(streamer.getId())));
    }

    // List.sort is stable, equal counts keep the store's enumeration order
    ranked.sort(Comparator.comparingInt(StreamerWithFollowers::followerCount).reversed());
    if (ranked.size() > effectiveLimit) {
      return new ArrayList<>(ranked.subList(0, effectiveLimit));
    }
    return ranked;
  }

  private int followerCount(String streamerId) {
    try {
      return followStore.countFollowers(streamerId);
    } catch (DataAccessException ex) {
      StoreFailureException failure = StoreFailureException.wrap("count followers", ex);
      if (failure.isCancelled()) {
        throw failure;
      }
      log.warn("Follower count unavailable for streamer {}, ranking it with 0: {}",
          streamerId, ex.getMessage());
      return 0;
    }
  }
}
