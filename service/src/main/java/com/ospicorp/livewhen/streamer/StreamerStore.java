package com.ospicorp.livewhen.streamer;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface StreamerStore {
  Optional<Streamer> findById(String id);

  List<Streamer> findByIds(Collection<String> ids);

  List<Streamer> list(int limit);
}
