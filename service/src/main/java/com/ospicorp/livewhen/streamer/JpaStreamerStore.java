package com.ospicorp.livewhen.streamer;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional(readOnly = true)
public class JpaStreamerStore implements StreamerStore {
  private final StreamerRepository repository;

  public JpaStreamerStore(StreamerRepository repository) {
    this.repository = repository;
  }

  @Override
  public Optional<Streamer> findById(String id) {
    return repository.findById(id);
  }

  @Override
  public List<Streamer> findByIds(Collection<String> ids) {
    if (ids.isEmpty()) {
      return List.of();
    }
    return repository.findAllById(ids);
  }

  @Override
  public List<Streamer> list(int limit) {
    return repository.findAllByOrderByCreatedAtAscIdAsc(PageRequest.of(0, Math.max(1, limit)))
        .getContent();
  }
}
