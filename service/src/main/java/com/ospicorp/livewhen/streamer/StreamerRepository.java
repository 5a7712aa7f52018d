package com.ospicorp.livewhen.streamer;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface StreamerRepository extends JpaRepository<Streamer, String> {
  Page<Streamer> findAllByOrderByCreatedAtAscIdAsc(Pageable pageable);
}
