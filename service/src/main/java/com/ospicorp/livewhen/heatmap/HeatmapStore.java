package com.ospicorp.livewhen.heatmap;

import java.util.Optional;

public interface HeatmapStore {
  Optional<Heatmap> findByStreamerId(String streamerId);

  void create(Heatmap heatmap);

  void update(Heatmap heatmap);
}
