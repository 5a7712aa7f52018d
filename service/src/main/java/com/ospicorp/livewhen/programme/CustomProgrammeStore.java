package com.ospicorp.livewhen.programme;

import java.util.Optional;

public interface CustomProgrammeStore {
  Optional<CustomProgramme> findByUserId(String userId);

  void create(CustomProgramme programme);

  void update(CustomProgramme programme);

  void delete(String userId);
}
