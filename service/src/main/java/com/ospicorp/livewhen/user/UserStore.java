package com.ospicorp.livewhen.user;

import java.util.Optional;

public interface UserStore {
  Optional<UserAccount> findById(String userId);
}
