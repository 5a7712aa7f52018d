package com.ospicorp.livewhen.common;

import java.util.function.Supplier;
import org.springframework.dao.DataAccessException;

public final class Stores {
  private Stores() {
  }

  public static <T> T call(String operation, Supplier<T> call) {
    try {
      return call.get();
    } catch (DataAccessException ex) {
      throw StoreFailureException.wrap(operation, ex);
    }
  }

  public static void run(String operation, Runnable call) {
    try {
      call.run();
    } catch (DataAccessException ex) {
      throw StoreFailureException.wrap(operation, ex);
    }
  }
}
