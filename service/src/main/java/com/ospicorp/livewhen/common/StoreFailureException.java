package com.ospicorp.livewhen.common;

import org.springframework.dao.QueryTimeoutException;

public class StoreFailureException extends RuntimeException {
  private final boolean cancelled;

  public StoreFailureException(String message, Throwable cause, boolean cancelled) {
    super(message, cause);
    this.cancelled = cancelled;
  }

  public static StoreFailureException wrap(String operation, RuntimeException cause) {
    boolean cancelled = cause instanceof QueryTimeoutException
        || Thread.currentThread().isInterrupted();
    String message = cancelled
        ? "Store call cancelled: " + operation
        : "Store call failed: " + operation;
    return new StoreFailureException(message, cause, cancelled);
  }

  /**
   * True when the repository call was aborted by a timeout or interruption rather than failing
   * on its own. Batch operations never swallow a cancelled failure.
   */
  public boolean isCancelled() {
    return cancelled;
  }
}
