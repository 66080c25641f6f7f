package com.codeheadsystems.veil.client.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. Operations check it at fixed points: before proof setup, between
 * proof stages, after the prover returns and just before submission. Once a request has been
 * submitted the token is no longer consulted.
 */
public class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  /**
   * A token nobody will cancel.
   *
   * @return the cancellation token
   */
  public static CancellationToken none() {
    return new CancellationToken();
  }

  /**
   * Request cancellation. Idempotent.
   */
  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
