package com.codeheadsystems.sessionkey.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.sessionkey.lifecycle.ExpiredKeySweeper;
import com.codeheadsystems.sessionkey.store.SessionKeyStore;

/**
 * Health check that verifies the session key store can be read and the expiry sweeper runs.
 */
public class SessionKeyStoreHealthCheck extends HealthCheck {

  private final SessionKeyStore store;
  private final ExpiredKeySweeper sweeper;

  /**
   * Instantiates a new Session key store health check.
   *
   * @param store   the store
   * @param sweeper the sweeper
   */
  public SessionKeyStoreHealthCheck(SessionKeyStore store, ExpiredKeySweeper sweeper) {
    this.store = store;
    this.sweeper = sweeper;
  }

  @Override
  protected Result check() {
    if (!sweeper.isRunning()) {
      return Result.unhealthy("Expiry sweeper is not running");
    }
    return Result.healthy("session keys=%d", store.loadAll().size());
  }
}
