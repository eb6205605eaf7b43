package com.codeheadsystems.sessionkey.dropwizard.lifecycle;

import com.codeheadsystems.sessionkey.lifecycle.ExpiredKeySweeper;
import io.dropwizard.lifecycle.Managed;

/**
 * Ties the expiry sweeper to the Dropwizard server lifecycle.
 */
public class ManagedExpiredKeySweeper implements Managed {

  private final ExpiredKeySweeper sweeper;

  /**
   * Instantiates a new Managed expired key sweeper.
   *
   * @param sweeper the sweeper
   */
  public ManagedExpiredKeySweeper(ExpiredKeySweeper sweeper) {
    this.sweeper = sweeper;
  }

  @Override
  public void start() {
    sweeper.start();
  }

  @Override
  public void stop() {
    sweeper.shutdown();
  }
}
