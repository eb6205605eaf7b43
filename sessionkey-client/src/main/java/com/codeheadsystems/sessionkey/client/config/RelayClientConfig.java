package com.codeheadsystems.sessionkey.client.config;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Where the signing/broadcast relay lives and how long to wait for it.
 *
 * @param endpoint the relay's submit endpoint
 * @param timeout  per-request timeout
 */
public record RelayClientConfig(URI endpoint, Duration timeout) {

  /**
   * Default request timeout.
   */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  public RelayClientConfig {
    Objects.requireNonNull(endpoint, "endpoint");
    timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
  }

  /**
   * Instantiates a new Relay client config with the default timeout.
   *
   * @param endpoint the endpoint
   */
  public RelayClientConfig(URI endpoint) {
    this(endpoint, DEFAULT_TIMEOUT);
  }
}
