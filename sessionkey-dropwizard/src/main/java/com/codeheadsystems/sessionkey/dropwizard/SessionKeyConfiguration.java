package com.codeheadsystems.sessionkey.dropwizard;

import com.codeheadsystems.sessionkey.gateway.QuotaConsumptionPoint;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Dropwizard configuration for the session key service.
 * <p>
 * With no {@code storeFile} the keys live in memory only and vanish on restart. With no
 * {@code relayEndpoint} the bundle needs a {@code TransactionSigner} passed to its constructor.
 */
public class SessionKeyConfiguration extends Configuration {

  /**
   * Zone whose midnight starts a new quota day.
   */
  @NotEmpty
  private String dayBoundaryZone = "UTC";

  /**
   * When an admitted action consumes quota: {@code SUBMISSION} (default) or
   * {@code CONFIRMATION}.
   */
  @NotNull
  private QuotaConsumptionPoint quotaConsumptionPoint = QuotaConsumptionPoint.DEFAULT;

  /**
   * Seconds between expiry sweeps.
   */
  @Min(1)
  private long cleanupIntervalSeconds = 300;

  /**
   * JSON document holding the keys. Empty keeps them in memory.
   */
  private String storeFile = "";

  /**
   * Submit endpoint of the signing/broadcast relay.
   */
  private String relayEndpoint = "";

  /**
   * Relay request timeout in seconds.
   */
  @Min(1)
  private long relayTimeoutSeconds = 30;

  /**
   * Gets day boundary zone.
   *
   * @return the day boundary zone
   */
  @JsonProperty
  public String getDayBoundaryZone() {
    return dayBoundaryZone;
  }

  /**
   * Sets day boundary zone.
   *
   * @param dayBoundaryZone the day boundary zone
   */
  @JsonProperty
  public void setDayBoundaryZone(String dayBoundaryZone) {
    this.dayBoundaryZone = dayBoundaryZone;
  }

  /**
   * Gets quota consumption point.
   *
   * @return the quota consumption point
   */
  @JsonProperty
  public QuotaConsumptionPoint getQuotaConsumptionPoint() {
    return quotaConsumptionPoint;
  }

  /**
   * Sets quota consumption point.
   *
   * @param quotaConsumptionPoint the quota consumption point
   */
  @JsonProperty
  public void setQuotaConsumptionPoint(QuotaConsumptionPoint quotaConsumptionPoint) {
    this.quotaConsumptionPoint = quotaConsumptionPoint;
  }

  /**
   * Gets cleanup interval seconds.
   *
   * @return the cleanup interval seconds
   */
  @JsonProperty
  public long getCleanupIntervalSeconds() {
    return cleanupIntervalSeconds;
  }

  /**
   * Sets cleanup interval seconds.
   *
   * @param cleanupIntervalSeconds the cleanup interval seconds
   */
  @JsonProperty
  public void setCleanupIntervalSeconds(long cleanupIntervalSeconds) {
    this.cleanupIntervalSeconds = cleanupIntervalSeconds;
  }

  /**
   * Gets store file.
   *
   * @return the store file
   */
  @JsonProperty
  public String getStoreFile() {
    return storeFile;
  }

  /**
   * Sets store file.
   *
   * @param storeFile the store file
   */
  @JsonProperty
  public void setStoreFile(String storeFile) {
    this.storeFile = storeFile;
  }

  /**
   * Gets relay endpoint.
   *
   * @return the relay endpoint
   */
  @JsonProperty
  public String getRelayEndpoint() {
    return relayEndpoint;
  }

  /**
   * Sets relay endpoint.
   *
   * @param relayEndpoint the relay endpoint
   */
  @JsonProperty
  public void setRelayEndpoint(String relayEndpoint) {
    this.relayEndpoint = relayEndpoint;
  }

  /**
   * Gets relay timeout seconds.
   *
   * @return the relay timeout seconds
   */
  @JsonProperty
  public long getRelayTimeoutSeconds() {
    return relayTimeoutSeconds;
  }

  /**
   * Sets relay timeout seconds.
   *
   * @param relayTimeoutSeconds the relay timeout seconds
   */
  @JsonProperty
  public void setRelayTimeoutSeconds(long relayTimeoutSeconds) {
    this.relayTimeoutSeconds = relayTimeoutSeconds;
  }
}
