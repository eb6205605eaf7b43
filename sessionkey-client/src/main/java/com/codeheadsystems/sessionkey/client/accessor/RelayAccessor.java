package com.codeheadsystems.sessionkey.client.accessor;

import com.codeheadsystems.sessionkey.client.config.RelayClientConfig;
import com.codeheadsystems.sessionkey.client.exceptions.RelayAccessorException;
import com.codeheadsystems.sessionkey.model.relay.RelayTransactionRequest;
import com.codeheadsystems.sessionkey.model.relay.RelayTransactionResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP access to the signing/broadcast relay.
 */
@Singleton
public class RelayAccessor {
  private static final Logger log = LoggerFactory.getLogger(RelayAccessor.class);

  private final RelayClientConfig config;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Relay accessor.
   *
   * @param config       the config
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   */
  @Inject
  public RelayAccessor(final RelayClientConfig config,
                       final HttpClient httpClient,
                       final ObjectMapper objectMapper) {
    log.info("RelayAccessor({})", config.endpoint());
    this.config = config;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
  }

  /**
   * Posts a signed action to the relay.
   *
   * @param request the request
   * @return the relay's response
   * @throws RelayAccessorException if the call fails or the relay answers with an error status
   * @throws SecurityException      if the relay rejects the caller (401/403)
   */
  public RelayTransactionResponse submit(final RelayTransactionRequest request) {
    log.trace("submit(sessionAddress={}, method={})", request.sessionAddress(), request.methodName());
    try {
      final String requestBody = objectMapper.writeValueAsString(request);
      final HttpRequest httpRequest = HttpRequest.newBuilder()
          .uri(config.endpoint())
          .timeout(config.timeout())
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(requestBody))
          .build();

      final HttpResponse<String> httpResponse = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      checkStatus(httpResponse.statusCode());
      return objectMapper.readValue(httpResponse.body(), RelayTransactionResponse.class);
    } catch (IOException e) {
      throw new RelayAccessorException("Relay request failed: " + config.endpoint(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RelayAccessorException("Relay request interrupted: " + config.endpoint(), e);
    }
  }

  private void checkStatus(int statusCode) {
    if (statusCode == 401 || statusCode == 403) {
      throw new SecurityException("Relay rejected request (" + statusCode + "): " + config.endpoint());
    }
    if (statusCode >= 400) {
      throw new RelayAccessorException("Relay returned HTTP " + statusCode + ": " + config.endpoint(), null);
    }
  }
}
