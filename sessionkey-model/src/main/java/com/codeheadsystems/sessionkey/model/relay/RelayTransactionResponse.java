package com.codeheadsystems.sessionkey.model.relay;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Relay's answer.
 *
 * @param transactionHash the broadcast transaction hash
 * @param status          SUBMITTED, CONFIRMED or REVERTED
 */
public record RelayTransactionResponse(@JsonProperty("transactionHash") String transactionHash,
                                       @JsonProperty("status") String status) {
}
