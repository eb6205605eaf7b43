package com.codeheadsystems.sessionkey.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Action to run under a session key.
 *
 * @param targetContract the contract address
 * @param methodName     the method name
 * @param amount         decimal base units
 * @param payloadHex     hex call data, optional
 * @param gasLimit       decimal gas limit, optional
 */
public record ExecuteRequest(@JsonProperty("targetContract") String targetContract,
                             @JsonProperty("methodName") String methodName,
                             @JsonProperty("amount") String amount,
                             @JsonProperty("payloadHex") String payloadHex,
                             @JsonProperty("gasLimit") String gasLimit) {
}
