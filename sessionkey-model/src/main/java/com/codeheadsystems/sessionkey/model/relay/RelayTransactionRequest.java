package com.codeheadsystems.sessionkey.model.relay;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Signed action posted to the signing/broadcast relay.
 *
 * @param sessionAddress the session key address that signed
 * @param targetContract the contract address
 * @param methodName     the method name
 * @param amount         decimal base units
 * @param payloadHex     hex call data
 * @param gasLimit       decimal gas limit, zero for relay estimation
 * @param digestHex      hex of the signed digest
 * @param signatureHex   hex of r || s
 */
public record RelayTransactionRequest(@JsonProperty("sessionAddress") String sessionAddress,
                                      @JsonProperty("targetContract") String targetContract,
                                      @JsonProperty("methodName") String methodName,
                                      @JsonProperty("amount") String amount,
                                      @JsonProperty("payloadHex") String payloadHex,
                                      @JsonProperty("gasLimit") String gasLimit,
                                      @JsonProperty("digestHex") String digestHex,
                                      @JsonProperty("signatureHex") String signatureHex) {
}
