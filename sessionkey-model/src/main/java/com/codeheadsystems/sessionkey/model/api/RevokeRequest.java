package com.codeheadsystems.sessionkey.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Revocation request.
 *
 * @param reason optional reason
 */
public record RevokeRequest(@JsonProperty("reason") String reason) {
}
