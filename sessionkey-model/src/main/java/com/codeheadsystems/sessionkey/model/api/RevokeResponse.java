package com.codeheadsystems.sessionkey.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Revocation outcome.
 *
 * @param revoked true if this call revoked the key, false if it already was
 * @param count   number of keys revoked, for batch revocation
 */
public record RevokeResponse(@JsonProperty("revoked") boolean revoked,
                             @JsonProperty("count") int count) {
}
