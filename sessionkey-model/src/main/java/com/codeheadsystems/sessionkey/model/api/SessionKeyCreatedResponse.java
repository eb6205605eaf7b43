package com.codeheadsystems.sessionkey.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Issued session key.
 *
 * @param sessionKeyId   the id
 * @param address        the session signing address
 * @param expirationTime when it expires
 */
public record SessionKeyCreatedResponse(@JsonProperty("sessionKeyId") String sessionKeyId,
                                        @JsonProperty("address") String address,
                                        @JsonProperty("expirationTime") Instant expirationTime) {
}
