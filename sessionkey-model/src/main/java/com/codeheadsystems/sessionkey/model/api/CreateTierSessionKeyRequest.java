package com.codeheadsystems.sessionkey.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Set;

/**
 * Request to issue a session key from a tier preset.
 *
 * @param durationSeconds  lifetime of the key
 * @param allowedContracts contract addresses the key may call
 */
public record CreateTierSessionKeyRequest(@JsonProperty("durationSeconds") long durationSeconds,
                                          @JsonProperty("allowedContracts") Set<String> allowedContracts) {
}
