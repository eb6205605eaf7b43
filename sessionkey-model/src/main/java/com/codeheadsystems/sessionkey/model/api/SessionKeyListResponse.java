package com.codeheadsystems.sessionkey.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Ids of a principal's live session keys, newest first.
 *
 * @param sessionKeyIds the ids
 */
public record SessionKeyListResponse(@JsonProperty("sessionKeyIds") List<String> sessionKeyIds) {
}
