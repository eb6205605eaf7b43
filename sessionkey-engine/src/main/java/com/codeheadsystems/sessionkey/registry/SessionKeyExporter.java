package com.codeheadsystems.sessionkey.registry;

import com.codeheadsystems.sessionkey.model.SessionKeyConfig;
import com.codeheadsystems.sessionkey.model.SessionKeyFilter;
import com.codeheadsystems.sessionkey.model.SessionKeyState;
import com.codeheadsystems.sessionkey.model.SessionKeyStatus;
import com.codeheadsystems.sessionkey.model.SessionKeyUsage;
import com.codeheadsystems.sessionkey.store.ObjectMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Exports a principal's session keys as versioned JSON for backup or audit.
 * Signing identities are reduced to their address; key handles are never exported.
 */
@Singleton
public class SessionKeyExporter {

  /**
   * Export format version.
   */
  public static final int EXPORT_VERSION = 1;

  private final SessionKeyRegistry registry;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Instantiates a new Session key exporter.
   *
   * @param registry the registry
   * @param clock    the clock
   */
  @Inject
  public SessionKeyExporter(SessionKeyRegistry registry, Clock clock) {
    this(registry, ObjectMappers.sessionKeyMapper(), clock);
  }

  /**
   * Instantiates a new Session key exporter.
   *
   * @param registry     the registry
   * @param objectMapper the object mapper
   * @param clock        the clock
   */
  public SessionKeyExporter(SessionKeyRegistry registry, ObjectMapper objectMapper, Clock clock) {
    this.registry = registry;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Builds the export document.
   *
   * @param principal the principal
   * @return the export
   */
  public Export exportOf(String principal) {
    Instant now = clock.instant();
    List<ExportedKey> keys = registry.find(principal, SessionKeyFilter.all()).stream()
        .map(state -> new ExportedKey(state.id(), state.identity().address(), state.statusAt(now),
            state.config(), state.usage(), state.revokedAt(), state.revokedReason()))
        .toList();
    return new Export(EXPORT_VERSION, principal, now, keys);
  }

  /**
   * Exports as JSON.
   *
   * @param principal the principal
   * @return the JSON document
   */
  public String export(String principal) {
    try {
      return objectMapper.writeValueAsString(exportOf(principal));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Failed to export session keys for " + principal, e);
    }
  }

  /**
   * Export document.
   *
   * @param version    the format version
   * @param principal  the principal
   * @param exportedAt when the export was taken
   * @param keys       the keys, newest first
   */
  public record Export(int version, String principal, Instant exportedAt, List<ExportedKey> keys) {
  }

  /**
   * One exported key.
   *
   * @param id            the id
   * @param address       the session address
   * @param status        the status at export time
   * @param config        the policy
   * @param usage         the ledger
   * @param revokedAt     revocation instant, if revoked
   * @param revokedReason revocation reason, if revoked
   */
  public record ExportedKey(String id, String address, SessionKeyStatus status, SessionKeyConfig config,
                            List<SessionKeyUsage> usage, Instant revokedAt, String revokedReason) {
  }
}
