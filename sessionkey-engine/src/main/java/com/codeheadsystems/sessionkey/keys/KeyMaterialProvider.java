package com.codeheadsystems.sessionkey.keys;

import com.codeheadsystems.sessionkey.model.SessionIdentity;

/**
 * Source of fresh signing identities for new session keys.
 * <p>
 * The engine only ever sees the {@link SessionIdentity}: an address plus an opaque handle.
 * Private key material stays with the provider.
 */
public interface KeyMaterialProvider {

  /**
   * Generates a new identity.
   *
   * @return the identity
   */
  SessionIdentity generateIdentity();
}
