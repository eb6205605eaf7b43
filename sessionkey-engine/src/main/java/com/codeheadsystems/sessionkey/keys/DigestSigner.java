package com.codeheadsystems.sessionkey.keys;

import com.codeheadsystems.sessionkey.model.SessionIdentity;

/**
 * Signs 32-byte digests with the private key held for an identity.
 */
public interface DigestSigner {

  /**
   * Signs a digest.
   *
   * @param identity the identity whose key signs
   * @param digest   a 32-byte digest
   * @return the 64-byte signature r || s
   * @throws IllegalStateException    if no key is held for the identity
   * @throws IllegalArgumentException if the digest is not 32 bytes
   */
  byte[] sign(SessionIdentity identity, byte[] digest);

  /**
   * Releases the key held for an identity. Unknown handles are ignored.
   *
   * @param identity the identity
   */
  void destroy(SessionIdentity identity);
}
