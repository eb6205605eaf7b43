package com.codeheadsystems.sessionkey.model;

/**
 * The ephemeral signing identity behind a session key.
 * <p>
 * Only public values live here. {@code keyHandle} is an opaque reference into the
 * {@code KeyMaterialProvider} that holds the private key; the engine never sees key material.
 *
 * @param address      hex account address derived from the public key
 * @param publicKeyHex uncompressed SEC1 public key, hex encoded
 * @param keyHandle    opaque custody handle for the private key
 */
public record SessionIdentity(String address, String publicKeyHex, String keyHandle) {

  @Override
  public String toString() {
    return "SessionIdentity[address=" + address + "]";
  }
}
