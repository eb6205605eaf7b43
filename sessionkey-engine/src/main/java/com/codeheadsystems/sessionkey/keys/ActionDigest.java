package com.codeheadsystems.sessionkey.keys;

import com.codeheadsystems.sessionkey.model.ProposedAction;
import com.codeheadsystems.sessionkey.model.SessionIdentity;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.util.BigIntegers;
import org.bouncycastle.util.Pack;
import org.bouncycastle.util.encoders.Hex;

/**
 * Digest a session key signs to authorize one action:
 * keccak256(sessionAddress || targetContract || len(methodName) || methodName || amount as 32 bytes || payload).
 * Addresses enter as their 20 raw bytes. The method name is UTF-8 behind a 4-byte big-endian length,
 * so no two distinct actions share an encoding.
 */
public final class ActionDigest {

  private ActionDigest() {
  }

  /**
   * Computes the digest.
   *
   * @param identity the signing identity
   * @param action   the action
   * @return the 32-byte digest
   */
  public static byte[] of(SessionIdentity identity, ProposedAction action) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(addressBytes(identity.address()));
    out.writeBytes(addressBytes(action.targetContract()));
    byte[] method = action.methodName().getBytes(StandardCharsets.UTF_8);
    out.writeBytes(Pack.intToBigEndian(method.length));
    out.writeBytes(method);
    out.writeBytes(BigIntegers.asUnsignedByteArray(32, action.amount()));
    out.writeBytes(action.payload());
    return Secp256k1KeyMaterialProvider.keccak256(out.toByteArray());
  }

  private static byte[] addressBytes(String address) {
    String hex = address.trim();
    if (hex.startsWith("0x") || hex.startsWith("0X")) {
      hex = hex.substring(2);
    }
    if (hex.length() != 40) {
      throw new IllegalArgumentException("Not a 20-byte address: " + address);
    }
    return Hex.decode(hex);
  }
}
