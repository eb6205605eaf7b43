package com.codeheadsystems.sessionkey.keys;

import java.math.BigInteger;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;

/**
 * Domain parameters of the curve session keys live on.
 *
 * @param params the domain parameters
 * @param curve  the curve
 * @param g      the generator
 * @param n      the group order
 * @param h      the cofactor
 */
public record Curve(ECDomainParameters params, ECCurve curve, ECPoint g, BigInteger n, BigInteger h) {

  /**
   * The secp256k1 curve used by Ethereum accounts.
   */
  public static final Curve SECP256K1_CURVE = loadCurve("secp256k1");

  /**
   * Instantiates a new Curve.
   *
   * @param params the params
   */
  public Curve(ECDomainParameters params) {
    this(params, params.getCurve(), params.getG(), params.getN(), params.getH());
  }

  private static Curve loadCurve(String name) {
    X9ECParameters params = CustomNamedCurves.getByName(name);
    if (params == null) {
      throw new IllegalArgumentException("Unsupported curve: " + name);
    }
    return new Curve(new ECDomainParameters(params.getCurve(), params.getG(), params.getN(), params.getH()));
  }

  /**
   * Half the group order; signatures with s above it are normalized.
   *
   * @return the big integer
   */
  public BigInteger halfOrder() {
    return n.shiftRight(1);
  }
}
