package com.codeheadsystems.sessionkey.keys;

import com.codeheadsystems.sessionkey.model.SessionIdentity;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.digests.KeccakDigest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.ECKeyPairGenerator;
import org.bouncycastle.crypto.params.ECKeyGenerationParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.BigIntegers;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates secp256k1 session identities and keeps their private keys in process memory.
 * <p>
 * The address is the Ethereum account address of the key: the last 20 bytes of the Keccak-256
 * hash of the uncompressed public point without its 0x04 prefix. Signatures are deterministic
 * (RFC 6979) and normalized to low s.
 * <p>
 * Custody is in memory only, so keys do not survive a restart; a reloaded session key keeps its
 * address but can no longer sign until a provider that holds its handle is configured.
 */
@Singleton
public class Secp256k1KeyMaterialProvider implements KeyMaterialProvider, DigestSigner {

  private static final Logger log = LoggerFactory.getLogger(Secp256k1KeyMaterialProvider.class);

  private final Curve curve;
  private final SecureRandom random;
  private final Map<String, BigInteger> custody = new ConcurrentHashMap<>();

  /**
   * Instantiates a new provider with a fresh {@link SecureRandom}.
   */
  @Inject
  public Secp256k1KeyMaterialProvider() {
    this(new SecureRandom());
  }

  /**
   * Instantiates a new provider.
   *
   * @param random the random source
   */
  public Secp256k1KeyMaterialProvider(SecureRandom random) {
    this.curve = Curve.SECP256K1_CURVE;
    this.random = random;
  }

  @Override
  public SessionIdentity generateIdentity() {
    ECKeyPairGenerator generator = new ECKeyPairGenerator();
    generator.init(new ECKeyGenerationParameters(curve.params(), random));
    AsymmetricCipherKeyPair pair = generator.generateKeyPair();
    BigInteger privateKey = ((ECPrivateKeyParameters) pair.getPrivate()).getD();
    ECPoint publicPoint = ((ECPublicKeyParameters) pair.getPublic()).getQ().normalize();

    byte[] uncompressed = publicPoint.getEncoded(false);
    String address = addressOf(uncompressed);
    String handle = UUID.randomUUID().toString();
    custody.put(handle, privateKey);
    log.debug("generateIdentity(): {}", address);
    return new SessionIdentity(address, "0x" + Hex.toHexString(uncompressed), handle);
  }

  @Override
  public byte[] sign(SessionIdentity identity, byte[] digest) {
    if (digest == null || digest.length != 32) {
      throw new IllegalArgumentException("digest must be 32 bytes");
    }
    BigInteger privateKey = custody.get(identity.keyHandle());
    if (privateKey == null) {
      throw new IllegalStateException("No key material held for " + identity.address());
    }
    ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
    signer.init(true, new ECPrivateKeyParameters(privateKey, curve.params()));
    BigInteger[] rs = signer.generateSignature(digest);
    BigInteger s = rs[1];
    if (s.compareTo(curve.halfOrder()) > 0) {
      s = curve.n().subtract(s);
    }
    byte[] signature = new byte[64];
    System.arraycopy(BigIntegers.asUnsignedByteArray(32, rs[0]), 0, signature, 0, 32);
    System.arraycopy(BigIntegers.asUnsignedByteArray(32, s), 0, signature, 32, 32);
    return signature;
  }

  @Override
  public void destroy(SessionIdentity identity) {
    if (custody.remove(identity.keyHandle()) != null) {
      log.debug("destroy(): {}", identity.address());
    }
  }

  /**
   * Whether this provider holds the key for an identity.
   *
   * @param identity the identity
   * @return the boolean
   */
  public boolean holds(SessionIdentity identity) {
    return custody.containsKey(identity.keyHandle());
  }

  /**
   * Derives the account address of an uncompressed public key.
   *
   * @param uncompressedPublicKey 65 bytes starting with 0x04
   * @return the lower case 0x-prefixed address
   */
  public static String addressOf(byte[] uncompressedPublicKey) {
    if (uncompressedPublicKey.length != 65 || uncompressedPublicKey[0] != 0x04) {
      throw new IllegalArgumentException("Expected a 65-byte uncompressed public key");
    }
    byte[] hash = keccak256(Arrays.copyOfRange(uncompressedPublicKey, 1, 65));
    return "0x" + Hex.toHexString(Arrays.copyOfRange(hash, 12, 32));
  }

  /**
   * Keccak-256 (the pre-standard SHA-3 padding Ethereum uses).
   *
   * @param input the input
   * @return the 32-byte hash
   */
  public static byte[] keccak256(byte[] input) {
    KeccakDigest digest = new KeccakDigest(256);
    digest.update(input, 0, input.length);
    byte[] out = new byte[32];
    digest.doFinal(out, 0);
    return out;
  }
}
