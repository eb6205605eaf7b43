package com.codeheadsystems.sessionkey.keys;

import static com.codeheadsystems.sessionkey.testing.SessionKeys.CONTRACT;
import static com.codeheadsystems.sessionkey.testing.SessionKeys.METHOD;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.sessionkey.model.ProposedAction;
import com.codeheadsystems.sessionkey.model.SessionIdentity;
import java.math.BigInteger;
import java.util.Arrays;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type Secp 256 k 1 key material provider test.
 */
class Secp256k1KeyMaterialProviderTest {

  private Secp256k1KeyMaterialProvider provider;

  @BeforeEach
  void setUp() {
    provider = new Secp256k1KeyMaterialProvider();
  }

  @Test
  void keccak256_emptyInput_knownVector() {
    assertThat(Hex.toHexString(Secp256k1KeyMaterialProvider.keccak256(new byte[0])))
        .isEqualTo("c5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470");
  }

  @Test
  void addressOf_privateKeyOne_knownAddress() {
    byte[] generator = Curve.SECP256K1_CURVE.g().getEncoded(false);

    assertThat(Secp256k1KeyMaterialProvider.addressOf(generator))
        .isEqualTo("0x7e5f4552091a69125d5dfcb7b8c2659029395bdf");
  }

  @Test
  void generateIdentity_addressMatchesPublicKey() {
    SessionIdentity identity = provider.generateIdentity();

    assertThat(identity.address()).matches("0x[0-9a-f]{40}");
    assertThat(identity.publicKeyHex()).startsWith("0x04").hasSize(2 + 130);
    assertThat(Secp256k1KeyMaterialProvider.addressOf(Hex.decode(identity.publicKeyHex().substring(2))))
        .isEqualTo(identity.address());
    assertThat(identity.toString()).doesNotContain(identity.keyHandle());
    assertThat(provider.holds(identity)).isTrue();
  }

  @Test
  void generateIdentity_distinctEachTime() {
    assertThat(provider.generateIdentity().address()).isNotEqualTo(provider.generateIdentity().address());
  }

  @Test
  void sign_verifiesAgainstPublicKeyAndIsDeterministicLowS() {
    SessionIdentity identity = provider.generateIdentity();
    byte[] digest = ActionDigest.of(identity, ProposedAction.of(CONTRACT, METHOD, BigInteger.TEN));

    byte[] signature = provider.sign(identity, digest);

    assertThat(signature).hasSize(64);
    assertThat(provider.sign(identity, digest)).isEqualTo(signature);
    BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, 32));
    BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
    assertThat(s).isLessThanOrEqualTo(Curve.SECP256K1_CURVE.halfOrder());
    ECDSASigner verifier = new ECDSASigner();
    Curve curve = Curve.SECP256K1_CURVE;
    verifier.init(false, new ECPublicKeyParameters(
        curve.curve().decodePoint(Hex.decode(identity.publicKeyHex().substring(2))), curve.params()));
    assertThat(verifier.verifySignature(digest, r, s)).isTrue();
  }

  @Test
  void sign_destroyedKey_refused() {
    SessionIdentity identity = provider.generateIdentity();
    provider.destroy(identity);

    assertThatThrownBy(() -> provider.sign(identity, new byte[32])).isInstanceOf(IllegalStateException.class);
    assertThat(provider.holds(identity)).isFalse();
  }

  @Test
  void sign_wrongDigestLength_rejected() {
    SessionIdentity identity = provider.generateIdentity();

    assertThatThrownBy(() -> provider.sign(identity, new byte[31])).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void actionDigest_changesWithAmount() {
    SessionIdentity identity = provider.generateIdentity();

    assertThat(ActionDigest.of(identity, ProposedAction.of(CONTRACT, METHOD, BigInteger.ONE)))
        .hasSize(32)
        .isNotEqualTo(ActionDigest.of(identity, ProposedAction.of(CONTRACT, METHOD, BigInteger.TWO)));
  }

  @Test
  void actionDigest_methodBoundaryCannotShiftIntoPayload() {
    SessionIdentity identity = provider.generateIdentity();
    // Without a length on the method name both encode as "ab" 0x00 followed by 32 zero bytes.
    ProposedAction shortMethod = new ProposedAction(CONTRACT, "ab", BigInteger.ZERO, new byte[]{0}, null);
    ProposedAction longMethod = new ProposedAction(CONTRACT, "ab\u0000", BigInteger.ZERO, new byte[0], null);

    assertThat(ActionDigest.of(identity, shortMethod)).isNotEqualTo(ActionDigest.of(identity, longMethod));
  }
}
