package com.codeheadsystems.sessionkey.client.signer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.sessionkey.client.accessor.RelayAccessor;
import com.codeheadsystems.sessionkey.client.exceptions.RelayAccessorException;
import com.codeheadsystems.sessionkey.gateway.SubmissionReceipt;
import com.codeheadsystems.sessionkey.gateway.SubmissionStatus;
import com.codeheadsystems.sessionkey.gateway.TransactionSubmissionException;
import com.codeheadsystems.sessionkey.keys.ActionDigest;
import com.codeheadsystems.sessionkey.keys.Secp256k1KeyMaterialProvider;
import com.codeheadsystems.sessionkey.model.ProposedAction;
import com.codeheadsystems.sessionkey.model.SessionIdentity;
import com.codeheadsystems.sessionkey.model.relay.RelayTransactionRequest;
import com.codeheadsystems.sessionkey.model.relay.RelayTransactionResponse;
import java.math.BigInteger;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RelayTransactionSignerTest {

  private static final String CONTRACT = "0x00000000000000000000000000000000000000aa";
  private static final ProposedAction ACTION = new ProposedAction(CONTRACT, "transfer",
      BigInteger.valueOf(250), new byte[]{0x01, 0x02}, BigInteger.valueOf(21000));

  @Mock private RelayAccessor relayAccessor;

  private Secp256k1KeyMaterialProvider keys;
  private SessionIdentity identity;
  private RelayTransactionSigner signer;

  @BeforeEach
  void setUp() {
    keys = new Secp256k1KeyMaterialProvider();
    identity = keys.generateIdentity();
    signer = new RelayTransactionSigner(keys, relayAccessor);
  }

  @Test
  void submit_signsDigestAndForwardsToRelay() throws Exception {
    when(relayAccessor.submit(any(RelayTransactionRequest.class)))
        .thenReturn(new RelayTransactionResponse("0xfeed", "submitted"));

    SubmissionReceipt receipt = signer.submit(identity, ACTION);

    assertThat(receipt.transactionReference()).isEqualTo("0xfeed");
    assertThat(receipt.status()).isEqualTo(SubmissionStatus.SUBMITTED);

    ArgumentCaptor<RelayTransactionRequest> captor = ArgumentCaptor.forClass(RelayTransactionRequest.class);
    verify(relayAccessor).submit(captor.capture());
    RelayTransactionRequest sent = captor.getValue();
    assertThat(sent.sessionAddress()).isEqualTo(identity.address());
    assertThat(sent.targetContract()).isEqualTo(CONTRACT);
    assertThat(sent.methodName()).isEqualTo("transfer");
    assertThat(sent.amount()).isEqualTo("250");
    assertThat(sent.gasLimit()).isEqualTo("21000");
    assertThat(sent.payloadHex()).isEqualTo("0x0102");
    assertThat(sent.digestHex()).isEqualTo("0x" + Hex.toHexString(ActionDigest.of(identity, ACTION)));
    assertThat(sent.signatureHex()).startsWith("0x").hasSize(2 + 128);
  }

  @Test
  void submit_confirmedStatus_isPassedThrough() throws Exception {
    when(relayAccessor.submit(any(RelayTransactionRequest.class)))
        .thenReturn(new RelayTransactionResponse("0xfeed", "CONFIRMED"));

    assertThat(signer.submit(identity, ACTION).status()).isEqualTo(SubmissionStatus.CONFIRMED);
  }

  @Test
  void submit_missingStatus_defaultsToSubmitted() throws Exception {
    when(relayAccessor.submit(any(RelayTransactionRequest.class)))
        .thenReturn(new RelayTransactionResponse("0xfeed", null));

    assertThat(signer.submit(identity, ACTION).status()).isEqualTo(SubmissionStatus.SUBMITTED);
  }

  @Test
  void submit_unknownStatus_fails() {
    when(relayAccessor.submit(any(RelayTransactionRequest.class)))
        .thenReturn(new RelayTransactionResponse("0xfeed", "PENDING_FOREVER"));

    assertThatThrownBy(() -> signer.submit(identity, ACTION))
        .isInstanceOf(TransactionSubmissionException.class)
        .hasMessageContaining("PENDING_FOREVER");
  }

  @Test
  void submit_missingHash_fails() {
    when(relayAccessor.submit(any(RelayTransactionRequest.class)))
        .thenReturn(new RelayTransactionResponse(" ", "SUBMITTED"));

    assertThatThrownBy(() -> signer.submit(identity, ACTION))
        .isInstanceOf(TransactionSubmissionException.class)
        .hasMessageContaining("no transaction hash");
  }

  @Test
  void submit_relayFailure_becomesSubmissionException() {
    RelayAccessorException failure = new RelayAccessorException("down", null);
    when(relayAccessor.submit(any(RelayTransactionRequest.class))).thenThrow(failure);

    assertThatThrownBy(() -> signer.submit(identity, ACTION))
        .isInstanceOf(TransactionSubmissionException.class)
        .hasCause(failure);
  }

  @Test
  void submit_relayRejectsCaller_becomesSubmissionException() {
    when(relayAccessor.submit(any(RelayTransactionRequest.class)))
        .thenThrow(new SecurityException("401"));

    assertThatThrownBy(() -> signer.submit(identity, ACTION))
        .isInstanceOf(TransactionSubmissionException.class)
        .hasCauseInstanceOf(SecurityException.class);
  }

  @Test
  void submit_destroyedKey_failsWithoutCallingRelay() {
    keys.destroy(identity);

    assertThatThrownBy(() -> signer.submit(identity, ACTION))
        .isInstanceOf(TransactionSubmissionException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
    verifyNoInteractions(relayAccessor);
  }
}
