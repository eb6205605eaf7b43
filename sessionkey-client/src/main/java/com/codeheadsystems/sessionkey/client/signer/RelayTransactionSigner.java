package com.codeheadsystems.sessionkey.client.signer;

import com.codeheadsystems.sessionkey.client.accessor.RelayAccessor;
import com.codeheadsystems.sessionkey.client.exceptions.RelayAccessorException;
import com.codeheadsystems.sessionkey.gateway.SubmissionReceipt;
import com.codeheadsystems.sessionkey.gateway.SubmissionStatus;
import com.codeheadsystems.sessionkey.gateway.TransactionSigner;
import com.codeheadsystems.sessionkey.gateway.TransactionSubmissionException;
import com.codeheadsystems.sessionkey.keys.ActionDigest;
import com.codeheadsystems.sessionkey.keys.DigestSigner;
import com.codeheadsystems.sessionkey.model.ProposedAction;
import com.codeheadsystems.sessionkey.model.SessionIdentity;
import com.codeheadsystems.sessionkey.model.api.Amounts;
import com.codeheadsystems.sessionkey.model.relay.RelayTransactionRequest;
import com.codeheadsystems.sessionkey.model.relay.RelayTransactionResponse;
import java.util.Locale;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TransactionSigner} that signs the action digest with the session key and hands the
 * signed action to a relay, which builds, pays for and broadcasts the transaction.
 * <p>
 * Every failure, including an unusable relay answer, is reported as a
 * {@link TransactionSubmissionException} so the gateway releases the reserved quota.
 */
@Singleton
public class RelayTransactionSigner implements TransactionSigner {
  private static final Logger log = LoggerFactory.getLogger(RelayTransactionSigner.class);

  private final DigestSigner digestSigner;
  private final RelayAccessor relayAccessor;

  /**
   * Instantiates a new Relay transaction signer.
   *
   * @param digestSigner  holds the session private keys
   * @param relayAccessor the relay accessor
   */
  @Inject
  public RelayTransactionSigner(final DigestSigner digestSigner, final RelayAccessor relayAccessor) {
    this.digestSigner = digestSigner;
    this.relayAccessor = relayAccessor;
  }

  @Override
  public SubmissionReceipt submit(final SessionIdentity identity, final ProposedAction action)
      throws TransactionSubmissionException {
    final RelayTransactionResponse response;
    try {
      final byte[] digest = ActionDigest.of(identity, action);
      final byte[] signature = digestSigner.sign(identity, digest);
      response = relayAccessor.submit(new RelayTransactionRequest(
          identity.address(),
          action.targetContract(),
          action.methodName(),
          Amounts.format(action.amount()),
          "0x" + Hex.toHexString(action.payload()),
          Amounts.format(action.gasLimit()),
          "0x" + Hex.toHexString(digest),
          "0x" + Hex.toHexString(signature)));
    } catch (RelayAccessorException | SecurityException | IllegalStateException | IllegalArgumentException e) {
      throw new TransactionSubmissionException("Relay submission failed for " + identity.address(), e);
    }
    if (response == null || response.transactionHash() == null || response.transactionHash().isBlank()) {
      throw new TransactionSubmissionException("Relay returned no transaction hash for " + identity.address());
    }
    final SubmissionStatus status = parseStatus(response.status());
    log.debug("submit({}): {} {}", identity.address(), response.transactionHash(), status);
    return new SubmissionReceipt(response.transactionHash(), status);
  }

  private static SubmissionStatus parseStatus(final String status) throws TransactionSubmissionException {
    if (status == null || status.isBlank()) {
      return SubmissionStatus.SUBMITTED;
    }
    try {
      return SubmissionStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new TransactionSubmissionException("Relay returned unknown status " + status, e);
    }
  }
}
