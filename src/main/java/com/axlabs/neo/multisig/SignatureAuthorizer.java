package com.axlabs.neo.multisig;

import io.neow3j.crypto.ECKeyPair.ECPublicKey;
import io.neow3j.crypto.Sign;
import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SignatureException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Lets a signer vote without submitting the call themselves.
 * <p>
 * A vote signature is accepted if the key recovered from it belongs to the claimed voter, or, for signers that are
 * not key holders, if the {@link SignatureValidator} deployed at the voter's address accepts it. Each signer has a
 * nonce that is bound into the signed digest and incremented with every accepted signature, so a signature can only
 * be used once.
 */
public class SignatureAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(SignatureAuthorizer.class);

    /**
     * Length of a recoverable signature: 32 bytes r, 32 bytes s and the recovery byte v.
     */
    public static final int SIGNATURE_LENGTH = 65;

    private final Map<Hash160, Long> nonces = new HashMap<>();
    private final SignerRegistry signers;
    private final ContractRegistry contracts;
    private final DomainInfo domain;

    SignatureAuthorizer(SignerRegistry signers, ContractRegistry contracts, DomainInfo domain) {
        this.signers = signers;
        this.contracts = contracts;
        this.domain = domain;
    }

    /**
     * Verifies the signature of {@code voter} on the vote and consumes the voter's nonce.
     * <p>
     * The nonce is consumed even if the vote is rejected by the ledger afterwards. It is only left untouched if the
     * signature is rejected.
     *
     * @param proposalId The proposal voted on.
     * @param support    True for a yes-vote, false for retracting one.
     * @param voter      The signer that supposedly signed.
     * @param signature  The signature.
     * @param journal    The journal of the current call.
     */
    void authorize(int proposalId, boolean support, Hash160 voter, byte[] signature, CallJournal journal) {
        String method = "MultiSigWallet.voteOnBehalfOf";
        if (!signers.isSigner(voter)) throw new AuthorizationException(method, "Not authorised");
        if (signature == null) throw new InvalidSignatureException(method, "Invalid signature");

        long nonce = getNonce(voter);
        byte[] digest = domain.voteDigest(proposalId, support, nonce);
        if (!recoversTo(digest, signature, voter) && !isAcceptedByValidator(digest, signature, voter)) {
            log.debug("Rejected vote signature of {} on proposal {} with nonce {}", voter, proposalId, nonce);
            throw new InvalidSignatureException(method, "Invalid signature");
        }

        nonces.put(voter, nonce + 1);
        journal.onEnclosingRollback(() -> nonces.put(voter, nonce));
    }

    long getNonce(Hash160 identity) {
        return nonces.getOrDefault(identity, 0L);
    }

    DomainInfo getDomain() {
        return domain;
    }

    private boolean recoversTo(byte[] digest, byte[] signature, Hash160 voter) {
        if (signature.length != SIGNATURE_LENGTH) {
            return false;
        }
        Sign.SignatureData signatureData = new Sign.SignatureData(signature[64],
                Arrays.copyOfRange(signature, 0, 32), Arrays.copyOfRange(signature, 32, 64));
        try {
            ECPublicKey key = Sign.signedMessageToKey(digest, signatureData);
            return Hash160.fromPublicKey(key.getEncoded(true)).equals(voter);
        } catch (SignatureException | RuntimeException e) {
            log.debug("No key recoverable from signature for {}: {}", voter, e.getMessage());
            return false;
        }
    }

    private boolean isAcceptedByValidator(byte[] digest, byte[] signature, Hash160 voter) {
        SignatureValidator validator = contracts.getSignatureValidator(voter);
        if (validator == null) {
            return false;
        }
        try {
            return validator.isValidSignature(digest.clone(), signature.clone());
        } catch (Exception e) {
            log.debug("Signature validator of {} failed: {}", voter, e.toString());
            return false;
        }
    }
}
