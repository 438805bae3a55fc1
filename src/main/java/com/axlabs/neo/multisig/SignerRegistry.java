package com.axlabs.neo.multisig;

import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.axlabs.neo.multisig.MultiSigWallet.SIGNER_ADDED;
import static com.axlabs.neo.multisig.MultiSigWallet.SIGNER_REMOVED;

/**
 * The current set of signers of a wallet. Never empty and never larger than the configured maximum.
 * <p>
 * Mutations are only reachable through the wallet's governance path, i.e., through operations of an executed
 * proposal.
 */
public class SignerRegistry {

    private static final Logger log = LoggerFactory.getLogger(SignerRegistry.class);

    private final IdentitySet signers = new IdentitySet();
    private final int maxSigners;

    SignerRegistry(List<Hash160> initialSigners, int maxSigners) {
        this.maxSigners = maxSigners;
        if (initialSigners == null || initialSigners.isEmpty()) {
            throw new ValidationException("MultiSigWallet.deploy", "No signers given");
        }
        if (initialSigners.size() > maxSigners) {
            throw new ValidationException("MultiSigWallet.deploy", "Too many signers");
        }
        for (Hash160 signer : initialSigners) {
            if (!isValidIdentity(signer)) {
                throw new ValidationException("MultiSigWallet.deploy", "Invalid signer");
            }
            if (!signers.add(signer)) {
                throw new ValidationException("MultiSigWallet.deploy", "Duplicate signer " + signer);
            }
        }
    }

    public boolean isSigner(Hash160 identity) {
        return identity != null && signers.contains(identity);
    }

    /**
     * Returns the current signers.
     * <p>
     * The ordering of the returned list can change after a signer was removed.
     *
     * @return the signers.
     */
    public List<Hash160> list() {
        return signers.toList();
    }

    public int count() {
        return signers.size();
    }

    public int getMaxSigners() {
        return maxSigners;
    }

    void add(Hash160 signer, CallJournal journal) {
        String method = "MultiSigWallet.addSigner";
        if (!isValidIdentity(signer)) throw new ValidationException(method, "Invalid signer");
        if (signers.contains(signer)) throw new ValidationException(method, "Already a signer");
        if (signers.size() >= maxSigners) throw new ValidationException(method, "Maximum number of signers reached");

        signers.add(signer);
        journal.onRollback(() -> signers.remove(signer));
        journal.notify(SIGNER_ADDED, signer);
        log.info("Added signer {}, {} signers now", signer, signers.size());
    }

    void remove(Hash160 signer, CallJournal journal) {
        String method = "MultiSigWallet.removeSigner";
        if (signer == null || !signers.contains(signer)) throw new ValidationException(method, "Not a signer");
        if (signers.size() == 1) throw new ValidationException(method, "Cannot remove the last signer");

        signers.remove(signer);
        journal.onRollback(() -> signers.add(signer));
        journal.notify(SIGNER_REMOVED, signer);
        log.info("Removed signer {}, {} signers now", signer, signers.size());
    }

    private static boolean isValidIdentity(Hash160 identity) {
        return identity != null && !Hash160.ZERO.equals(identity);
    }
}
