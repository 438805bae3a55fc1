package com.axlabs.neo.multisig;

import io.neow3j.types.Hash160;

import java.util.HashMap;
import java.util.Map;

/**
 * The contracts deployed at an address, i.e. the operation targets and signature validators wallets can call, and
 * the wallets themselves.
 */
public class ContractRegistry {

    private final Map<Hash160, Object> contracts = new HashMap<>();
    // The call in progress on the current thread. Calls into any wallet of this registry join it.
    private final ThreadLocal<CallJournal> activeJournal = new ThreadLocal<>();

    /**
     * Deploys {@code contract} at {@code address}.
     *
     * @param address  The contract's address.
     * @param contract The contract. Usually a {@link CallTarget}, a {@link SignatureValidator} or a wallet.
     * @throws IllegalArgumentException if there already is a contract at the address.
     */
    public synchronized void deploy(Hash160 address, Object contract) {
        if (address == null || contract == null) {
            throw new IllegalArgumentException("Address and contract must not be null");
        }
        if (contracts.containsKey(address)) {
            throw new IllegalArgumentException("Contract already exists at " + address);
        }
        contracts.put(address, contract);
    }

    public synchronized boolean contains(Hash160 address) {
        return contracts.containsKey(address);
    }

    public synchronized Object get(Hash160 address) {
        return contracts.get(address);
    }

    CallJournal getActiveJournal() {
        return activeJournal.get();
    }

    void setActiveJournal(CallJournal journal) {
        if (journal == null) {
            activeJournal.remove();
        } else {
            activeJournal.set(journal);
        }
    }

    /**
     * @return the call target at the address, or null if there is none.
     */
    public synchronized CallTarget getCallTarget(Hash160 address) {
        Object contract = contracts.get(address);
        return contract instanceof CallTarget ? (CallTarget) contract : null;
    }

    /**
     * @return the signature validator at the address, or null if there is none.
     */
    public synchronized SignatureValidator getSignatureValidator(Hash160 address) {
        Object contract = contracts.get(address);
        return contract instanceof SignatureValidator ? (SignatureValidator) contract : null;
    }
}
