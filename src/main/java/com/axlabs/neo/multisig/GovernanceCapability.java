package com.axlabs.neo.multisig;

import io.neow3j.types.Hash160;

/**
 * Proof that a call is made by a wallet on behalf of one of its own accepted proposals. Only the wallet's
 * {@link GovernanceGuard} issues capabilities, and only while it executes a proposal. A capability is useless after
 * that execution ended and to any other wallet.
 */
public final class GovernanceCapability {

    private final Hash160 wallet;
    private final int proposalId;

    GovernanceCapability(Hash160 wallet, int proposalId) {
        this.wallet = wallet;
        this.proposalId = proposalId;
    }

    public Hash160 getWallet() {
        return wallet;
    }

    /**
     * @return the proposal whose execution this capability was issued for.
     */
    public int getProposalId() {
        return proposalId;
    }

    @Override
    public String toString() {
        return "GovernanceCapability{wallet=" + wallet + ", proposal=" + proposalId + "}";
    }
}
