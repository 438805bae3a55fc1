package com.axlabs.neo.multisig;

import io.neow3j.types.Hash160;

import java.util.Collections;
import java.util.List;

/**
 * The stored state of a proposal created by a signer.
 * <p>
 * Proposer, expiration and operations are fixed at creation. Only the status and, while the proposal is
 * {@link ProposalStatus#PROPOSED}, the yes-voters change afterwards.
 */
final class Proposal {

    /**
     * The proposal's ID. IDs are assigned incrementally.
     */
    private final int id;

    /**
     * The signer that created the proposal. Not re-validated, except when the proposer tries to cancel.
     */
    private final Hash160 proposer;

    /**
     * The time in milliseconds after which the proposal can neither be voted on nor executed.
     */
    private final long expiration;

    private final List<Operation> operations;

    /**
     * Everyone that voted yes and did not retract, including identities that are no longer signers.
     */
    private final IdentitySet yesVoters = new IdentitySet();

    private ProposalStatus status = ProposalStatus.PROPOSED;

    Proposal(int id, Hash160 proposer, long expiration, List<Operation> operations) {
        this.id = id;
        this.proposer = proposer;
        this.expiration = expiration;
        this.operations = Collections.unmodifiableList(operations);
    }

    int getId() {
        return id;
    }

    Hash160 getProposer() {
        return proposer;
    }

    long getExpiration() {
        return expiration;
    }

    List<Operation> getOperations() {
        return operations;
    }

    IdentitySet getYesVoters() {
        return yesVoters;
    }

    ProposalStatus getStatus() {
        return status;
    }

    void setStatus(ProposalStatus status) {
        this.status = status;
    }

    boolean isExpiredAt(long time) {
        return time > expiration;
    }
}
