package com.axlabs.neo.multisig;

/**
 * Status of a proposal. {@link #EXECUTED} and {@link #CANCELLED} are terminal. Expiration is not a status, it is
 * checked whenever a proposal is voted on or executed.
 */
public enum ProposalStatus {

    /**
     * Implicit status of ids that were never allocated.
     */
    NOT_STARTED,
    PROPOSED,
    EXECUTED,
    CANCELLED
}
