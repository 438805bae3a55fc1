package com.axlabs.neo.multisig;

/**
 * The proposal is in the wrong status for the requested action, is expired, or lacks the votes to be executed.
 */
public class ProposalStateException extends WalletException {

    public ProposalStateException(String method, String reason) {
        super(method, reason);
    }
}
