package com.axlabs.neo.multisig;

/**
 * The caller is not a current signer, not the governance path, or not allowed to cancel a proposal.
 */
public class AuthorizationException extends WalletException {

    public AuthorizationException(String method, String reason) {
        super(method, reason);
    }
}
