package com.axlabs.neo.multisig;

/**
 * Neither key recovery nor delegated validation accepted a vote signature.
 */
public class InvalidSignatureException extends WalletException {

    public InvalidSignatureException(String method, String reason) {
        super(method, reason);
    }
}
