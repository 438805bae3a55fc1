package com.axlabs.neo.multisig;

/**
 * Malformed input rejected at the boundary, e.g. an empty batch or a signer set bound violation.
 */
public class ValidationException extends WalletException {

    public ValidationException(String method, String reason) {
        super(method, reason);
    }
}
