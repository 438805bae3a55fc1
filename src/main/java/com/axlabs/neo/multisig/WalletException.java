package com.axlabs.neo.multisig;

/**
 * Base of all errors raised by a wallet call. A call that raises one of these leaves no observable state behind,
 * with the single exception of a consumed signature nonce (see {@link SignatureAuthorizer}).
 */
public class WalletException extends RuntimeException {

    private final String method;
    private final String reason;

    public WalletException(String method, String reason) {
        this(method, reason, null);
    }

    public WalletException(String method, String reason, Throwable cause) {
        super("[" + method + "] " + reason, cause);
        this.method = method;
        this.reason = reason;
    }

    /**
     * @return the operation that rejected the call, e.g. {@code MultiSigWallet.execute}.
     */
    public String getMethod() {
        return method;
    }

    /**
     * @return the rejection reason without the operation prefix.
     */
    public String getReason() {
        return reason;
    }
}
