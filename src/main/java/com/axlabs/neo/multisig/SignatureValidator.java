package com.axlabs.neo.multisig;

/**
 * Signature policy of a signer that does not hold a raw key, e.g. a contract or another wallet.
 */
@FunctionalInterface
public interface SignatureValidator {

    /**
     * @param digest    The vote digest that was signed.
     * @param signature The signature blob in whatever format the policy expects.
     * @return true if the policy accepts the signature for the digest.
     * @throws Exception on any failure. Callers treat it like a {@code false}.
     */
    boolean isValidSignature(byte[] digest, byte[] signature) throws Exception;
}
