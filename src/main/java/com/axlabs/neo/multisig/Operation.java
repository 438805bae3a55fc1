package com.axlabs.neo.multisig;

import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * Represents an action of a proposal. Proposals are made up of one or more operations that are executed in order once
 * the proposal is accepted.
 * <p>
 * An operation that targets the wallet's own address is a governance call (see {@link GovernanceCalls}). Any other
 * target is resolved in the {@link ContractRegistry} at execution time.
 */
public final class Operation {

    /**
     * The contract to be called.
     */
    private final Hash160 target;

    /**
     * The value handed to the target. Opaque to the wallet.
     */
    private final BigInteger value;

    /**
     * The payload handed to the target. Opaque to the wallet unless the target is the wallet itself.
     */
    private final byte[] data;

    public Operation(Hash160 target, BigInteger value, byte[] data) {
        this.target = target;
        this.value = value;
        this.data = data == null ? new byte[0] : data.clone();
    }

    public Operation(Hash160 target, byte[] data) {
        this(target, BigInteger.ZERO, data);
    }

    public Hash160 getTarget() {
        return target;
    }

    public BigInteger getValue() {
        return value;
    }

    public byte[] getData() {
        return data.clone();
    }

    boolean isValid() {
        return target != null && !Hash160.ZERO.equals(target) && value != null && value.signum() >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Operation)) return false;
        Operation that = (Operation) o;
        return Objects.equals(target, that.target) && Objects.equals(value, that.value)
                && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(target, value) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Operation{target=" + target + ", value=" + value + ", data=" + data.length + " bytes}";
    }
}
