package com.axlabs.neo.multisig;

import java.math.BigInteger;

/**
 * A contract that proposal operations can be addressed to.
 * <p>
 * Implementations that change their own state have to register an undo action with
 * {@link CallContext#onRollback(Runnable)}; otherwise a failure of a later operation in the same batch cannot revert
 * the change.
 */
@FunctionalInterface
public interface CallTarget {

    /**
     * @param context The executing wallet and the rollback hook.
     * @param value   The operation's value.
     * @param data    The operation's payload.
     * @return the value returned to the executing wallet.
     * @throws Exception if the operation fails. Any exception aborts the whole batch.
     */
    Object call(CallContext context, BigInteger value, byte[] data) throws Exception;
}
