package com.axlabs.neo.multisig;

/**
 * Source of the current time in milliseconds, the equivalent of the block timestamp a call is processed in.
 */
@FunctionalInterface
public interface BlockTime {

    long getTime();

    static BlockTime system() {
        return System::currentTimeMillis;
    }
}
