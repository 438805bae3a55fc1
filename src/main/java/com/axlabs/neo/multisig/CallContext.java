package com.axlabs.neo.multisig;

import io.neow3j.types.Hash160;

/**
 * What a {@link CallTarget} gets to know about the execution that calls it.
 */
public final class CallContext {

    private final Hash160 caller;
    private final int proposalId;
    private final CallJournal journal;

    CallContext(Hash160 caller, int proposalId, CallJournal journal) {
        this.caller = caller;
        this.proposalId = proposalId;
        this.journal = journal;
    }

    /**
     * @return the address of the executing wallet.
     */
    public Hash160 getCaller() {
        return caller;
    }

    public int getProposalId() {
        return proposalId;
    }

    /**
     * Registers how to undo a change the target made. Undo actions run in reverse registration order if any
     * operation of the same batch fails.
     *
     * @param undo The action reverting the change.
     */
    public void onRollback(Runnable undo) {
        journal.onRollback(undo);
    }
}
