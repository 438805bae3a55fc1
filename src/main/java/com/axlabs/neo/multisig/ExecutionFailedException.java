package com.axlabs.neo.multisig;

/**
 * One operation of a proposal's batch failed. The whole execution call was rolled back.
 */
public class ExecutionFailedException extends WalletException {

    private final int proposalId;
    private final int operationIndex;

    public ExecutionFailedException(String method, int proposalId, int operationIndex, String reason,
            Throwable cause) {
        super(method, "Operation " + operationIndex + " of proposal " + proposalId + " failed: " + reason, cause);
        this.proposalId = proposalId;
        this.operationIndex = operationIndex;
    }

    public int getProposalId() {
        return proposalId;
    }

    /**
     * @return the position of the failing operation in the proposal's batch.
     */
    public int getOperationIndex() {
        return operationIndex;
    }
}
