package com.axlabs.neo.multisig;

import io.neow3j.types.Hash160;

import java.util.Collections;
import java.util.List;

/**
 * Used to return all proposal information as one structure in getter methods.
 */
public class ProposalDTO {

    public final int id;
    public final Hash160 proposer;
    public final long expiration;
    public final ProposalStatus status;
    public final List<Operation> operations;
    public final List<Hash160> yesVoters;

    ProposalDTO(int id, Hash160 proposer, long expiration, ProposalStatus status, List<Operation> operations,
            List<Hash160> yesVoters) {
        this.id = id;
        this.proposer = proposer;
        this.expiration = expiration;
        this.status = status;
        this.operations = operations;
        this.yesVoters = yesVoters;
    }

    static ProposalDTO of(Proposal proposal) {
        return new ProposalDTO(proposal.getId(), proposal.getProposer(), proposal.getExpiration(),
                proposal.getStatus(), proposal.getOperations(), proposal.getYesVoters().toList());
    }

    /**
     * @return the view of an id that was never allocated.
     */
    static ProposalDTO notStarted(int id) {
        return new ProposalDTO(id, null, 0, ProposalStatus.NOT_STARTED, Collections.emptyList(),
                Collections.emptyList());
    }
}
