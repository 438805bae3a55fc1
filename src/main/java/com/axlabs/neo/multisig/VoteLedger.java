package com.axlabs.neo.multisig;

import io.neow3j.types.Hash160;

import java.util.List;

import static com.axlabs.neo.multisig.MultiSigWallet.VOTED;
import static com.axlabs.neo.multisig.MultiSigWallet.VOTE_RETRACTED;

/**
 * Records the yes-votes on proposals.
 * <p>
 * The history of a proposal holds everyone who voted yes and did not retract, whether or not they are still a
 * signer. Only the yes-votes of current signers count towards the majority, and that count is derived from the
 * history on every request. Removing a signer therefore needs no cleanup, and a signer who is added back gets their
 * earlier votes back.
 */
public class VoteLedger {

    private final SignerRegistry signers;
    private final BlockTime time;

    VoteLedger(SignerRegistry signers, BlockTime time) {
        this.signers = signers;
        this.time = time;
    }

    void castYes(Proposal proposal, Hash160 voter, CallJournal journal, String method) {
        if (proposal.getStatus() != ProposalStatus.PROPOSED) {
            throw new ProposalStateException(method, "Proposal not active");
        }
        if (proposal.isExpiredAt(time.getTime())) throw new ProposalStateException(method, "Proposal expired");
        IdentitySet yesVoters = proposal.getYesVoters();
        if (yesVoters.contains(voter)) throw new ProposalStateException(method, "Already voted on this proposal");

        yesVoters.add(voter);
        journal.onRollback(() -> yesVoters.remove(voter));
        journal.notify(VOTED, proposal.getId(), voter);
    }

    void retractYes(Proposal proposal, Hash160 voter, CallJournal journal, String method) {
        if (proposal.getStatus() != ProposalStatus.PROPOSED) {
            throw new ProposalStateException(method, "Proposal not active");
        }
        IdentitySet yesVoters = proposal.getYesVoters();
        if (!yesVoters.contains(voter)) throw new ProposalStateException(method, "Not voted on this proposal");

        yesVoters.remove(voter);
        journal.onRollback(() -> yesVoters.add(voter));
        journal.notify(VOTE_RETRACTED, proposal.getId(), voter);
    }

    boolean hasVotedYes(Proposal proposal, Hash160 voter) {
        return voter != null && proposal.getYesVoters().contains(voter);
    }

    List<Hash160> yesVoterHistory(Proposal proposal) {
        return proposal.getYesVoters().toList();
    }

    /**
     * @return the number of historical yes-voters that are signers right now.
     */
    int validYesCount(Proposal proposal) {
        int count = 0;
        for (Hash160 voter : proposal.getYesVoters().toList()) {
            if (signers.isSigner(voter)) {
                count++;
            }
        }
        return count;
    }
}
