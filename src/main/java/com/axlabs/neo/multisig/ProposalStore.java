package com.axlabs.neo.multisig;

import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.axlabs.neo.multisig.MultiSigWallet.PROPOSAL_CANCELLED;
import static com.axlabs.neo.multisig.MultiSigWallet.PROPOSAL_CREATED;

/**
 * Creates proposals and moves them between statuses. Proposal ids start at 0 and are never reused.
 */
public class ProposalStore {

    private static final Logger log = LoggerFactory.getLogger(ProposalStore.class);

    private final List<Proposal> proposals = new ArrayList<>();
    private final SignerRegistry signers;
    private final VoteLedger ledger;
    private final BlockTime time;

    ProposalStore(SignerRegistry signers, VoteLedger ledger, BlockTime time) {
        this.signers = signers;
        this.ledger = ledger;
        this.time = time;
    }

    /**
     * Creates a proposal and casts the proposer's yes-vote on it.
     *
     * @param proposer   The signer creating the proposal.
     * @param operations The operations to be executed when the proposal is accepted.
     * @param expiration The time in milliseconds after which the proposal can no longer be voted on or executed.
     * @param journal    The journal of the current call.
     * @return the new proposal.
     */
    Proposal create(Hash160 proposer, List<Operation> operations, long expiration, CallJournal journal) {
        String method = "MultiSigWallet.propose";
        if (!signers.isSigner(proposer)) throw new AuthorizationException(method, "Not authorised");
        if (operations == null || operations.isEmpty()) throw new ValidationException(method, "No operations");
        for (Operation operation : operations) {
            if (operation == null || !operation.isValid()) throw new ValidationException(method, "Invalid operations");
        }
        if (expiration <= time.getTime()) throw new ValidationException(method, "Expiration not in the future");

        int id = proposals.size();
        Proposal proposal = new Proposal(id, proposer, expiration, new ArrayList<>(operations));
        proposals.add(proposal);
        journal.onRollback(() -> proposals.remove(proposals.size() - 1));
        journal.notify(PROPOSAL_CREATED, id, proposer, expiration);
        ledger.castYes(proposal, proposer, journal, method);
        log.info("Proposal {} created by {} with {} operations", id, proposer, operations.size());
        return proposal;
    }

    /**
     * Cancels a proposal.
     *
     * @param proposal   The proposal.
     * @param caller     The account asking for the cancellation. Ignored if {@code governance} is set.
     * @param governance Whether the call comes from the wallet's execution path.
     * @param journal    The journal of the current call.
     */
    void cancel(Proposal proposal, Hash160 caller, boolean governance, CallJournal journal) {
        String method = "MultiSigWallet.cancelProposal";
        if (proposal.getStatus() != ProposalStatus.PROPOSED) {
            throw new ProposalStateException(method, "Proposal not active");
        }
        // A proposer that was removed from the signers loses the right to cancel.
        boolean isProposer = proposal.getProposer().equals(caller) && signers.isSigner(caller);
        if (!governance && !isProposer) throw new AuthorizationException(method, "Not authorised");

        proposal.setStatus(ProposalStatus.CANCELLED);
        journal.onRollback(() -> proposal.setStatus(ProposalStatus.PROPOSED));
        journal.notify(PROPOSAL_CANCELLED, proposal.getId());
        log.info("Proposal {} cancelled{}", proposal.getId(), governance ? " by governance" : "");
    }

    /**
     * @return the proposal or null if the id was never allocated.
     */
    Proposal get(int id) {
        if (id < 0 || id >= proposals.size()) {
            return null;
        }
        return proposals.get(id);
    }

    Proposal require(int id, String method) {
        Proposal proposal = get(id);
        if (proposal == null) throw new ProposalStateException(method, "Proposal doesn't exist");
        return proposal;
    }

    int count() {
        return proposals.size();
    }

    List<Proposal> all() {
        return proposals;
    }
}
