package com.axlabs.neo.multisig;

import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.axlabs.neo.multisig.MultiSigWallet.PROPOSAL_EXECUTED;

/**
 * Executes accepted proposals.
 * <p>
 * A proposal is accepted if more than half of the current signers are among its yes-voters. Both numbers are taken
 * at the time of execution. The operations of a proposal run all-or-nothing: if one fails, every change made during
 * the execution is reverted and the proposal stays {@link ProposalStatus#PROPOSED}.
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final MultiSigWallet wallet;
    private final ProposalStore proposals;
    private final VoteLedger ledger;
    private final SignerRegistry signers;
    private final ContractRegistry contracts;
    private final GovernanceGuard guard;
    private final BlockTime time;

    ExecutionEngine(MultiSigWallet wallet, ProposalStore proposals, VoteLedger ledger, SignerRegistry signers,
            ContractRegistry contracts, GovernanceGuard guard, BlockTime time) {
        this.wallet = wallet;
        this.proposals = proposals;
        this.ledger = ledger;
        this.signers = signers;
        this.contracts = contracts;
        this.guard = guard;
        this.time = time;
    }

    /**
     * Executes the proposal with the given {@code id}. Anyone can execute any proposal.
     *
     * @param id      The proposal id.
     * @param journal The journal of the current call. Rolling it back reverts the execution.
     * @return the values returned by the proposal's operations.
     */
    List<Object> execute(int id, CallJournal journal) {
        String method = "MultiSigWallet.execute";
        Proposal proposal = proposals.require(id, method);
        if (proposal.getStatus() == ProposalStatus.EXECUTED) {
            throw new ProposalStateException(method, "Proposal already executed");
        }
        if (proposal.getStatus() != ProposalStatus.PROPOSED) {
            throw new ProposalStateException(method, "Proposal not active");
        }
        if (proposal.isExpiredAt(time.getTime())) throw new ProposalStateException(method, "Proposal expired");
        int validYesCount = ledger.validYesCount(proposal);
        int signerCount = signers.count();
        if (validYesCount <= signerCount / 2) {
            throw new ProposalStateException(method, "Insufficient votes");
        }

        // The status is committed before any operation runs, so an operation calling back into execute fails.
        proposal.setStatus(ProposalStatus.EXECUTED);
        journal.onRollback(() -> proposal.setStatus(ProposalStatus.PROPOSED));

        List<Operation> operations = proposal.getOperations();
        List<Object> returnVals = new ArrayList<>(operations.size());
        GovernanceCapability capability = guard.issue(id);
        try {
            for (int i = 0; i < operations.size(); i++) {
                returnVals.add(run(id, i, operations.get(i), capability, journal));
            }
        } finally {
            guard.revoke(capability);
        }
        journal.notify(PROPOSAL_EXECUTED, id);
        log.info("Proposal {} executed with {} of {} signers in favour", id, validYesCount, signerCount);
        return returnVals;
    }

    private Object run(int id, int index, Operation operation, GovernanceCapability capability,
            CallJournal journal) {
        String method = "MultiSigWallet.execute";
        Hash160 target = operation.getTarget();
        if (target.equals(wallet.getAddress())) {
            try {
                return GovernanceCalls.dispatch(wallet, capability, operation.getData());
            } catch (Exception e) {
                throw new ExecutionFailedException(method, id, index, e.getMessage(), e);
            }
        }
        CallTarget callTarget = contracts.getCallTarget(target);
        if (callTarget == null) {
            throw new ExecutionFailedException(method, id, index, "Unknown target " + target, null);
        }
        try {
            return callTarget.call(new CallContext(wallet.getAddress(), id, journal), operation.getValue(),
                    operation.getData());
        } catch (Exception e) {
            throw new ExecutionFailedException(method, id, index, String.valueOf(e.getMessage()), e);
        }
    }
}
