package com.axlabs.neo.multisig;

import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * A wallet governed by its signers. Any signer can propose a batch of operations, and the batch can be executed as
 * soon as more than half of the current signers voted yes on it. Votes are cast directly by the signer or on their
 * behalf with a signature.
 * <p>
 * Calls are processed one at a time. A call either completes or leaves no trace, and its notifications are delivered
 * to the listeners only after it completed. The one exception is the nonce consumed by an accepted vote signature,
 * which stays consumed even if the vote itself is rejected afterwards.
 * <p>
 * A call made while another call on a wallet of the same {@link ContractRegistry} is running on the thread becomes
 * part of that call and is reverted with it. A failing listener affects neither the call nor the other listeners.
 * <p>
 * The signer set can only be changed by executing a proposal that contains the corresponding operations, see
 * {@link GovernanceCalls}.
 */
public class MultiSigWallet {

    private static final Logger log = LoggerFactory.getLogger(MultiSigWallet.class);

    //region EVENTS
    public static final String SIGNER_ADDED = "SignerAdded";
    public static final String SIGNER_REMOVED = "SignerRemoved";
    public static final String PROPOSAL_CREATED = "ProposalCreated";
    public static final String VOTED = "Voted";
    public static final String VOTE_RETRACTED = "VoteRetracted";
    public static final String PROPOSAL_CANCELLED = "ProposalCancelled";
    public static final String PROPOSAL_EXECUTED = "ProposalExecuted";
    //endregion EVENTS

    private final Hash160 address;
    private final SignerRegistry signers;
    private final VoteLedger ledger;
    private final ProposalStore proposals;
    private final SignatureAuthorizer authorizer;
    private final ExecutionEngine engine;
    private final GovernanceGuard guard;
    private final ContractRegistry contracts;
    private final List<NotificationListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Sets up a wallet. Use a {@link com.axlabs.neo.multisig.factory.WalletFactory} to get a wallet that is also
     * deployed at its address.
     *
     * @param address        The address of this wallet.
     * @param initialSigners The signers. Must not be empty, contain duplicates or the zero hash.
     * @param config         The configuration, i.e., the maximum number of signers and the signing domain.
     * @param contracts      The contracts that operations and signature validation can call.
     * @param time           The source of the current time.
     */
    public MultiSigWallet(Hash160 address, List<Hash160> initialSigners, WalletConfig config,
            ContractRegistry contracts, BlockTime time) {
        if (address == null || Hash160.ZERO.equals(address)) {
            throw new ValidationException("MultiSigWallet.deploy", "Invalid wallet address");
        }
        this.address = address;
        this.contracts = contracts;
        this.signers = new SignerRegistry(initialSigners, config.getMaxSigners());
        this.ledger = new VoteLedger(signers, time);
        this.proposals = new ProposalStore(signers, ledger, time);
        this.authorizer = new SignatureAuthorizer(signers, contracts, new DomainInfo(config.getDomainName(),
                config.getDomainVersion(), config.getNetworkMagic(), address));
        this.guard = new GovernanceGuard(address);
        this.engine = new ExecutionEngine(this, proposals, ledger, signers, contracts, guard, time);
        log.info("Wallet {} set up with {} signers", address, signers.count());
    }

    public void addListener(NotificationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(NotificationListener listener) {
        listeners.remove(listener);
    }

    //region SAFE METHODS

    public Hash160 getAddress() {
        return address;
    }

    /**
     * Returns the current signers.
     * <p>
     * The ordering of the returned list can change for consecutive calls.
     *
     * @return the signers.
     */
    public synchronized List<Hash160> getSigners() {
        return signers.list();
    }

    public synchronized int getSignerCount() {
        return signers.count();
    }

    public int getMaxSigners() {
        return signers.getMaxSigners();
    }

    public synchronized boolean isSigner(Hash160 identity) {
        return signers.isSigner(identity);
    }

    /**
     * Gets all information of the proposal with {@code id}. For an id that was never allocated, the returned
     * proposal has status {@link ProposalStatus#NOT_STARTED} and no data.
     *
     * @param id The proposal's id.
     * @return the proposal.
     */
    public synchronized ProposalDTO getProposal(int id) {
        Proposal proposal = proposals.get(id);
        return proposal == null ? ProposalDTO.notStarted(id) : ProposalDTO.of(proposal);
    }

    /**
     * Gets the number of proposals created on this wallet, including cancelled and executed ones.
     *
     * @return the number of proposals.
     */
    public synchronized int getProposalCount() {
        return proposals.count();
    }

    /**
     * Gets the proposals on the given page.
     *
     * @param page         The page, starting at 0.
     * @param itemsPerPage The number of proposals per page.
     * @return the chosen page, how many pages there are with the given page size and the proposals on the page.
     */
    public synchronized Paginator.Paginated<ProposalDTO> getProposals(int page, int itemsPerPage) {
        List<ProposalDTO> all = new ArrayList<>(proposals.count());
        for (Proposal proposal : proposals.all()) {
            all.add(ProposalDTO.of(proposal));
        }
        return Paginator.paginate(all, page, itemsPerPage, "MultiSigWallet.getProposals");
    }

    public synchronized boolean hasVoted(int id, Hash160 voter) {
        Proposal proposal = proposals.get(id);
        return proposal != null && ledger.hasVotedYes(proposal, voter);
    }

    /**
     * Returns everyone who voted yes on the proposal and did not retract the vote, including identities that are no
     * longer signers.
     *
     * @param id The proposal's id.
     * @return the yes-voters.
     */
    public synchronized List<Hash160> getYesVoterHistory(int id) {
        Proposal proposal = proposals.get(id);
        return proposal == null ? Collections.emptyList() : ledger.yesVoterHistory(proposal);
    }

    /**
     * Counts the yes-votes on the proposal that are cast by current signers. The count is computed on every call.
     *
     * @param id The proposal's id.
     * @return the number of valid yes-votes.
     */
    public synchronized int getValidYesCount(int id) {
        Proposal proposal = proposals.get(id);
        return proposal == null ? 0 : ledger.validYesCount(proposal);
    }

    /**
     * @param identity The signer.
     * @return the nonce the signer's next vote signature has to be made with.
     */
    public synchronized long getNonce(Hash160 identity) {
        return authorizer.getNonce(identity);
    }

    public DomainInfo getDomainInfo() {
        return authorizer.getDomain();
    }

    //endregion SAFE METHODS

    // region GOVERNANCE PROCESS METHODS

    /**
     * Creates a proposal and casts the proposer's yes-vote on it.
     *
     * @param proposer   The signer creating the proposal.
     * @param operations The operations to be executed when the proposal is accepted.
     * @param expiration The time in milliseconds after which the proposal can no longer be voted on or executed.
     *                   Must lie in the future.
     * @return the id of the proposal.
     */
    public synchronized int propose(Hash160 proposer, List<Operation> operations, long expiration) {
        return invoke(journal -> proposals.create(proposer, operations, expiration, journal).getId());
    }

    /**
     * Casts a yes-vote of {@code voter} on the proposal with {@code id}.
     *
     * @param voter The voter. Must be a signer.
     * @param id    The proposal to vote on.
     */
    public synchronized void voteFor(Hash160 voter, int id) {
        String method = "MultiSigWallet.voteFor";
        invoke(journal -> {
            if (!signers.isSigner(voter)) throw new AuthorizationException(method, "Not authorised");
            ledger.castYes(proposals.require(id, method), voter, journal, method);
            return null;
        });
    }

    /**
     * Retracts the yes-vote of {@code voter} on the proposal with {@code id}.
     *
     * @param voter The voter. Must be a signer.
     * @param id    The proposal.
     */
    public synchronized void cancelVoteFor(Hash160 voter, int id) {
        String method = "MultiSigWallet.cancelVoteFor";
        invoke(journal -> {
            if (!signers.isSigner(voter)) throw new AuthorizationException(method, "Not authorised");
            ledger.retractYes(proposals.require(id, method), voter, journal, method);
            return null;
        });
    }

    /**
     * Casts or retracts a yes-vote of {@code voter} with the voter's signature over
     * {@link DomainInfo#voteDigest(int, boolean, long)} made with their current nonce. Anyone can submit the vote.
     *
     * @param id        The proposal.
     * @param voter     The voter. Must be a signer.
     * @param support   True to vote yes, false to retract a yes-vote.
     * @param signature A 65 byte recoverable signature of the voter's key, or whatever the voter's
     *                  {@link SignatureValidator} accepts.
     */
    public synchronized void voteOnBehalfOf(int id, Hash160 voter, boolean support, byte[] signature) {
        String method = "MultiSigWallet.voteOnBehalfOf";
        invoke(journal -> {
            authorizer.authorize(id, support, voter, signature, journal);
            Proposal proposal = proposals.require(id, method);
            if (support) {
                ledger.castYes(proposal, voter, journal, method);
            } else {
                ledger.retractYes(proposal, voter, journal, method);
            }
            return null;
        });
    }

    /**
     * Executes the proposal with the given {@code id}. Anyone can execute any proposal.
     *
     * @param id The proposal id.
     * @return the values returned by the proposal's operations.
     */
    public synchronized List<Object> execute(int id) {
        return invoke(journal -> engine.execute(id, journal));
    }

    /**
     * Cancels the proposal with the given {@code id}. Only the proposer can cancel, and only as long as they are a
     * signer.
     *
     * @param caller The account asking for the cancellation.
     * @param id     The proposal.
     */
    public synchronized void cancelProposal(Hash160 caller, int id) {
        invoke(journal -> {
            proposals.cancel(proposals.require(id, "MultiSigWallet.cancelProposal"), caller, false, journal);
            return null;
        });
    }
    // endregion GOVERNANCE PROCESS METHODS

    //region PROPOSAL-INVOKED METHODS

    /**
     * Cancels the proposal with the given {@code id}.
     * <p>
     * This method can only be called by the wallet itself.
     *
     * @param capability The capability of the running execution.
     * @param id         The proposal.
     */
    public synchronized void cancelProposal(GovernanceCapability capability, int id) {
        String method = "MultiSigWallet.cancelProposal";
        invoke(journal -> {
            guard.check(capability, method);
            proposals.cancel(proposals.require(id, method), null, true, journal);
            return null;
        });
    }

    /**
     * Adds {@code signer} to the signers.
     * <p>
     * This method can only be called by the wallet itself.
     *
     * @param capability The capability of the running execution.
     * @param signer     The new signer.
     */
    public synchronized void addSigner(GovernanceCapability capability, Hash160 signer) {
        invoke(journal -> {
            guard.check(capability, "MultiSigWallet.addSigner");
            signers.add(signer, journal);
            return null;
        });
    }

    /**
     * Removes {@code signer} from the signers.
     * <p>
     * This method can only be called by the wallet itself.
     *
     * @param capability The capability of the running execution.
     * @param signer     The signer to remove.
     */
    public synchronized void removeSigner(GovernanceCapability capability, Hash160 signer) {
        invoke(journal -> {
            guard.check(capability, "MultiSigWallet.removeSigner");
            signers.remove(signer, journal);
            return null;
        });
    }
    //endregion PROPOSAL-INVOKED METHODS

    private <T> T invoke(Function<CallJournal, T> call) {
        CallJournal enclosing = contracts.getActiveJournal();
        CallJournal journal = enclosing == null
                ? new CallJournal(address, this::deliver)
                : enclosing.nested(address, this::deliver);
        contracts.setActiveJournal(journal);
        boolean completed = false;
        T result;
        try {
            result = call.apply(journal);
            completed = true;
        } catch (WalletException e) {
            if (journal.isNested()) {
                log.debug("Nested call on wallet {} reverted: {}", address, e.getMessage());
            } else if (e instanceof ExecutionFailedException) {
                log.warn("Execution on wallet {} reverted: {}", address, e.getMessage());
            } else {
                log.debug("Call on wallet {} rejected: {}", address, e.getMessage());
            }
            throw e;
        } finally {
            if (!completed) {
                journal.rollback();
            }
            contracts.setActiveJournal(enclosing);
        }
        if (journal.isNested()) {
            journal.mergeIntoParent();
        } else {
            journal.publish();
        }
        return result;
    }

    private void deliver(Notification notification) {
        for (NotificationListener listener : listeners) {
            try {
                listener.onNotification(notification);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {} of wallet {}", listener, notification, address, e);
            }
        }
    }
}
