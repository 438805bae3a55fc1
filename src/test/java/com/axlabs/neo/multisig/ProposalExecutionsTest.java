package com.axlabs.neo.multisig;

import com.axlabs.neo.multisig.util.CounterContract;
import com.axlabs.neo.multisig.util.NotificationCollector;
import com.axlabs.neo.multisig.util.TestBlockTime;
import io.neow3j.types.Hash160;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.axlabs.neo.multisig.MultiSigWallet.PROPOSAL_CREATED;
import static com.axlabs.neo.multisig.MultiSigWallet.PROPOSAL_EXECUTED;
import static com.axlabs.neo.multisig.MultiSigWallet.VOTED;
import static com.axlabs.neo.multisig.util.TestHelper.ALICE;
import static com.axlabs.neo.multisig.util.TestHelper.BOB;
import static com.axlabs.neo.multisig.util.TestHelper.CHARLIE;
import static com.axlabs.neo.multisig.util.TestHelper.COUNTER_ADDRESS;
import static com.axlabs.neo.multisig.util.TestHelper.DENISE;
import static com.axlabs.neo.multisig.util.TestHelper.EVE;
import static com.axlabs.neo.multisig.util.TestHelper.PHASE_LENGTH;
import static com.axlabs.neo.multisig.util.TestHelper.START_TIME;
import static com.axlabs.neo.multisig.util.TestHelper.addSigner;
import static com.axlabs.neo.multisig.util.TestHelper.assertAborted;
import static com.axlabs.neo.multisig.util.TestHelper.counterOperation;
import static com.axlabs.neo.multisig.util.TestHelper.createProposal;
import static com.axlabs.neo.multisig.util.TestHelper.deployWallet;
import static com.axlabs.neo.multisig.util.TestHelper.removeSigner;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ProposalExecutionsTest {

    private TestBlockTime time;
    private ContractRegistry contracts;
    private CounterContract counter;
    private MultiSigWallet wallet;
    private NotificationCollector events;

    @BeforeEach
    public void setUp() {
        time = new TestBlockTime(START_TIME);
        contracts = new ContractRegistry();
        counter = new CounterContract();
        contracts.deploy(COUNTER_ADDRESS, counter);
        // Alice, Bob and Charlie are signers.
        wallet = deployWallet(contracts, time, ALICE, BOB, CHARLIE);
        events = new NotificationCollector();
        wallet.addListener(events);
    }

    //region MAJORITY
    @Test
    public void execute_with_majority_of_signers() {
        int id = createProposal(wallet, time, ALICE, counterOperation(7));
        wallet.voteFor(BOB.getScriptHash(), id);
        events.clear();

        List<Object> returnVals = wallet.execute(id);

        assertThat(returnVals.size(), is(1));
        assertThat((BigInteger) returnVals.get(0), is(BigInteger.valueOf(7)));
        assertThat(counter.getCount(), is(BigInteger.valueOf(7)));
        assertThat(wallet.getProposal(id).status, is(ProposalStatus.EXECUTED));
        assertThat(events.getEventNames(), contains(PROPOSAL_EXECUTED));
        assertThat((int) events.getNotifications().get(0).getState().get(0), is(id));
    }

    @Test
    public void fail_execute_with_only_proposer_vote() {
        int id = createProposal(wallet, time, ALICE, counterOperation(1));
        assertAborted(ProposalStateException.class, () -> wallet.execute(id), "Insufficient votes");
        assertThat(counter.getCalls(), is(0));
        assertThat(wallet.getProposal(id).status, is(ProposalStatus.PROPOSED));
    }

    @Test
    public void fail_execute_with_half_of_even_signer_count() {
        addSigner(wallet, time, ALICE, Collections.singletonList(BOB), DENISE);
        int id = createProposal(wallet, time, ALICE, counterOperation(1));
        wallet.voteFor(BOB.getScriptHash(), id);

        assertAborted(ProposalStateException.class, () -> wallet.execute(id), "Insufficient votes");

        wallet.voteFor(DENISE.getScriptHash(), id);
        wallet.execute(id);
        assertThat(counter.getCount(), is(BigInteger.ONE));
    }

    @Test
    public void execute_after_voted_signer_retracted_and_other_voted() {
        int id = createProposal(wallet, time, ALICE, counterOperation(1));
        wallet.voteFor(BOB.getScriptHash(), id);
        wallet.cancelVoteFor(BOB.getScriptHash(), id);
        assertAborted(ProposalStateException.class, () -> wallet.execute(id), "Insufficient votes");

        wallet.voteFor(CHARLIE.getScriptHash(), id);
        wallet.execute(id);
        assertThat(wallet.getProposal(id).status, is(ProposalStatus.EXECUTED));
    }

    @Test
    public void execute_after_non_voter_was_removed() {
        int id = createProposal(wallet, time, ALICE, counterOperation(1));
        // Charlie leaves before Bob votes. Two of two signers in favour.
        removeSigner(wallet, time, ALICE, Collections.singletonList(BOB), CHARLIE);
        wallet.voteFor(BOB.getScriptHash(), id);

        assertThat(wallet.getValidYesCount(id), is(2));
        wallet.execute(id);
        assertThat(wallet.getProposal(id).status, is(ProposalStatus.EXECUTED));
    }

    @Test
    public void fail_execute_after_voter_was_removed() {
        int id = createProposal(wallet, time, ALICE, counterOperation(1));
        wallet.voteFor(BOB.getScriptHash(), id);
        assertThat(wallet.getValidYesCount(id), is(2));

        removeSigner(wallet, time, ALICE, Collections.singletonList(CHARLIE), BOB);

        // Bob's vote stays in the history but no longer counts.
        assertThat(wallet.getYesVoterHistory(id), containsInAnyOrder(ALICE.getScriptHash(), BOB.getScriptHash()));
        assertThat(wallet.getValidYesCount(id), is(1));
        assertAborted(ProposalStateException.class, () -> wallet.execute(id), "Insufficient votes");
        assertThat(counter.getCalls(), is(0));
    }

    @Test
    public void execute_with_revived_vote_of_readded_signer() {
        int id = createProposal(wallet, time, ALICE, counterOperation(1));
        wallet.voteFor(BOB.getScriptHash(), id);
        removeSigner(wallet, time, ALICE, Collections.singletonList(CHARLIE), BOB);
        assertThat(wallet.getValidYesCount(id), is(1));

        addSigner(wallet, time, ALICE, Collections.singletonList(CHARLIE), BOB);

        assertThat(wallet.getValidYesCount(id), is(2));
        assertThat(wallet.hasVoted(id, BOB.getScriptHash()), is(true));
        wallet.execute(id);
        assertThat(counter.getCount(), is(BigInteger.ONE));
    }
    //endregion MAJORITY

    //region STATE CHECKS
    @Test
    public void fail_execute_non_existent_proposal() {
        assertAborted(ProposalStateException.class, () -> wallet.execute(1000), "Proposal doesn't exist");
    }

    @Test
    public void fail_execute_proposal_twice() {
        int id = createProposal(wallet, time, ALICE, counterOperation(1));
        wallet.voteFor(BOB.getScriptHash(), id);
        wallet.execute(id);

        assertAborted(ProposalStateException.class, () -> wallet.execute(id), "Proposal already executed");
        assertThat(counter.getCalls(), is(1));
    }

    @Test
    public void fail_execute_cancelled_proposal() {
        int id = createProposal(wallet, time, ALICE, counterOperation(1));
        wallet.voteFor(BOB.getScriptHash(), id);
        wallet.cancelProposal(ALICE.getScriptHash(), id);

        assertAborted(ProposalStateException.class, () -> wallet.execute(id), "Proposal not active");
    }

    @Test
    public void fail_execute_expired_proposal() {
        int id = createProposal(wallet, time, ALICE, counterOperation(1));
        wallet.voteFor(BOB.getScriptHash(), id);
        time.fastForward(PHASE_LENGTH + 1);

        assertAborted(ProposalStateException.class, () -> wallet.execute(id), "Proposal expired");
        assertThat(wallet.getProposal(id).status, is(ProposalStatus.PROPOSED));
    }

    @Test
    public void execute_at_expiration_time() {
        int id = createProposal(wallet, time, ALICE, counterOperation(1));
        wallet.voteFor(BOB.getScriptHash(), id);
        time.fastForward(PHASE_LENGTH);

        wallet.execute(id);
        assertThat(wallet.getProposal(id).status, is(ProposalStatus.EXECUTED));
    }

    @Test
    public void fail_voting_on_executed_proposal() {
        int id = createProposal(wallet, time, ALICE, counterOperation(1));
        wallet.voteFor(BOB.getScriptHash(), id);
        wallet.execute(id);

        assertAborted(ProposalStateException.class, () -> wallet.voteFor(CHARLIE.getScriptHash(), id),
                "Proposal not active");
        assertAborted(ProposalStateException.class, () -> wallet.cancelVoteFor(BOB.getScriptHash(), id),
                "Proposal not active");
    }
    //endregion STATE CHECKS

    //region OPERATIONS
    @Test
    public void execute_operations_in_order_and_return_their_values() {
        int id = createProposal(wallet, time, ALICE, counterOperation(2), counterOperation(3),
                counterOperation(5));
        wallet.voteFor(CHARLIE.getScriptHash(), id);

        List<Object> returnVals = wallet.execute(id);

        assertThat(returnVals.size(), is(3));
        assertThat((BigInteger) returnVals.get(0), is(BigInteger.valueOf(2)));
        assertThat((BigInteger) returnVals.get(1), is(BigInteger.valueOf(5)));
        assertThat((BigInteger) returnVals.get(2), is(BigInteger.TEN));
        assertThat(counter.getCalls(), is(3));
    }

    @Test
    public void pass_wallet_address_and_proposal_to_call_target() {
        Hash160 probeAddress = new Hash160("0x00000000000000000000000000000000000000cc");
        List<Object> seen = new ArrayList<>();
        contracts.deploy(probeAddress, (CallTarget) (context, value, data) -> {
            seen.add(context.getCaller());
            seen.add(context.getProposalId());
            seen.add(value);
            return data.length;
        });
        int id = createProposal(wallet, time, ALICE,
                new Operation(probeAddress, BigInteger.valueOf(42), new byte[]{1, 2}));
        wallet.voteFor(BOB.getScriptHash(), id);

        List<Object> returnVals = wallet.execute(id);

        assertThat((int) returnVals.get(0), is(2));
        assertThat((Hash160) seen.get(0), is(wallet.getAddress()));
        assertThat((int) seen.get(1), is(id));
        assertThat((BigInteger) seen.get(2), is(BigInteger.valueOf(42)));
    }

    @Test
    public void fail_execute_with_unknown_target() {
        Hash160 nowhere = new Hash160("0x00000000000000000000000000000000000000dd");
        int id = createProposal(wallet, time, ALICE, new Operation(nowhere, new byte[0]));
        wallet.voteFor(BOB.getScriptHash(), id);

        ExecutionFailedException e = assertAborted(ExecutionFailedException.class, () -> wallet.execute(id),
                "Unknown target");
        assertThat(e.getOperationIndex(), is(0));
        assertThat(e.getProposalId(), is(id));
        assertThat(wallet.getProposal(id).status, is(ProposalStatus.PROPOSED));
    }

    @Test
    public void fail_execute_with_empty_governance_call() {
        int id = createProposal(wallet, time, ALICE, new Operation(wallet.getAddress(), new byte[0]));
        wallet.voteFor(BOB.getScriptHash(), id);
        assertAborted(ExecutionFailedException.class, () -> wallet.execute(id), "Empty governance call");
    }

    @Test
    public void fail_execute_with_unknown_governance_call() {
        int id = createProposal(wallet, time, ALICE, new Operation(wallet.getAddress(), new byte[]{0x7f}));
        wallet.voteFor(BOB.getScriptHash(), id);
        assertAborted(ExecutionFailedException.class, () -> wallet.execute(id), "Unknown governance call");
    }
    //endregion OPERATIONS

    //region ATOMICITY
    @Test
    public void revert_all_operations_if_one_fails() {
        int id = createProposal(wallet, time, ALICE, counterOperation(5), counterOperation(6),
                new Operation(COUNTER_ADDRESS, BigInteger.ONE, CounterContract.FAIL));
        wallet.voteFor(BOB.getScriptHash(), id);
        events.clear();

        ExecutionFailedException e = assertAborted(ExecutionFailedException.class, () -> wallet.execute(id),
                "Counter refused the call");

        assertThat(e.getOperationIndex(), is(2));
        assertThat(e.getCause(), instanceOf(IllegalStateException.class));
        assertThat(counter.getCount(), is(BigInteger.ZERO));
        assertThat(counter.getCalls(), is(0));
        assertThat(wallet.getProposal(id).status, is(ProposalStatus.PROPOSED));
        assertThat(events.getNotifications(), is(empty()));
    }

    @Test
    public void revert_signer_changes_if_later_operation_fails() {
        int id = createProposal(wallet, time, ALICE,
                GovernanceCalls.addSigner(wallet.getAddress(), EVE.getScriptHash()),
                GovernanceCalls.removeSigner(wallet.getAddress(), CHARLIE.getScriptHash()),
                new Operation(COUNTER_ADDRESS, BigInteger.ONE, CounterContract.FAIL));
        wallet.voteFor(BOB.getScriptHash(), id);
        events.clear();

        assertAborted(ExecutionFailedException.class, () -> wallet.execute(id), "Counter refused the call");

        assertThat(wallet.getSigners(), containsInAnyOrder(ALICE.getScriptHash(), BOB.getScriptHash(),
                CHARLIE.getScriptHash()));
        assertThat(events.getNotifications(), is(empty()));
    }

    @Test
    public void revert_governance_cancellation_if_later_operation_fails() {
        int other = createProposal(wallet, time, BOB, counterOperation(1));
        int id = createProposal(wallet, time, ALICE, GovernanceCalls.cancelProposal(wallet.getAddress(), other),
                new Operation(COUNTER_ADDRESS, BigInteger.ONE, CounterContract.FAIL));
        wallet.voteFor(BOB.getScriptHash(), id);

        assertAborted(ExecutionFailedException.class, () -> wallet.execute(id), "Counter refused the call");
        assertThat(wallet.getProposal(other).status, is(ProposalStatus.PROPOSED));
    }

    @Test
    public void execute_after_failed_attempt() {
        FlakyContract flaky = new FlakyContract();
        Hash160 flakyAddress = new Hash160("0x00000000000000000000000000000000000000ee");
        contracts.deploy(flakyAddress, flaky);
        int id = createProposal(wallet, time, ALICE, counterOperation(1), new Operation(flakyAddress, new byte[0]));
        wallet.voteFor(BOB.getScriptHash(), id);

        assertAborted(ExecutionFailedException.class, () -> wallet.execute(id), "Not yet");
        assertThat(counter.getCount(), is(BigInteger.ZERO));

        flaky.ready = true;
        wallet.execute(id);
        assertThat(counter.getCount(), is(BigInteger.ONE));
        assertThat(wallet.getProposal(id).status, is(ProposalStatus.EXECUTED));
    }

    @Test
    public void fail_reentrant_execution_from_call_target() {
        List<String> reentryErrors = new ArrayList<>();
        Hash160 reentrantAddress = new Hash160("0x00000000000000000000000000000000000000ff");
        contracts.deploy(reentrantAddress, (CallTarget) (context, value, data) -> {
            try {
                wallet.execute(context.getProposalId());
            } catch (ProposalStateException e) {
                reentryErrors.add(e.getMessage());
            }
            return null;
        });
        int id = createProposal(wallet, time, ALICE, counterOperation(1), new Operation(reentrantAddress, new byte[0]));
        wallet.voteFor(BOB.getScriptHash(), id);

        wallet.execute(id);

        assertThat(reentryErrors.size(), is(1));
        assertThat(reentryErrors.get(0).contains("Proposal already executed"), is(true));
        assertThat(counter.getCalls(), is(1));
    }

    @Test
    public void revert_all_operations_if_call_target_throws_error() {
        Hash160 brokenAddress = new Hash160("0x00000000000000000000000000000000000000ab");
        contracts.deploy(brokenAddress, (CallTarget) (context, value, data) -> {
            throw new AssertionError("Broken target");
        });
        int id = createProposal(wallet, time, ALICE, counterOperation(5), new Operation(brokenAddress, new byte[0]));
        wallet.voteFor(BOB.getScriptHash(), id);
        events.clear();

        AssertionError e = assertThrows(AssertionError.class, () -> wallet.execute(id));

        assertThat(e.getMessage(), is("Broken target"));
        assertThat(counter.getCount(), is(BigInteger.ZERO));
        assertThat(wallet.getProposal(id).status, is(ProposalStatus.PROPOSED));
        assertThat(events.getNotifications(), is(empty()));
        // The wallet is usable afterwards.
        wallet.cancelProposal(ALICE.getScriptHash(), id);
        assertThat(wallet.getProposal(id).status, is(ProposalStatus.CANCELLED));
    }

    @Test
    public void revert_calls_into_other_wallet_if_later_operation_fails() {
        Hash160 otherAddress = new Hash160("0x00000000000000000000000000000000000000ac");
        // The other wallet is governed by this wallet alone.
        MultiSigWallet other = new MultiSigWallet(otherAddress, Collections.singletonList(wallet.getAddress()),
                WalletConfig.defaults(), contracts, time);
        contracts.deploy(otherAddress, other);
        NotificationCollector otherEvents = new NotificationCollector();
        other.addListener(otherEvents);
        Hash160 proxyAddress = new Hash160("0x00000000000000000000000000000000000000ad");
        contracts.deploy(proxyAddress, (CallTarget) (context, value, data) -> other.propose(context.getCaller(),
                Collections.singletonList(counterOperation(1)), time.getTime() + 1000));

        int failing = createProposal(wallet, time, ALICE, new Operation(proxyAddress, new byte[0]),
                new Operation(COUNTER_ADDRESS, BigInteger.ONE, CounterContract.FAIL));
        wallet.voteFor(BOB.getScriptHash(), failing);

        assertAborted(ExecutionFailedException.class, () -> wallet.execute(failing), "Counter refused the call");
        assertThat(other.getProposalCount(), is(0));
        assertThat(otherEvents.getNotifications(), is(empty()));

        int passing = createProposal(wallet, time, ALICE, new Operation(proxyAddress, new byte[0]));
        wallet.voteFor(BOB.getScriptHash(), passing);
        events.clear();

        List<Object> returnVals = wallet.execute(passing);

        assertThat((int) returnVals.get(0), is(0));
        assertThat(other.getProposalCount(), is(1));
        assertThat(other.getProposal(0).proposer, is(wallet.getAddress()));
        assertThat(otherEvents.getEventNames(), contains(PROPOSAL_CREATED, VOTED));
        assertThat(otherEvents.getNotifications().get(0).getContract(), is(otherAddress));
        assertThat(events.getEventNames(), contains(PROPOSAL_EXECUTED));
    }
    //endregion ATOMICITY

    private static class FlakyContract implements CallTarget {
        boolean ready;

        @Override
        public Object call(CallContext context, BigInteger value, byte[] data) {
            if (!ready) {
                throw new IllegalStateException("Not yet");
            }
            return null;
        }
    }
}
