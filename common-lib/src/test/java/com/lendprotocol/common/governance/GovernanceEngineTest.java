package com.lendprotocol.common.governance;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendprotocol.common.capability.StoredAdminGate;
import com.lendprotocol.common.exception.ProtocolError;
import com.lendprotocol.common.exception.ProtocolException;
import com.lendprotocol.common.model.Address;
import com.lendprotocol.common.model.Proposal;
import com.lendprotocol.common.model.ProposalState;
import com.lendprotocol.common.model.VoteReceipt;
import com.lendprotocol.common.store.JsonKvStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lifecycle verification of {@link GovernanceEngine}: propose → vote → queue → execute.
 */
class GovernanceEngineTest {

    private static final Address ADMIN    = Address.of("GADMIN");
    private static final Address PROPOSER = Address.of("GPROPOSER");
    private static final Address ALICE    = Address.of("GALICE");
    private static final Address BOB      = Address.of("GBOB");

    private static final long START  = 1_000_000L;
    private static final long PERIOD = 3_600L;

    private final AtomicLong now = new AtomicLong(START);

    private GovernanceStore store;
    private StoredAdminGate adminGate;
    private GovernanceEngine engine;

    @BeforeEach
    void setUp() {
        JsonKvStore kv = new JsonKvStore(new ObjectMapper());
        store     = new GovernanceStore(kv);
        adminGate = new StoredAdminGate(kv);
        adminGate.setAdmin(ADMIN);
        engine    = engineWith(RepeatVotePolicy.ACCUMULATE);
    }

    private GovernanceEngine engineWith(RepeatVotePolicy policy) {
        return new GovernanceEngine(store, now::get, adminGate, policy);
    }

    private static BigInteger w(long weight) {
        return BigInteger.valueOf(weight);
    }

    /** Proposal with 700 for / 300 against, voting window already closed. */
    private Proposal closedWithQuorum() {
        Proposal p = engine.propose(PROPOSER, "raise collateral factor", PERIOD);
        engine.vote(p.id(), ALICE, true, w(700));
        engine.vote(p.id(), BOB, false, w(300));
        now.set(p.votingEnds());
        return p;
    }

    // ── propose() ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("propose()")
    class ProposeTests {

        @Test
        @DisplayName("ids start at 1 and strictly increase")
        void idsIncrease() {
            assertEquals(1L, engine.propose(PROPOSER, "a", PERIOD).id());
            assertEquals(2L, engine.propose(PROPOSER, "b", PERIOD).id());
            assertEquals(3L, engine.propose(PROPOSER, "c", 0).id());
        }

        @Test
        @DisplayName("new proposal: votingEnds = created + period, zero tallies, not queued")
        void initialFields() {
            Proposal p = engine.propose(PROPOSER, "list asset", PERIOD);

            assertEquals(START, p.created());
            assertEquals(START + PERIOD, p.votingEnds());
            assertEquals(0L, p.queuedUntil());
            assertEquals(BigInteger.ZERO, p.forVotes());
            assertEquals(BigInteger.ZERO, p.againstVotes());
            assertFalse(p.executed());
            assertEquals(p, engine.getProposal(p.id()));
            assertEquals(ProposalState.PENDING, engine.state(p));
        }

        @Test
        @DisplayName("negative voting period → INVALID_AMOUNT, counter untouched")
        void negativePeriod() {
            ProtocolException e = assertThrows(ProtocolException.class,
                () -> engine.propose(PROPOSER, "bad", -1));
            assertEquals(ProtocolError.INVALID_AMOUNT, e.getError());
            assertEquals(1L, engine.propose(PROPOSER, "good", PERIOD).id());
        }

        @Test
        @DisplayName("voting period past the end of the clock → INVALID_AMOUNT, nothing stored")
        void periodOverflow() {
            ProtocolException e = assertThrows(ProtocolException.class,
                () -> engine.propose(PROPOSER, "forever", Long.MAX_VALUE));
            assertEquals(ProtocolError.INVALID_AMOUNT, e.getError());

            Proposal next = engine.propose(PROPOSER, "good", PERIOD);
            assertEquals(1L, next.id());
            assertEquals(START + PERIOD, next.votingEnds());
        }
    }

    // ── vote() ────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("vote()")
    class VoteTests {

        @Test
        @DisplayName("unknown proposal → NOT_FOUND instead of a crash")
        void unknownProposal() {
            ProtocolException e = assertThrows(ProtocolException.class,
                () -> engine.vote(42, ALICE, true, w(1)));
            assertEquals(ProtocolError.NOT_FOUND, e.getError());
        }

        @Test
        @DisplayName("support routes weight to for, otherwise to against")
        void tallies() {
            Proposal p = engine.propose(PROPOSER, "t", PERIOD);
            engine.vote(p.id(), ALICE, true, w(10));
            Proposal after = engine.vote(p.id(), BOB, false, w(4));

            assertEquals(w(10), after.forVotes());
            assertEquals(w(4), after.againstVotes());
            assertEquals(after, engine.getProposal(p.id()));
        }

        @Test
        @DisplayName("vote at exactly votingEnds still counts; one second later is a no-op")
        void votingWindowBoundary() {
            Proposal p = engine.propose(PROPOSER, "t", PERIOD);

            now.set(p.votingEnds());
            assertEquals(w(5), engine.vote(p.id(), ALICE, true, w(5)).forVotes());

            now.set(p.votingEnds() + 1);
            Proposal unchanged = engine.vote(p.id(), BOB, true, w(100));
            assertEquals(w(5), unchanged.forVotes());
            assertTrue(engine.getReceipt(p.id(), BOB).isEmpty());
        }

        @Test
        @DisplayName("ACCUMULATE: repeat votes add to the tally while the receipt keeps only the last")
        void accumulatePolicy() {
            Proposal p = engine.propose(PROPOSER, "t", PERIOD);
            engine.vote(p.id(), ALICE, true, w(10));
            Proposal after = engine.vote(p.id(), ALICE, false, w(3));

            assertEquals(w(10), after.forVotes());
            assertEquals(w(3), after.againstVotes());
            assertEquals(new VoteReceipt(ALICE, false, w(3)), engine.getReceipt(p.id(), ALICE).orElseThrow());
            assertEquals(1, engine.getReceipts(p.id()).size());
        }

        @Test
        @DisplayName("REPLACE: the previous vote is withdrawn before the new one counts")
        void replacePolicy() {
            GovernanceEngine replacing = engineWith(RepeatVotePolicy.REPLACE);
            Proposal p = replacing.propose(PROPOSER, "t", PERIOD);
            replacing.vote(p.id(), ALICE, true, w(10));
            replacing.vote(p.id(), BOB, true, w(2));
            Proposal after = replacing.vote(p.id(), ALICE, false, w(3));

            assertEquals(w(2), after.forVotes());
            assertEquals(w(3), after.againstVotes());
        }

        @Test
        @DisplayName("weight outside the signed 128-bit range → INVALID_AMOUNT")
        void weightRange() {
            Proposal p = engine.propose(PROPOSER, "t", PERIOD);
            BigInteger tooLarge = Proposal.MAX_TALLY.add(BigInteger.ONE);
            BigInteger tooSmall = Proposal.MIN_TALLY.subtract(BigInteger.ONE);

            assertEquals(ProtocolError.INVALID_AMOUNT, assertThrows(ProtocolException.class,
                () -> engine.vote(p.id(), ALICE, true, tooLarge)).getError());
            assertEquals(ProtocolError.INVALID_AMOUNT, assertThrows(ProtocolException.class,
                () -> engine.vote(p.id(), ALICE, false, tooSmall)).getError());
            assertEquals(BigInteger.ZERO, engine.getProposal(p.id()).forVotes());
        }

        @Test
        @DisplayName("tally that would leave the 128-bit range → INVALID_AMOUNT, tally and receipt unchanged")
        void tallyOverflow() {
            Proposal p = engine.propose(PROPOSER, "t", PERIOD);
            engine.vote(p.id(), ALICE, true, Proposal.MAX_TALLY);

            assertEquals(ProtocolError.INVALID_AMOUNT, assertThrows(ProtocolException.class,
                () -> engine.vote(p.id(), BOB, true, w(1))).getError());
            assertEquals(Proposal.MAX_TALLY, engine.getProposal(p.id()).forVotes());
            assertTrue(engine.getReceipt(p.id(), BOB).isEmpty());
        }
    }

    // ── queue() ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("queue()")
    class QueueTests {

        @Test
        @DisplayName("quorum 700/300 at 1000 bps after voting ends → queuedUntil = now + timelock")
        void queuesWithQuorum() {
            Proposal p = closedWithQuorum();
            Proposal queued = engine.queue(p.id());

            assertEquals(p.votingEnds() + GovernanceStore.DEFAULT_TIMELOCK_SECONDS, queued.queuedUntil());
            assertTrue(queued.queuedUntil() >= queued.votingEnds());
            assertEquals(ProposalState.QUEUED, engine.state(queued));
        }

        @Test
        @DisplayName("voting still open → unchanged even with quorum")
        void votingStillOpen() {
            Proposal p = closedWithQuorum();
            now.set(p.votingEnds() - 1);
            assertEquals(0L, engine.queue(p.id()).queuedUntil());
        }

        @Test
        @DisplayName("no votes cast → never queues")
        void noVotes() {
            Proposal p = engine.propose(PROPOSER, "t", PERIOD);
            now.set(p.votingEnds() + 10);
            Proposal after = engine.queue(p.id());
            assertEquals(0L, after.queuedUntil());
            assertEquals(ProposalState.VOTING_CLOSED, engine.state(after));
        }

        @Test
        @DisplayName("for share below quorum → stays VOTING_CLOSED")
        void belowQuorum() {
            Proposal p = engine.propose(PROPOSER, "t", PERIOD);
            engine.vote(p.id(), ALICE, true, w(50));
            engine.vote(p.id(), BOB, false, w(950));
            now.set(p.votingEnds());
            assertEquals(0L, engine.queue(p.id()).queuedUntil());
        }

        @Test
        @DisplayName("idempotent: two calls with no change in between yield the same proposal")
        void idempotent() {
            Proposal p = closedWithQuorum();
            Proposal first = engine.queue(p.id());
            Proposal second = engine.queue(p.id());
            assertEquals(first, second);

            Proposal deferred = engine.propose(PROPOSER, "no votes", PERIOD);
            assertEquals(engine.queue(deferred.id()), engine.queue(deferred.id()));
        }

        @Test
        @DisplayName("unknown proposal → NOT_FOUND")
        void unknown() {
            assertEquals(ProtocolError.NOT_FOUND,
                assertThrows(ProtocolException.class, () -> engine.queue(99)).getError());
        }

        @Test
        @DisplayName("timelock that overflows the clock → INVALID_AMOUNT, proposal stays unqueued and unexecutable")
        void timelockOverflow() {
            engine.setTimelock(ADMIN, Long.MAX_VALUE);
            Proposal p = closedWithQuorum();

            ProtocolException e = assertThrows(ProtocolException.class, () -> engine.queue(p.id()));
            assertEquals(ProtocolError.INVALID_AMOUNT, e.getError());

            Proposal stored = engine.getProposal(p.id());
            assertEquals(0L, stored.queuedUntil());
            assertFalse(engine.execute(p.id()).executed());
        }

        @Test
        @DisplayName("quorum formula truncates: for * 10000 / total")
        void quorumFormula() {
            Proposal p = Proposal.open(1, PROPOSER, "t", 0, 0);
            assertTrue(GovernanceEngine.hasQuorum(p.withVote(true, w(700)).withVote(false, w(300)), 1000));
            assertTrue(GovernanceEngine.hasQuorum(p.withVote(true, w(1)).withVote(false, w(9_999)), 1));
            assertFalse(GovernanceEngine.hasQuorum(p.withVote(true, w(1)).withVote(false, w(10_000)), 1));
            assertFalse(GovernanceEngine.hasQuorum(p, 0));
        }
    }

    // ── execute() ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("execute()")
    class ExecuteTests {

        @Test
        @DisplayName("not queued → executed stays false")
        void notQueued() {
            Proposal p = closedWithQuorum();
            assertFalse(engine.execute(p.id()).executed());
        }

        @Test
        @DisplayName("queued but timelock not elapsed → executed stays false")
        void timelockPending() {
            Proposal queued = engine.queue(closedWithQuorum().id());
            now.set(queued.queuedUntil() - 1);
            assertFalse(engine.execute(queued.id()).executed());
        }

        @Test
        @DisplayName("now >= queuedUntil → executed, and repeating is a no-op")
        void executesOnce() {
            Proposal queued = engine.queue(closedWithQuorum().id());
            now.set(queued.queuedUntil());

            Proposal executed = engine.execute(queued.id());
            assertTrue(executed.executed());
            assertEquals(ProposalState.EXECUTED, engine.state(executed));

            now.addAndGet(1_000);
            assertEquals(executed, engine.execute(queued.id()));
        }

        @Test
        @DisplayName("unknown proposal → NOT_FOUND")
        void unknown() {
            assertEquals(ProtocolError.NOT_FOUND,
                assertThrows(ProtocolException.class, () -> engine.execute(5)).getError());
        }
    }

    // ── delegation & tunables ────────────────────────────────────────────────

    @Nested
    @DisplayName("delegation and tunables")
    class DelegationAndTunables {

        @Test
        @DisplayName("delegate() overwrites; getDelegate() reads back; tallies ignore it")
        void delegation() {
            assertTrue(engine.getDelegate(ALICE).isEmpty());
            engine.delegate(ALICE, BOB);
            engine.delegate(ALICE, PROPOSER);
            assertEquals(PROPOSER, engine.getDelegate(ALICE).orElseThrow());

            Proposal p = engine.propose(PROPOSER, "t", PERIOD);
            assertEquals(w(1), engine.vote(p.id(), ALICE, true, w(1)).forVotes());
        }

        @Test
        @DisplayName("defaults: quorum 1000 bps, timelock 60 s")
        void defaults() {
            assertEquals(1000L, engine.getQuorumBps());
            assertEquals(60L, engine.getTimelock());
        }

        @Test
        @DisplayName("non-admin cannot change tunables")
        void unauthorized() {
            assertEquals(ProtocolError.UNAUTHORIZED,
                assertThrows(ProtocolException.class, () -> engine.setQuorumBps(ALICE, 5000)).getError());
            assertEquals(ProtocolError.UNAUTHORIZED,
                assertThrows(ProtocolException.class, () -> engine.setTimelock(ALICE, 10)).getError());
            assertEquals(1000L, engine.getQuorumBps());
        }

        @Test
        @DisplayName("out-of-range values → INVALID_AMOUNT")
        void invalidValues() {
            assertEquals(ProtocolError.INVALID_AMOUNT,
                assertThrows(ProtocolException.class, () -> engine.setQuorumBps(ADMIN, 10_001)).getError());
            assertEquals(ProtocolError.INVALID_AMOUNT,
                assertThrows(ProtocolException.class, () -> engine.setTimelock(ADMIN, -1)).getError());
        }

        @Test
        @DisplayName("admin-set timelock and quorum drive queue()")
        void tunablesApplied() {
            engine.setTimelock(ADMIN, 600);
            engine.setQuorumBps(ADMIN, 8000);

            Proposal p = closedWithQuorum();
            assertEquals(0L, engine.queue(p.id()).queuedUntil());

            engine.setQuorumBps(ADMIN, 7000);
            assertEquals(p.votingEnds() + 600, engine.queue(p.id()).queuedUntil());
        }
    }
}
