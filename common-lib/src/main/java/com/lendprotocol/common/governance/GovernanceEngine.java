package com.lendprotocol.common.governance;

import com.lendprotocol.common.capability.AdminGate;
import com.lendprotocol.common.capability.LedgerClock;
import com.lendprotocol.common.exception.ProtocolException;
import com.lendprotocol.common.model.Address;
import com.lendprotocol.common.model.Proposal;
import com.lendprotocol.common.model.ProposalState;
import com.lendprotocol.common.model.VoteReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Proposal lifecycle: propose → vote → queue → execute.
 *
 * <h3>Transitions</h3>
 * <pre>
 *   PENDING        now &lt; votingEnds; votes accepted up to and including votingEnds
 *   VOTING_CLOSED  now &gt;= votingEnds; queue() succeeds once quorum holds
 *   QUEUED         queuedUntil = now + timelock
 *   EXECUTED       now &gt;= queuedUntil
 * </pre>
 *
 * <h3>Quorum</h3>
 * <pre>
 *   total  = forVotes + againstVotes
 *   quorum = total != 0 &amp;&amp; forVotes * 10000 / total &gt;= quorumBps   (truncating)
 * </pre>
 *
 * <p>{@code queue} and {@code execute} are no-ops when their guard does not hold, so
 * callers may retry them freely. Each public mutator runs as one atomic invocation.
 * Only the tunable setters are admin-gated.
 */
public class GovernanceEngine {

    private static final Logger log = LoggerFactory.getLogger(GovernanceEngine.class);

    static final BigInteger BPS_SCALE = BigInteger.valueOf(10_000);
    public static final long MAX_QUORUM_BPS = 10_000;

    private final GovernanceStore store;
    private final LedgerClock clock;
    private final AdminGate adminGate;
    private final RepeatVotePolicy repeatVotePolicy;

    public GovernanceEngine(GovernanceStore store, LedgerClock clock, AdminGate adminGate,
                            RepeatVotePolicy repeatVotePolicy) {
        this.store            = store;
        this.clock            = clock;
        this.adminGate        = adminGate;
        this.repeatVotePolicy = repeatVotePolicy;
    }

    public Proposal propose(Address proposer, String title, long votingPeriodSeconds) {
        if (votingPeriodSeconds < 0) {
            throw ProtocolException.invalidAmount("voting period must not be negative: " + votingPeriodSeconds);
        }
        return store.inInvocation("propose", () -> {
            long now = clock.now();
            plusSeconds(now, votingPeriodSeconds, "voting period"); // rejects an overflowing window
            Proposal proposal = Proposal.open(store.nextId(), proposer, title, now, votingPeriodSeconds);
            store.saveProposal(proposal);
            log.info("PROPOSAL_CREATED id={} proposer={} votingEnds={}",
                     proposal.id(), proposer, proposal.votingEnds());
            return proposal;
        });
    }

    public Proposal vote(long id, Address voter, boolean support, BigInteger weight) {
        if (!Proposal.fitsTally(weight)) {
            throw ProtocolException.invalidAmount("vote weight outside the signed 128-bit range: " + weight);
        }
        return store.inInvocation("vote", () -> {
            Proposal proposal = require(id);
            long now = clock.now();
            if (!proposal.isVotingOpen(now)) {
                log.info("VOTE_IGNORED id={} voter={} reason=voting_closed votingEnds={} now={}",
                         id, voter, proposal.votingEnds(), now);
                return proposal;
            }

            Proposal base = proposal;
            if (repeatVotePolicy == RepeatVotePolicy.REPLACE) {
                Optional<VoteReceipt> previous = store.getReceipt(id, voter);
                if (previous.isPresent()) {
                    base = proposal.withoutVote(previous.get());
                }
            }
            Proposal updated = base.withVote(support, weight);
            if (!Proposal.fitsTally(updated.forVotes()) || !Proposal.fitsTally(updated.againstVotes())) {
                throw ProtocolException.invalidAmount("tally overflow on proposal " + id);
            }

            store.saveReceipt(id, new VoteReceipt(voter, support, weight));
            store.saveProposal(updated);
            log.info("VOTE_CAST id={} voter={} support={} weight={} for={} against={}",
                     id, voter, support, weight, updated.forVotes(), updated.againstVotes());
            return updated;
        });
    }

    public Proposal queue(long id) {
        return store.inInvocation("queue", () -> {
            Proposal proposal = require(id);
            long now = clock.now();
            long quorumBps = store.getQuorumBps();
            boolean quorum = hasQuorum(proposal, quorumBps);

            if (quorum && now >= proposal.votingEnds()) {
                Proposal queued = proposal.withQueuedUntil(plusSeconds(now, store.getTimelock(), "timelock"));
                store.saveProposal(queued);
                log.info("PROPOSAL_QUEUED id={} queuedUntil={}", id, queued.queuedUntil());
                return queued;
            }
            log.info("QUEUE_DEFERRED id={} quorum={} quorumBps={} votingEnds={} now={}",
                     id, quorum, quorumBps, proposal.votingEnds(), now);
            return proposal;
        });
    }

    public Proposal execute(long id) {
        return store.inInvocation("execute", () -> {
            Proposal proposal = require(id);
            long now = clock.now();
            if (proposal.executed()) {
                return proposal;
            }
            if (proposal.isQueued() && now >= proposal.queuedUntil()) {
                Proposal executed = proposal.asExecuted();
                store.saveProposal(executed);
                log.info("PROPOSAL_EXECUTED id={} at={}", id, now);
                return executed;
            }
            log.info("EXECUTE_DEFERRED id={} queuedUntil={} now={}", id, proposal.queuedUntil(), now);
            return proposal;
        });
    }

    /** Records a delegation. Tallies do not consult it. */
    public void delegate(Address from, Address to) {
        store.inInvocation("delegate", () -> {
            store.setDelegate(from, to);
            log.info("DELEGATION_SET from={} to={}", from, to);
            return null;
        });
    }

    public Optional<Address> getDelegate(Address from) {
        return store.getDelegate(from);
    }

    // ── admin-gated tunables ──────────────────────────────────────────────────

    public void setQuorumBps(Address caller, long bps) {
        store.inInvocation("set_quorum_bps", () -> {
            adminGate.requireAdmin(caller);
            if (bps < 0 || bps > MAX_QUORUM_BPS) {
                throw ProtocolException.invalidAmount("quorum bps must be within [0, 10000]: " + bps);
            }
            store.setQuorumBps(bps);
            log.info("QUORUM_BPS_SET bps={} caller={}", bps, caller);
            return null;
        });
    }

    public void setTimelock(Address caller, long seconds) {
        store.inInvocation("set_timelock", () -> {
            adminGate.requireAdmin(caller);
            if (seconds < 0) {
                throw ProtocolException.invalidAmount("timelock must not be negative: " + seconds);
            }
            store.setTimelock(seconds);
            log.info("TIMELOCK_SET seconds={} caller={}", seconds, caller);
            return null;
        });
    }

    // ── reads ─────────────────────────────────────────────────────────────────

    public Proposal getProposal(long id) {
        return require(id);
    }

    public ProposalState state(Proposal proposal) {
        return proposal.state(clock.now());
    }

    public Optional<VoteReceipt> getReceipt(long id, Address voter) {
        require(id);
        return store.getReceipt(id, voter);
    }

    public List<VoteReceipt> getReceipts(long id) {
        require(id);
        return store.getReceipts(id);
    }

    public long getQuorumBps() {
        return store.getQuorumBps();
    }

    public long getTimelock() {
        return store.getTimelock();
    }

    /** Ledger time {@code seconds} after {@code now}; a sum past {@code Long.MAX_VALUE} is rejected. */
    private static long plusSeconds(long now, long seconds, String what) {
        try {
            return Math.addExact(now, seconds);
        } catch (ArithmeticException e) {
            throw ProtocolException.invalidAmount(what + " of " + seconds + "s overflows the ledger clock at " + now);
        }
    }

    /**
     * Quorum test on the cast votes. Zero total never reaches quorum.
     */
    static boolean hasQuorum(Proposal proposal, long quorumBps) {
        BigInteger total = proposal.totalVotes();
        if (total.signum() == 0) {
            return false;
        }
        BigInteger forShareBps = proposal.forVotes().multiply(BPS_SCALE).divide(total);
        return forShareBps.compareTo(BigInteger.valueOf(quorumBps)) >= 0;
    }

    private Proposal require(long id) {
        return store.getProposal(id)
            .orElseThrow(() -> ProtocolException.notFound("proposal " + id + " does not exist"));
    }
}
