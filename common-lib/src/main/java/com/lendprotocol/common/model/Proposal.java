package com.lendprotocol.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Governance proposal. Immutable: every transition returns a new instance that the
 * engine writes back to storage.
 *
 * <p>{@code queuedUntil == 0} means "not queued". Tallies are signed 128-bit quantities:
 * {@link #MIN_TALLY} to {@link #MAX_TALLY} inclusive.
 */
public record Proposal(
    @JsonProperty("id")           long       id,
    @JsonProperty("proposer")     Address    proposer,
    @JsonProperty("title")        String     title,
    @JsonProperty("created")      long       created,
    @JsonProperty("votingEnds")   long       votingEnds,
    @JsonProperty("queuedUntil")  long       queuedUntil,
    @JsonProperty("forVotes")     BigInteger forVotes,
    @JsonProperty("againstVotes") BigInteger againstVotes,
    @JsonProperty("executed")     boolean    executed
) {

    public static final BigInteger MAX_TALLY = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
    public static final BigInteger MIN_TALLY = BigInteger.ONE.shiftLeft(127).negate();

    /** @throws ArithmeticException if {@code now + votingPeriodSeconds} overflows */
    public static Proposal open(long id, Address proposer, String title, long now, long votingPeriodSeconds) {
        return new Proposal(id, proposer, title, now, Math.addExact(now, votingPeriodSeconds), 0L,
                            BigInteger.ZERO, BigInteger.ZERO, false);
    }

    public Proposal withVote(boolean support, BigInteger weight) {
        return support
            ? new Proposal(id, proposer, title, created, votingEnds, queuedUntil,
                           forVotes.add(weight), againstVotes, executed)
            : new Proposal(id, proposer, title, created, votingEnds, queuedUntil,
                           forVotes, againstVotes.add(weight), executed);
    }

    /** Takes a previously counted vote back out of the tally. */
    public Proposal withoutVote(VoteReceipt receipt) {
        return withVote(receipt.support(), receipt.weight().negate());
    }

    public Proposal withQueuedUntil(long until) {
        return new Proposal(id, proposer, title, created, votingEnds, until,
                            forVotes, againstVotes, executed);
    }

    public Proposal asExecuted() {
        return new Proposal(id, proposer, title, created, votingEnds, queuedUntil,
                            forVotes, againstVotes, true);
    }

    public static boolean fitsTally(BigInteger value) {
        return value.compareTo(MIN_TALLY) >= 0 && value.compareTo(MAX_TALLY) <= 0;
    }

    public BigInteger totalVotes() {
        return forVotes.add(againstVotes);
    }

    @JsonIgnore
    public boolean isQueued() {
        return queuedUntil != 0L;
    }

    public boolean isVotingOpen(long now) {
        return now <= votingEnds;
    }

    public ProposalState state(long now) {
        if (executed)        return ProposalState.EXECUTED;
        if (isQueued())      return ProposalState.QUEUED;
        if (now < votingEnds) return ProposalState.PENDING;
        return ProposalState.VOTING_CLOSED;
    }
}
