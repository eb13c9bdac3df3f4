package com.lendprotocol.common.model;

/**
 * Lifecycle position of a {@link Proposal}, derived from its fields and the ledger time.
 *
 * <ul>
 *   <li>{@link #PENDING}       – voting window still open ({@code now < votingEnds}).</li>
 *   <li>{@link #VOTING_CLOSED} – window closed, not queued. A proposal that never reaches
 *       quorum stays here forever; there is no rejected state.</li>
 *   <li>{@link #QUEUED}        – quorum reached, waiting for the timelock to elapse.</li>
 *   <li>{@link #EXECUTED}      – terminal.</li>
 * </ul>
 */
public enum ProposalState {
    PENDING,
    VOTING_CLOSED,
    QUEUED,
    EXECUTED
}
