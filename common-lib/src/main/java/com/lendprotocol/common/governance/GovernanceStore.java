package com.lendprotocol.common.governance;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lendprotocol.common.model.Address;
import com.lendprotocol.common.model.Proposal;
import com.lendprotocol.common.model.VoteReceipt;
import com.lendprotocol.common.store.PersistentKv;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * CRUD over proposals, vote receipts, delegations and the two governance tunables.
 * Tunables fall back to their defaults until first written.
 */
public class GovernanceStore {

    public static final long DEFAULT_QUORUM_BPS       = 1000;
    public static final long DEFAULT_TIMELOCK_SECONDS = 60;

    private static final TypeReference<LinkedHashMap<Long, Proposal>> PROPOSAL_MAP =
        new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, VoteReceipt>> RECEIPT_MAP =
        new TypeReference<>() {};

    private final PersistentKv kv;

    public GovernanceStore(PersistentKv kv) {
        this.kv = kv;
    }

    public <T> T inInvocation(String operation, Supplier<T> work) {
        return kv.atomically(operation, work);
    }

    /** Increments the proposal counter and returns the new value; the first id is 1. */
    public long nextId() {
        long id = kv.get(GovernanceKeys.counter(), Long.class).orElse(0L) + 1;
        kv.set(GovernanceKeys.counter(), id);
        return id;
    }

    public void saveProposal(Proposal proposal) {
        Map<Long, Proposal> proposals = loadProposals();
        proposals.put(proposal.id(), proposal);
        kv.set(GovernanceKeys.proposals(), proposals);
    }

    public Optional<Proposal> getProposal(long id) {
        return Optional.ofNullable(loadProposals().get(id));
    }

    public void saveReceipt(long proposalId, VoteReceipt receipt) {
        Map<String, VoteReceipt> receipts = loadReceipts(proposalId);
        receipts.put(receipt.voter().value(), receipt);
        kv.set(GovernanceKeys.receipts(proposalId), receipts);
    }

    public Optional<VoteReceipt> getReceipt(long proposalId, Address voter) {
        return Optional.ofNullable(loadReceipts(proposalId).get(voter.value()));
    }

    public List<VoteReceipt> getReceipts(long proposalId) {
        return List.copyOf(loadReceipts(proposalId).values());
    }

    public long getQuorumBps() {
        return kv.get(GovernanceKeys.quorumBps(), Long.class).orElse(DEFAULT_QUORUM_BPS);
    }

    public void setQuorumBps(long bps) {
        kv.set(GovernanceKeys.quorumBps(), bps);
    }

    public long getTimelock() {
        return kv.get(GovernanceKeys.timelock(), Long.class).orElse(DEFAULT_TIMELOCK_SECONDS);
    }

    public void setTimelock(long seconds) {
        kv.set(GovernanceKeys.timelock(), seconds);
    }

    public void setDelegate(Address from, Address to) {
        kv.set(GovernanceKeys.delegation(from), to);
    }

    public Optional<Address> getDelegate(Address from) {
        return kv.get(GovernanceKeys.delegation(from), Address.class);
    }

    private Map<Long, Proposal> loadProposals() {
        return kv.get(GovernanceKeys.proposals(), PROPOSAL_MAP).orElseGet(LinkedHashMap::new);
    }

    private Map<String, VoteReceipt> loadReceipts(long proposalId) {
        return kv.get(GovernanceKeys.receipts(proposalId), RECEIPT_MAP).orElseGet(LinkedHashMap::new);
    }
}
