package com.lendprotocol.governance.service;

import com.lendprotocol.common.governance.GovernanceEngine;
import com.lendprotocol.common.model.Address;
import com.lendprotocol.common.model.Proposal;
import com.lendprotocol.common.model.VoteReceipt;
import com.lendprotocol.governance.dto.DelegationResponse;
import com.lendprotocol.governance.dto.ProposalResponse;
import com.lendprotocol.governance.dto.ProposeRequest;
import com.lendprotocol.governance.dto.VoteRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Reactive facade over {@link GovernanceEngine}.
 * The engine serialises invocations behind a lock, so every call is shifted onto the
 * bounded-elastic scheduler instead of blocking a Netty event-loop thread.
 */
@Service
public class GovernanceService {

    private static final Logger log = LoggerFactory.getLogger(GovernanceService.class);

    private final GovernanceEngine engine;

    public GovernanceService(GovernanceEngine engine) {
        this.engine = engine;
    }

    public Mono<ProposalResponse> propose(ProposeRequest request) {
        return call(() -> present(engine.propose(
                Address.of(request.proposer()), request.title(), request.votingPeriodSeconds())))
            .doOnError(e -> log.warn("Propose failed. proposer={} reason={}", request.proposer(), e.getMessage()));
    }

    public Mono<ProposalResponse> getProposal(long id) {
        return call(() -> present(engine.getProposal(id)));
    }

    public Mono<ProposalResponse> vote(long id, VoteRequest request) {
        BigInteger weight = request.weight() == null ? BigInteger.ZERO : request.weight();
        return call(() -> present(engine.vote(id, Address.of(request.voter()), request.support(), weight)))
            .doOnError(e -> log.warn("Vote failed. id={} voter={} reason={}", id, request.voter(), e.getMessage()));
    }

    public Mono<List<VoteReceipt>> getReceipts(long id) {
        return call(() -> engine.getReceipts(id));
    }

    /** Empty when {@code voter} never voted on an existing proposal. */
    public Mono<VoteReceipt> getReceipt(long id, String voter) {
        return call(() -> engine.getReceipt(id, Address.of(voter)).orElse(null));
    }

    public Mono<ProposalResponse> queue(long id) {
        return call(() -> present(engine.queue(id)));
    }

    public Mono<ProposalResponse> execute(long id) {
        return call(() -> present(engine.execute(id)));
    }

    public Mono<DelegationResponse> delegate(String from, String to) {
        return call(() -> {
            engine.delegate(Address.of(from), Address.of(to));
            return new DelegationResponse(from, to);
        });
    }

    /** Empty when {@code from} never delegated. */
    public Mono<DelegationResponse> getDelegate(String from) {
        return call(() -> engine.getDelegate(Address.of(from))
            .map(to -> new DelegationResponse(from, to.value()))
            .orElse(null));
    }

    public Mono<Long> getQuorumBps() {
        return call(engine::getQuorumBps);
    }

    public Mono<Long> setQuorumBps(String caller, long bps) {
        return call(() -> {
            engine.setQuorumBps(callerAddress(caller), bps);
            return engine.getQuorumBps();
        });
    }

    public Mono<Long> getTimelock() {
        return call(engine::getTimelock);
    }

    public Mono<Long> setTimelock(String caller, long seconds) {
        return call(() -> {
            engine.setTimelock(callerAddress(caller), seconds);
            return engine.getTimelock();
        });
    }

    private ProposalResponse present(Proposal proposal) {
        return ProposalResponse.from(proposal, engine.state(proposal));
    }

    /** A missing caller header reaches the admin gate as {@code null} and is rejected there. */
    private static Address callerAddress(String caller) {
        return caller == null || caller.isBlank() ? null : Address.of(caller);
    }

    private static <T> Mono<T> call(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }
}
