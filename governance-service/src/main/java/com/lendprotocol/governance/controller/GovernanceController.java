package com.lendprotocol.governance.controller;

import com.lendprotocol.common.model.VoteReceipt;
import com.lendprotocol.governance.dto.DelegationRequest;
import com.lendprotocol.governance.dto.DelegationResponse;
import com.lendprotocol.governance.dto.ParameterRequest;
import com.lendprotocol.governance.dto.ParameterResponse;
import com.lendprotocol.governance.dto.ProposalResponse;
import com.lendprotocol.governance.dto.ProposeRequest;
import com.lendprotocol.governance.dto.VoteRequest;
import com.lendprotocol.governance.service.GovernanceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST API for the proposal lifecycle and the governance tunables.
 * Admin-gated writes identify the caller through the {@code X-Caller} header.
 */
@RestController
@RequestMapping("/api/v1/governance")
public class GovernanceController {

    private static final Logger log = LoggerFactory.getLogger(GovernanceController.class);

    static final String CALLER_HEADER = "X-Caller";

    private final GovernanceService governanceService;

    public GovernanceController(GovernanceService governanceService) {
        this.governanceService = governanceService;
    }

    @PostMapping("/proposals")
    public Mono<ResponseEntity<ProposalResponse>> propose(@RequestBody ProposeRequest request) {
        log.info("Proposal requested. proposer={} title={} period={}",
                 request.proposer(), request.title(), request.votingPeriodSeconds());
        return governanceService.propose(request)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/proposals/{id}")
    public Mono<ResponseEntity<ProposalResponse>> getProposal(@PathVariable long id) {
        return governanceService.getProposal(id)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/proposals/{id}/votes")
    public Mono<ResponseEntity<ProposalResponse>> vote(@PathVariable long id, @RequestBody VoteRequest request) {
        log.info("Vote requested. id={} voter={} support={} weight={}",
                 id, request.voter(), request.support(), request.weight());
        return governanceService.vote(id, request)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/proposals/{id}/votes")
    public Mono<ResponseEntity<List<VoteReceipt>>> getReceipts(@PathVariable long id) {
        return governanceService.getReceipts(id)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/proposals/{id}/votes/{voter}")
    public Mono<ResponseEntity<VoteReceipt>> getReceipt(@PathVariable long id, @PathVariable String voter) {
        return governanceService.getReceipt(id, voter)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/proposals/{id}/queue")
    public Mono<ResponseEntity<ProposalResponse>> queue(@PathVariable long id) {
        log.info("Queue requested. id={}", id);
        return governanceService.queue(id)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Queue endpoint error. id={}", id, e));
    }

    @PostMapping("/proposals/{id}/execute")
    public Mono<ResponseEntity<ProposalResponse>> execute(@PathVariable long id) {
        log.info("Execute requested. id={}", id);
        return governanceService.execute(id)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Execute endpoint error. id={}", id, e));
    }

    @PutMapping("/delegations/{from}")
    public Mono<ResponseEntity<DelegationResponse>> delegate(@PathVariable String from,
                                                             @RequestBody DelegationRequest request) {
        log.info("Delegation requested. from={} to={}", from, request.to());
        return governanceService.delegate(from, request.to())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/delegations/{from}")
    public Mono<ResponseEntity<DelegationResponse>> getDelegate(@PathVariable String from) {
        return governanceService.getDelegate(from)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/params/quorum-bps")
    public Mono<ResponseEntity<ParameterResponse>> getQuorumBps() {
        return governanceService.getQuorumBps()
            .map(v -> ResponseEntity.ok(new ParameterResponse("quorum-bps", v)));
    }

    @PutMapping("/params/quorum-bps")
    public Mono<ResponseEntity<ParameterResponse>> setQuorumBps(
            @RequestHeader(name = CALLER_HEADER, required = false) String caller,
            @RequestBody ParameterRequest request) {
        log.info("Quorum update requested. caller={} bps={}", caller, request.value());
        return governanceService.setQuorumBps(caller, request.value())
            .map(v -> ResponseEntity.ok(new ParameterResponse("quorum-bps", v)));
    }

    @GetMapping("/params/timelock")
    public Mono<ResponseEntity<ParameterResponse>> getTimelock() {
        return governanceService.getTimelock()
            .map(v -> ResponseEntity.ok(new ParameterResponse("timelock", v)));
    }

    @PutMapping("/params/timelock")
    public Mono<ResponseEntity<ParameterResponse>> setTimelock(
            @RequestHeader(name = CALLER_HEADER, required = false) String caller,
            @RequestBody ParameterRequest request) {
        log.info("Timelock update requested. caller={} seconds={}", caller, request.value());
        return governanceService.setTimelock(caller, request.value())
            .map(v -> ResponseEntity.ok(new ParameterResponse("timelock", v)));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
