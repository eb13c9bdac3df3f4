package com.lendprotocol.governance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lendprotocol.common.model.Proposal;
import com.lendprotocol.common.model.ProposalState;

import java.math.BigInteger;

/**
 * Proposal as stored, plus its lifecycle state at the time of the request.
 */
public record ProposalResponse(
    @JsonProperty("id")           long          id,
    @JsonProperty("proposer")     String        proposer,
    @JsonProperty("title")        String        title,
    @JsonProperty("created")      long          created,
    @JsonProperty("votingEnds")   long          votingEnds,
    @JsonProperty("queuedUntil")  long          queuedUntil,
    @JsonProperty("forVotes")     BigInteger    forVotes,
    @JsonProperty("againstVotes") BigInteger    againstVotes,
    @JsonProperty("executed")     boolean       executed,
    @JsonProperty("state")        ProposalState state
) {

    public static ProposalResponse from(Proposal proposal, ProposalState state) {
        return new ProposalResponse(
            proposal.id(),
            proposal.proposer().value(),
            proposal.title(),
            proposal.created(),
            proposal.votingEnds(),
            proposal.queuedUntil(),
            proposal.forVotes(),
            proposal.againstVotes(),
            proposal.executed(),
            state
        );
    }
}
