package com.polybot.mm.strategy.proposal;

@FunctionalInterface
public interface ProposalStage {

    QuoteProposal apply(QuoteProposal proposal);
}
