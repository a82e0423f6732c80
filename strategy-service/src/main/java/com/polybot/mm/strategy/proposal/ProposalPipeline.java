package com.polybot.mm.strategy.proposal;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of proposal stages. The post-only clamp always runs last against the book passed to
 * {@link #run}; it cannot be added as an ordinary stage.
 */
public final class ProposalPipeline {

    private final List<ProposalStage> stages = new ArrayList<>();

    public ProposalPipeline add(ProposalStage stage) {
        if (stage instanceof ProposalStages.PostOnlyStage) {
            throw new IllegalStateException("post-only is always the final stage and cannot be added explicitly");
        }
        stages.add(stage);
        return this;
    }

    public int size() {
        return stages.size();
    }

    public QuoteProposal run(QuoteProposal proposal, double bestBid, double bestAsk) {
        QuoteProposal current = proposal;
        for (ProposalStage stage : stages) {
            current = stage.apply(current);
        }
        return ProposalStages.postOnly(bestBid, bestAsk).apply(current);
    }
}
