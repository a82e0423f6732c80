package com.polybot.mm.strategy.proposal;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ProposalPipelineTest {

    private static QuoteProposal base(double bid, double ask, double size) {
        return ProposalStages.createBase("m1", "yes", bid, ask, size, size, 0.50, 0.50);
    }

    @Test
    void baseOmitsSidesWithoutSize() {
        QuoteProposal proposal = ProposalStages.createBase("m1", "yes", 0.48, 0.52, 10, 0, 0.50, 0);

        assertThat(proposal.getBids()).hasSize(1);
        assertThat(proposal.getAsks()).isEmpty();
        assertThat(proposal.getReservationPrice()).isEqualTo(0.50);
    }

    @Test
    void budgetShrinksFirstOrderThatDoesNotFit() {
        QuoteProposal proposal = ProposalStages.budgetCap(10, 0, 5).apply(base(0.50, 0.52, 100));

        assertThat(proposal.getBids()).singleElement().satisfies(bid -> {
            assertThat(bid.getSize()).isEqualTo(20.0);
            assertThat(bid.cost()).isCloseTo(10.0, within(1e-9));
        });
        assertThat(proposal.getAsks()).isEmpty();
    }

    @Test
    void budgetKeepsOrdersThatFitAndClearsWhenExhausted() {
        QuoteProposal fits = ProposalStages.budgetCap(100, 0, 5).apply(base(0.48, 0.52, 10));
        QuoteProposal exhausted = ProposalStages.budgetCap(50, 60, 5).apply(base(0.48, 0.52, 10));

        assertThat(fits.getBids()).hasSize(1);
        assertThat(fits.getAsks()).hasSize(1);
        assertThat(exhausted.isEmpty()).isTrue();
    }

    @Test
    void extraLevelsSitFurtherOutAndLarger() {
        QuoteProposal proposal = ProposalStages.multiLevel(3, 1.5, 2.0).apply(base(0.48, 0.52, 10));

        assertThat(proposal.getBids()).hasSize(3);
        assertThat(proposal.getBids().get(1).getPrice()).isEqualTo(0.47);
        assertThat(proposal.getBids().get(1).getSize()).isEqualTo(20.0);
        assertThat(proposal.getBids().get(2).getSize()).isEqualTo(40.0);
        assertThat(proposal.getBids().get(2).getPrice()).isLessThan(0.47);
        assertThat(proposal.getAsks().get(1).getPrice()).isEqualTo(0.53);
        assertThat(proposal.getAsks().get(2).getLevel()).isEqualTo(2);
    }

    @Test
    void highVolatilityWidensUpToDouble() {
        QuoteProposal calm = ProposalStages.volatilityWidening(4, 5).apply(base(0.48, 0.52, 10));
        QuoteProposal wild = ProposalStages.volatilityWidening(50, 5).apply(base(0.48, 0.52, 10));

        assertThat(calm.getBids().get(0).getPrice()).isEqualTo(0.48);
        assertThat(wild.getBids().get(0).getPrice()).isEqualTo(0.46);
        assertThat(wild.getAsks().get(0).getPrice()).isEqualTo(0.54);
    }

    @Test
    void eventWarningWidens() {
        QuoteProposal proposal = ProposalStages.eventRisk(true, 50).apply(base(0.48, 0.52, 10));

        assertThat(proposal.getBids().get(0).getPrice()).isEqualTo(0.47);
        assertThat(proposal.getAsks().get(0).getPrice()).isEqualTo(0.53);
    }

    @Test
    void postOnlyRunsLastAndKeepsOrdersOffTheTouch() {
        ProposalPipeline pipeline = new ProposalPipeline()
                .add(ProposalStages.eventRisk(false, 50));

        QuoteProposal crossingBid = pipeline.run(base(0.52, 0.53, 10), 0.49, 0.51);
        QuoteProposal crossingAsk = pipeline.run(base(0.45, 0.48, 10), 0.49, 0.51);

        assertThat(crossingBid.getBids().get(0).getPrice()).isLessThanOrEqualTo(0.50);
        assertThat(crossingBid.getAsks().get(0).getPrice()).isEqualTo(0.53);
        assertThat(crossingAsk.getAsks().get(0).getPrice()).isGreaterThanOrEqualTo(0.50);
    }

    @Test
    void crossedProposalWithoutBookIsSplitAroundItsMid() {
        QuoteProposal proposal = new ProposalPipeline().run(base(0.55, 0.45, 10), 0, 0);

        assertThat(proposal.getBids().get(0).getPrice()).isEqualTo(0.49);
        assertThat(proposal.getAsks().get(0).getPrice()).isEqualTo(0.51);
    }

    @Test
    void postOnlyCannotBeAddedAsAnOrdinaryStage() {
        ProposalPipeline pipeline = new ProposalPipeline();

        assertThatThrownBy(() -> pipeline.add(ProposalStages.postOnly(0.49, 0.51)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(pipeline.size()).isZero();
    }
}
