package com.polybot.mm.strategy.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OrderStateTest {

    @Test
    void filledIsTheOnlyTrueTerminalState() {
        for (OrderState target : OrderState.values()) {
            assertThat(OrderState.FILLED.canTransitionTo(target)).isFalse();
        }
    }

    @Test
    void cancelledOrderCanStillReportAFill() {
        assertThat(OrderState.CANCELLED.canTransitionTo(OrderState.FILLED)).isTrue();
        assertThat(OrderState.CANCELLED.canTransitionTo(OrderState.LIVE)).isFalse();
    }

    @Test
    void unknownCanRecoverToAnyVenueState() {
        assertThat(OrderState.UNKNOWN.canTransitionTo(OrderState.LIVE)).isTrue();
        assertThat(OrderState.UNKNOWN.canTransitionTo(OrderState.PARTIAL)).isTrue();
        assertThat(OrderState.UNKNOWN.canTransitionTo(OrderState.NEW)).isFalse();
    }

    @Test
    void mapsVenueStatuses() {
        assertThat(OrderState.fromVenueStatus("live")).isEqualTo(OrderState.LIVE);
        assertThat(OrderState.fromVenueStatus(" MATCHED ")).isEqualTo(OrderState.FILLED);
        assertThat(OrderState.fromVenueStatus("CANCELED")).isEqualTo(OrderState.CANCELLED);
        assertThat(OrderState.fromVenueStatus("EXPIRED")).isEqualTo(OrderState.CANCELLED);
        assertThat(OrderState.fromVenueStatus("weird")).isEqualTo(OrderState.UNKNOWN);
        assertThat(OrderState.fromVenueStatus(null)).isEqualTo(OrderState.UNKNOWN);
    }
}
