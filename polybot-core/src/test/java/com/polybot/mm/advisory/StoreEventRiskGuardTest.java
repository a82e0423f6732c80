package com.polybot.mm.advisory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.mm.store.InMemoryMmStore;
import com.polybot.mm.store.MmStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StoreEventRiskGuardTest {

  private final MmStore store = new InMemoryMmStore(
      Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneOffset.UTC), new ObjectMapper());
  private final StoreEventRiskGuard guard = new StoreEventRiskGuard(store);

  @Test
  void readsKillAndWarningListsFromBotStatus() {
    store.updateBotStatus(Map.of(
        MmStore.GUARD_KILL_LIST_KEY, List.of("m1"),
        StoreEventRiskGuard.WARNING_LIST_KEY, "[\"m2\"]"));

    assertThat(guard.killList()).containsExactly("m1");
    assertThat(guard.hasWarning("m2")).isTrue();
    assertThat(guard.hasWarning("m1")).isFalse();
  }

  @Test
  void missingListsMeanNoRestrictions() {
    assertThat(guard.killList()).isEmpty();
    assertThat(guard.hasWarning("m1")).isFalse();
  }
}
