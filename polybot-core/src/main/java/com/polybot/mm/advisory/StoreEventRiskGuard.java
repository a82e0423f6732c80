package com.polybot.mm.advisory;

import com.polybot.mm.store.MmStore;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.Set;

/**
 * Reads the guard's verdicts from the shared bot status table, where the event-risk watcher publishes them
 * ({@code guard_kill_list} and {@code guard_warning_list}, both JSON arrays of market ids).
 */
@RequiredArgsConstructor
public class StoreEventRiskGuard implements EventRiskGuard {

  public static final String WARNING_LIST_KEY = "guard_warning_list";

  private final @NonNull MmStore store;

  @Override
  public boolean hasWarning(String marketId) {
    return store.botStatusList(WARNING_LIST_KEY).contains(marketId);
  }

  @Override
  public Set<String> killList() {
    return store.guardKillList();
  }
}
