package com.polybot.mm.events;

import java.time.Instant;

public final class NoopMmEventPublisher implements MmEventPublisher {

  @Override
  public boolean isEnabled() {
    return false;
  }

  @Override
  public void publish(Instant ts, String type, String key, Object data) {
  }
}
