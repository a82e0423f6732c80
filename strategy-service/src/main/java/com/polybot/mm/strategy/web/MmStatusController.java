package com.polybot.mm.strategy.web;

import com.polybot.mm.config.MmProperties;
import com.polybot.mm.strategy.inventory.InventoryLedger;
import com.polybot.mm.strategy.loop.ActiveQuoteView;
import com.polybot.mm.strategy.loop.MarketMakingCycle;
import com.polybot.mm.strategy.loop.MarketMakingLoop;
import com.polybot.mm.strategy.model.InventorySnapshot;
import com.polybot.mm.strategy.risk.MmRiskManager;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/mm")
@RequiredArgsConstructor
@Slf4j
public class MmStatusController {

  private final @NonNull MmProperties properties;
  private final @NonNull MmRiskManager riskManager;
  private final @NonNull MarketMakingCycle cycle;
  private final @NonNull MarketMakingLoop loop;
  private final @NonNull InventoryLedger inventoryLedger;

  @GetMapping("/status")
  public ResponseEntity<MmStatusResponse> status() {
    return ResponseEntity.ok(new MmStatusResponse(
        properties.mode().name(),
        properties.enabled(),
        loop.isRunning(),
        cycle.cycle(),
        riskManager.isPaused(),
        riskManager.riskMode().name(),
        riskManager.killTriggeredAt().orElse(null),
        riskManager.recoveriesToday(),
        inventoryLedger.totalExposure(),
        inventoryLedger.totalRealizedPnl(),
        cycle.activeQuoteViews(),
        inventoryLedger.snapshots()
    ));
  }

  @PostMapping("/pause")
  public ResponseEntity<PauseResponse> pause(@RequestParam(name = "reason", defaultValue = "manual") String reason) {
    log.warn("pause requested via API: {}", reason);
    riskManager.pause(reason);
    return ResponseEntity.ok(new PauseResponse(riskManager.isPaused(), riskManager.riskMode().name()));
  }

  @PostMapping("/resume")
  public ResponseEntity<PauseResponse> resume() {
    log.info("resume requested via API");
    riskManager.resume();
    return ResponseEntity.ok(new PauseResponse(riskManager.isPaused(), riskManager.riskMode().name()));
  }

  public record MmStatusResponse(
      String mode,
      boolean enabled,
      boolean running,
      long cycle,
      boolean paused,
      String riskMode,
      Instant killTriggeredAt,
      int recoveriesToday,
      double totalExposure,
      double realizedPnl,
      List<ActiveQuoteView> activeQuotes,
      List<InventorySnapshot> inventory
  ) {
  }

  public record PauseResponse(boolean paused, String riskMode) {
  }
}
