package com.polybot.mm.strategy.loop;

import com.polybot.mm.config.MmProperties;
import com.polybot.mm.store.QuoteRecord;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs {@link MarketMakingCycle} on a single scheduler thread, which is the only thread that touches quote and
 * inventory state. On shutdown every live quote is cancelled from that same thread.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MarketMakingLoop {

    private static final long SHUTDOWN_CANCEL_TIMEOUT_SECONDS = 30;

    private final @NonNull MmProperties properties;
    private final @NonNull MarketMakingCycle cycle;

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "mm-loop");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean started;

    @PostConstruct
    void startIfEnabled() {
        if (!properties.enabled()) {
            log.info("market maker is disabled (mm.enabled=false)");
            return;
        }
        if (properties.markets().isEmpty()) {
            log.warn("market maker enabled but no markets configured under mm.markets");
        }
        long period = properties.quoting().cycleSeconds();
        executor.execute(this::safeInitialize);
        executor.scheduleWithFixedDelay(this::safeTick, period, period, TimeUnit.SECONDS);
        started = true;
        log.info("market maker started (mode={}, markets={}, cycleSeconds={})", properties.mode(),
                properties.markets().size(), period);
    }

    public boolean isRunning() {
        return started && !executor.isShutdown();
    }

    @PreDestroy
    void shutdown() {
        log.info("market maker shutting down");
        if (started) {
            Future<?> cancel = executor.submit(() -> cycle.cancelAll(QuoteRecord.CANCELLED));
            try {
                cancel.get(SHUTDOWN_CANCEL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("interrupted while cancelling quotes on shutdown");
            } catch (ExecutionException e) {
                log.error("cancelling quotes on shutdown failed", e.getCause());
            } catch (TimeoutException e) {
                log.warn("cancelling quotes on shutdown timed out after {}s", SHUTDOWN_CANCEL_TIMEOUT_SECONDS);
            }
        }
        executor.shutdownNow();
    }

    private void safeInitialize() {
        try {
            cycle.initialize(properties.markets());
        } catch (Exception e) {
            log.error("MM startup recovery failed, quoting from an empty book", e);
        }
    }

    void safeTick() {
        try {
            cycle.run(properties.markets());
        } catch (Exception e) {
            log.error("MM cycle {} failed, continuing scheduler loop", cycle.cycle(), e);
        }
    }
}
