package com.z254.campusvoice.voice.realtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the registry liveness sweep on a fixed delay, independent of requests.
 * Stops together with the application's task scheduler.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "campusvoice.realtime", name = "sweep-enabled", havingValue = "true", matchIfMissing = true)
public class RealtimeSweepScheduler {

    private final BroadcastRegistry registry;

    public RealtimeSweepScheduler(BroadcastRegistry registry) {
        this.registry = registry;
    }

    @Scheduled(fixedDelayString = "${campusvoice.realtime.sweep-interval:PT5M}",
               initialDelayString = "${campusvoice.realtime.sweep-interval:PT5M}")
    public void sweep() {
        if (registry.isClosed()) {
            return;
        }
        try {
            int removed = registry.sweep();
            if (removed > 0) {
                log.info("Liveness sweep removed {} stale channels", removed);
            }
        } catch (RuntimeException e) {
            log.error("Liveness sweep failed", e);
        }
    }
}
