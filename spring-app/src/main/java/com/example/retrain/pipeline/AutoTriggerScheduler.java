package com.example.retrain.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic automatic policy evaluation, so a stale model is refreshed even when
 * no samples arrive.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "retrain", name = "auto-trigger", havingValue = "true", matchIfMissing = true)
public class AutoTriggerScheduler {

    private final RetrainPipeline pipeline;

    @Scheduled(initialDelayString = "${retrain.check-interval:PT15M}", fixedDelayString = "${retrain.check-interval:PT15M}")
    public void check() {
        pipeline.autoTrigger()
                .subscribe(r -> log.debug("Scheduled retrain check: outcome={}, reason={}", r.outcome(), r.reason()),
                        e -> log.error("Scheduled retrain check failed", e));
    }
}
