package com.ruach.formation.bootstrap.config;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.ruach.formation.application.guard.DeduplicationService;
import com.ruach.formation.application.guard.FormationDataCache;
import com.ruach.formation.application.service.AxiomUnlockResult;
import com.ruach.formation.application.service.SubmissionResult;

/**
 * Periodically evicts expired dedup records and cache entries so that
 * in-memory stores do not grow with every idempotency key ever seen.
 */
@Component
public class GuardHousekeeping {

    private static final Logger log = LoggerFactory.getLogger(GuardHousekeeping.class);

    private final DeduplicationService<SubmissionResult> deduplicationService;
    private final FormationDataCache<List<AxiomUnlockResult>> axiomStatusCache;

    public GuardHousekeeping(DeduplicationService<SubmissionResult> deduplicationService,
            FormationDataCache<List<AxiomUnlockResult>> axiomStatusCache) {
        this.deduplicationService = deduplicationService;
        this.axiomStatusCache = axiomStatusCache;
    }

    @Scheduled(fixedDelayString = "${formation.housekeeping.interval-ms:60000}")
    public void evictExpired() {
        int evicted = deduplicationService.cleanup();
        axiomStatusCache.cleanup();
        if (evicted > 0) {
            log.info("action=dedup_cleanup evicted={}", evicted);
        }
    }
}
