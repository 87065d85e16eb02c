package com.smartflow.voice.service;

import com.smartflow.voice.service.cache.ResponseCache;
import com.smartflow.voice.service.session.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Traffic-independent housekeeping: expired cache entries and idle sessions.
 */
@Slf4j
@Component
public class MaintenanceScheduler {

    private final ResponseCache responseCache;
    private final SessionStore sessionStore;

    public MaintenanceScheduler(ResponseCache responseCache, SessionStore sessionStore) {
        this.responseCache = responseCache;
        this.sessionStore = sessionStore;
    }

    @Scheduled(fixedDelayString = "${smartflow.cache.purge-interval:PT1M}",
            initialDelayString = "${smartflow.cache.purge-interval:PT1M}")
    public void purgeResponseCache() {
        long purged = responseCache.purgeExpired();
        if (purged > 0) {
            log.info("Purged {} expired response cache entries", purged);
        }
    }

    @Scheduled(fixedDelayString = "${smartflow.session.sweep-interval:PT5M}",
            initialDelayString = "${smartflow.session.sweep-interval:PT5M}")
    public void sweepSessions() {
        int removed = sessionStore.sweep();
        if (removed > 0) {
            log.info("Swept {} idle sessions, {} active", removed, sessionStore.size());
        }
    }
}
