package com.surveylauncher.backend.modules.authorization.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class PermissionCacheMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(PermissionCacheMaintenanceScheduler.class);

    private final AuthorizationService authorizationService;

    public PermissionCacheMaintenanceScheduler(AuthorizationService authorizationService) {
        this.authorizationService = authorizationService;
    }

    @Scheduled(fixedDelayString = "${app.authorization.cache.cleanup-interval:PT5M}")
    public void cleanupExpiredEntries() {
        try {
            int removed = authorizationService.cleanupExpiredCache();
            if (removed > 0) {
                log.info("Removed {} expired permission cache entries", removed);
            }
        } catch (RuntimeException ex) {
            log.error("Permission cache cleanup failed", ex);
        }
    }
}
