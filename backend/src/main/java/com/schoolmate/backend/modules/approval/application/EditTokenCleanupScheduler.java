package com.schoolmate.backend.modules.approval.application;

import com.schoolmate.backend.modules.permission.application.CallerContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class EditTokenCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(EditTokenCleanupScheduler.class);

    private final EditTokenService editTokenService;

    public EditTokenCleanupScheduler(EditTokenService editTokenService) {
        this.editTokenService = editTokenService;
    }

    @Scheduled(cron = "${schoolmate.approval.cleanup-cron:0 30 3 * * *}", zone = "UTC")
    public void purgeStaleTokens() {
        int deleted = editTokenService.cleanupExpired(CallerContext.system());
        if (deleted > 0) {
            log.info("Purged {} stale edit tokens", deleted);
        }
    }
}
