package com.givehub.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class OneTimeCodeCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(OneTimeCodeCleanupScheduler.class);

    private final OneTimeCodeService oneTimeCodeService;

    public OneTimeCodeCleanupScheduler(OneTimeCodeService oneTimeCodeService) {
        this.oneTimeCodeService = oneTimeCodeService;
    }

    @Scheduled(cron = "${app.otp.cleanup-cron:0 0 * * * *}", zone = "UTC")
    public void purgeExpiredCodes() {
        try {
            int removed = oneTimeCodeService.purgeExpired();
            if (removed > 0) {
                log.info("Removed {} expired one-time codes", removed);
            }
        } catch (RuntimeException ex) {
            log.error("Failed to purge expired one-time codes", ex);
        }
    }
}
