package net.revivatech.boot.scheduler;

import java.time.Duration;
import net.revivatech.application.preview.PreviewManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes expired previews so storage does not grow with abandoned drafts.
 */
@Component
public class PreviewExpiryScheduler {

    private static final Logger log = LoggerFactory.getLogger(PreviewExpiryScheduler.class);
    private static final Duration PURGE_TIMEOUT = Duration.ofSeconds(30);

    private final PreviewManager previewManager;

    public PreviewExpiryScheduler(PreviewManager previewManager) {
        this.previewManager = previewManager;
    }

    /**
     * Runs on {@code pages.preview.purge-cron}.
     */
    @Scheduled(cron = "${pages.preview.purge-cron:0 */15 * * * *}")
    public void runPurge() {
        purgeExpiredPreviews();
    }

    /**
     * Removes expired previews now.
     *
     * <p>Failures are logged at {@code ERROR} and rethrown so the scheduler marks the run as failed.</p>
     *
     * @return number of previews removed
     */
    public int purgeExpiredPreviews() {
        try {
            Integer purged = previewManager.purgeExpired().block(PURGE_TIMEOUT);
            int count = purged == null ? 0 : purged;
            if (count > 0) {
                log.info("Purged {} expired previews", count);
            } else {
                log.debug("No expired previews to purge");
            }
            return count;
        } catch (RuntimeException purgeFailure) {
            log.error("Preview purge failed", purgeFailure);
            throw purgeFailure;
        }
    }
}
