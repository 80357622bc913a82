package win.ixuni.chunkledger.boot;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import win.ixuni.chunkledger.core.model.ExpiredUpload;
import win.ixuni.chunkledger.core.tracker.ExpirableTracker;
import win.ixuni.chunkledger.core.upload.ChunkedUploadService;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduled expiry of abandoned uploads
 * <p>
 * Drops tracking records idle for longer than {@code chunkledger.cleanup.idle-timeout} and
 * aborts their object-store sessions. Only registered when {@code chunkledger.cleanup.enabled=true}.
 */
@Slf4j
@RequiredArgsConstructor
public class UploadCleanupScheduler {

    private final ChunkedUploadService uploadService;

    private final ChunkLedgerProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(cron = "${chunkledger.cleanup.cron:0 0 * * * *}")
    public void scheduledCleanup() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous cleanup is still running, skipping this run");
            return;
        }

        try {
            log.info("Starting scheduled upload cleanup...");
            performCleanup();
        } finally {
            running.set(false);
        }
    }

    /**
     * Run a cleanup immediately
     *
     * @return number of expired uploads, or -1 if a cleanup is already running
     */
    public int triggerCleanup() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Cleanup is already running");
            return -1;
        }

        try {
            log.info("Manual upload cleanup triggered...");
            return performCleanup();
        } finally {
            running.set(false);
        }
    }

    private int performCleanup() {
        if (!(uploadService.getTracker() instanceof ExpirableTracker expirable)) {
            log.warn("Tracker {} does not support expiry, skipping cleanup",
                    uploadService.getTracker().getClass().getSimpleName());
            return 0;
        }

        List<ExpiredUpload> expired = expirable.expireIdle(properties.getCleanup().getIdleTimeout());
        for (ExpiredUpload upload : expired) {
            try {
                uploadService.abortSession(upload.getKey(), upload.getUploadId()).block();
                log.info("Aborted abandoned upload: key={}, uploadId={}", upload.getKey(), upload.getUploadId());
            } catch (Exception e) {
                log.error("Failed to abort abandoned upload {}: {}", upload.getKey(), e.getMessage(), e);
            }
        }
        return expired.size();
    }
}
