package win.ixuni.chunkledger.tracker.memory;

import lombok.Getter;
import win.ixuni.chunkledger.core.model.CompletedPart;
import win.ixuni.chunkledger.core.model.UploadStatus;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracking state of one upload
 * <p>
 * Not thread-safe on its own: every access goes through {@link InMemoryUploadTracker}'s lock.
 */
@Getter
class UploadRecord {

    private final String key;
    private final String uploadId;
    private final int totalParts;
    private final Instant createdAt;

    /**
     * partNumber -> part, one entry per part number
     */
    private final Map<Integer, CompletedPart> parts = new HashMap<>();

    private Instant lastActivity;

    UploadRecord(String key, String uploadId, int totalParts, Instant createdAt) {
        this.key = key;
        this.uploadId = uploadId;
        this.totalParts = totalParts;
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
    }

    /**
     * Insert or overwrite a part (last write wins)
     */
    void putPart(int partNumber, String etag, Instant now) {
        parts.put(partNumber, CompletedPart.of(partNumber, etag));
        lastActivity = now;
    }

    List<CompletedPart> snapshotParts() {
        return List.copyOf(parts.values());
    }

    UploadStatus status() {
        return UploadStatus.of(totalParts, parts.size());
    }
}
