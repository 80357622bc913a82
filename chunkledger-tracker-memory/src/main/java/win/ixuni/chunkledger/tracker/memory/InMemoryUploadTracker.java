package win.ixuni.chunkledger.tracker.memory;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.chunkledger.core.exception.InvalidUploadArgumentException;
import win.ixuni.chunkledger.core.exception.UploadAlreadyExistsException;
import win.ixuni.chunkledger.core.exception.UploadNotFoundException;
import win.ixuni.chunkledger.core.model.CompletedPart;
import win.ixuni.chunkledger.core.model.ExpiredUpload;
import win.ixuni.chunkledger.core.model.UploadStatus;
import win.ixuni.chunkledger.core.tracker.ExpirableTracker;
import win.ixuni.chunkledger.core.tracker.UploadTracker;
import win.ixuni.chunkledger.core.util.UploadValidationUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory upload tracker
 * <p>
 * A single read-write lock guards the whole record map: lookups share the read lock, every
 * mutation takes the write lock and therefore excludes all other operations on the store.
 * Critical sections only touch the map, never I/O.
 * <p>
 * Part numbers are not checked against the declared total here; callers validate them before
 * the chunk is sent to the object store.
 * <p>
 * State lives for the process lifetime only.
 */
@Slf4j
public class InMemoryUploadTracker implements UploadTracker, ExpirableTracker {

    private final Map<String, UploadRecord> records = new HashMap<>();
    private final Lock readLock;
    private final Lock writeLock;
    private final Clock clock;

    public InMemoryUploadTracker() {
        this(Clock.systemUTC());
    }

    public InMemoryUploadTracker(Clock clock) {
        ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        this.readLock = lock.readLock();
        this.writeLock = lock.writeLock();
        this.clock = clock;
    }

    // ==================== Mutations (write lock) ====================

    @Override
    public void createUpload(String key, String uploadId, int totalParts) {
        String error = UploadValidationUtils.validateKey(key);
        if (error == null) {
            error = UploadValidationUtils.validateTotalParts(totalParts);
        }
        if (error != null) {
            throw new InvalidUploadArgumentException(error);
        }

        writeLock.lock();
        try {
            if (records.containsKey(key)) {
                throw new UploadAlreadyExistsException(key);
            }
            records.put(key, new UploadRecord(key, uploadId, totalParts, clock.instant()));
        } finally {
            writeLock.unlock();
        }
        log.debug("Tracking upload: key={}, uploadId={}, totalParts={}", key, uploadId, totalParts);
    }

    @Override
    public void addPart(String key, int partNumber, String etag) {
        writeLock.lock();
        try {
            requireRecord(key).putPart(partNumber, etag, clock.instant());
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void completeUpload(String key) {
        writeLock.lock();
        try {
            if (records.remove(key) == null) {
                throw new UploadNotFoundException(key);
            }
        } finally {
            writeLock.unlock();
        }
        log.debug("Upload completed, stopped tracking: {}", key);
    }

    @Override
    public void abortUpload(String key) {
        UploadRecord removed;
        writeLock.lock();
        try {
            removed = records.remove(key);
        } finally {
            writeLock.unlock();
        }
        if (removed != null) {
            log.debug("Upload aborted, stopped tracking: {}", key);
        }
    }

    @Override
    public List<ExpiredUpload> expireIdle(Duration idleFor) {
        Instant cutoff = clock.instant().minus(idleFor);
        List<ExpiredUpload> expired = new ArrayList<>();

        writeLock.lock();
        try {
            Iterator<UploadRecord> it = records.values().iterator();
            while (it.hasNext()) {
                UploadRecord record = it.next();
                if (record.getLastActivity().isBefore(cutoff)) {
                    it.remove();
                    expired.add(new ExpiredUpload(record.getKey(), record.getUploadId()));
                }
            }
        } finally {
            writeLock.unlock();
        }

        if (!expired.isEmpty()) {
            log.info("Expired {} uploads idle for more than {}", expired.size(), idleFor);
        }
        return expired;
    }

    // ==================== Queries (read lock) ====================

    @Override
    public String getUploadId(String key) {
        readLock.lock();
        try {
            return requireRecord(key).getUploadId();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Collection<CompletedPart> getParts(String key) {
        readLock.lock();
        try {
            return requireRecord(key).snapshotParts();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public UploadStatus getStatus(String key) {
        readLock.lock();
        try {
            return requireRecord(key).status();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Number of uploads currently tracked (for monitoring)
     */
    public int activeUploadCount() {
        readLock.lock();
        try {
            return records.size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Caller must hold the read or write lock
     */
    private UploadRecord requireRecord(String key) {
        UploadRecord record = records.get(key);
        if (record == null) {
            throw new UploadNotFoundException(key);
        }
        return record;
    }
}
