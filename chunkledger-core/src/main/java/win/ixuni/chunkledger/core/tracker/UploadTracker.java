package win.ixuni.chunkledger.core.tracker;

import win.ixuni.chunkledger.core.model.CompletedPart;
import win.ixuni.chunkledger.core.model.UploadStatus;

import java.util.Collection;

/**
 * Upload tracking store
 * <p>
 * Keeps, per upload key, the object-store session id, the declared part count and the parts
 * received so far. Every implementation must be safe for concurrent use: mutations appear
 * atomic and concurrent {@link #addPart} calls for different part numbers are never lost.
 * <p>
 * A record lives from {@link #createUpload} until {@link #completeUpload} or {@link #abortUpload}.
 */
public interface UploadTracker {

    /**
     * Start tracking an upload
     *
     * @param key        upload key, must not be empty
     * @param uploadId   session id issued by the object store
     * @param totalParts declared number of parts (1-10000)
     * @throws win.ixuni.chunkledger.core.exception.InvalidUploadArgumentException on empty key or bad part count
     * @throws win.ixuni.chunkledger.core.exception.UploadAlreadyExistsException   if the key is already tracked
     */
    void createUpload(String key, String uploadId, int totalParts);

    /**
     * Record a received part. Re-adding a part number replaces its integrity tag.
     *
     * @throws win.ixuni.chunkledger.core.exception.UploadNotFoundException if the key is not tracked
     */
    void addPart(String key, int partNumber, String etag);

    /**
     * Stop tracking a finished upload. Completeness is not checked here; see {@link #getStatus}.
     *
     * @throws win.ixuni.chunkledger.core.exception.UploadNotFoundException if the key is not tracked
     */
    void completeUpload(String key);

    /**
     * Stop tracking an upload. Never fails, absent keys are ignored.
     */
    void abortUpload(String key);

    /**
     * @throws win.ixuni.chunkledger.core.exception.UploadNotFoundException if the key is not tracked
     */
    String getUploadId(String key);

    /**
     * Parts received so far, in no particular order
     *
     * @throws win.ixuni.chunkledger.core.exception.UploadNotFoundException if the key is not tracked
     */
    Collection<CompletedPart> getParts(String key);

    /**
     * @throws win.ixuni.chunkledger.core.exception.UploadNotFoundException if the key is not tracked
     */
    UploadStatus getStatus(String key);
}
