package win.ixuni.chunkledger.core.upload;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.chunkledger.core.exception.InvalidUploadArgumentException;
import win.ixuni.chunkledger.core.exception.ObjectStoreException;
import win.ixuni.chunkledger.core.exception.UploadIncompleteException;
import win.ixuni.chunkledger.core.exception.UploadNotFoundException;
import win.ixuni.chunkledger.core.model.CompletedPart;
import win.ixuni.chunkledger.core.model.ObjectAcl;
import win.ixuni.chunkledger.core.model.StoredObject;
import win.ixuni.chunkledger.core.model.StoredObjectData;
import win.ixuni.chunkledger.core.model.UploadStatus;
import win.ixuni.chunkledger.core.operation.chunked.AbortChunkedUploadOperation;
import win.ixuni.chunkledger.core.operation.chunked.CompleteChunkedUploadOperation;
import win.ixuni.chunkledger.core.operation.chunked.StartChunkedUploadOperation;
import win.ixuni.chunkledger.core.operation.chunked.UploadChunkOperation;
import win.ixuni.chunkledger.core.operation.object.DeleteObjectOperation;
import win.ixuni.chunkledger.core.operation.object.GetObjectOperation;
import win.ixuni.chunkledger.core.operation.object.PutObjectOperation;
import win.ixuni.chunkledger.core.store.ObjectStore;
import win.ixuni.chunkledger.core.tracker.UploadTracker;
import win.ixuni.chunkledger.core.util.UploadValidationUtils;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Chunked upload orchestration
 * <p>
 * Drives a chunked upload against an {@link ObjectStore} and records its progress in an
 * {@link UploadTracker}:
 * <ol>
 * <li>{@link #start} opens a session on the store and creates the tracking record</li>
 * <li>{@link #uploadChunk} validates the part number, pushes the chunk and records its ETag</li>
 * <li>{@link #complete} sorts the recorded parts by part number and finalizes the session</li>
 * <li>{@link #abort} discards the session on both sides</li>
 * </ol>
 * Chunks may arrive in any order and from concurrent callers. Tracker calls are in-memory and
 * never overlap a store call.
 */
@Slf4j
public class ChunkedUploadService {

    public static final int DEFAULT_CONCURRENCY = 4;

    private static final Comparator<CompletedPart> BY_PART_NUMBER =
            Comparator.comparingInt(CompletedPart::getPartNumber);

    @Getter
    private final UploadTracker tracker;

    @Getter
    private final ObjectStore store;

    private final int concurrency;

    /**
     * ACL applied when a caller passes none
     */
    @Getter
    private final ObjectAcl defaultAcl;

    public ChunkedUploadService(UploadTracker tracker, ObjectStore store) {
        this(tracker, store, DEFAULT_CONCURRENCY, ObjectAcl.PRIVATE);
    }

    public ChunkedUploadService(UploadTracker tracker, ObjectStore store, int concurrency, ObjectAcl defaultAcl) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1");
        }
        this.tracker = tracker;
        this.store = store;
        this.concurrency = concurrency;
        this.defaultAcl = defaultAcl != null ? defaultAcl : ObjectAcl.PRIVATE;
    }

    // ==================== Chunked upload ====================

    /**
     * Open a chunked upload for {@code key} and start tracking it
     *
     * @return the session id issued by the store
     */
    public Mono<String> start(String key, String contentType, ObjectAcl acl, int totalParts) {
        String error = firstError(
                UploadValidationUtils.validateKey(key),
                UploadValidationUtils.validateTotalParts(totalParts));
        if (error != null) {
            return Mono.error(new InvalidUploadArgumentException(error));
        }

        var operation = StartChunkedUploadOperation.builder()
                .path(key)
                .contentType(contentType)
                .acl(acl != null ? acl : defaultAcl)
                .build();

        return store.execute(operation)
                .flatMap(upload -> {
                    String uploadId = upload.getUploadId();
                    String idError = UploadValidationUtils.validateUploadId(uploadId);
                    if (idError != null) {
                        return Mono.<String>error(new ObjectStoreException(
                                "store." + operation.getOperationName(), idError));
                    }

                    return Mono.fromRunnable(() -> tracker.createUpload(key, uploadId, totalParts))
                            // the store session is orphaned if tracking fails
                            .onErrorResume(e -> cleanupThenFail(key,
                                    store.execute(new AbortChunkedUploadOperation(key, uploadId)), e))
                            .thenReturn(uploadId);
                })
                .doOnSuccess(uploadId -> log.info("Started chunked upload: key={}, uploadId={}, totalParts={}",
                        key, uploadId, totalParts));
    }

    /**
     * Push one chunk and record it
     *
     * @return the upload status after the chunk was recorded
     */
    public Mono<UploadStatus> uploadChunk(String key, int partNumber, byte[] data) {
        if (data == null || data.length == 0) {
            return Mono.error(new InvalidUploadArgumentException("Chunk is empty"));
        }

        return Mono.fromCallable(() -> {
                    String uploadId = tracker.getUploadId(key);
                    UploadStatus status = tracker.getStatus(key);
                    String error = UploadValidationUtils.validatePartNumber(partNumber, status.getTotalParts());
                    if (error != null) {
                        throw new InvalidUploadArgumentException(error);
                    }
                    return new UploadChunkOperation(key, uploadId, partNumber, data);
                })
                .flatMap(operation -> store.execute(operation))
                .map(chunk -> {
                    tracker.addPart(key, partNumber, chunk.getEtag());
                    UploadStatus status = tracker.getStatus(key);
                    log.debug("Recorded part {} of upload {} ({}/{})",
                            partNumber, key, status.getCompletedPartsCount(), status.getTotalParts());
                    return status;
                });
    }

    /**
     * Finalize the upload once every declared part has been recorded.
     * <p>
     * When the store refuses the part list ({@link InvalidUploadArgumentException}) the upload is
     * aborted on both sides. Any other store failure leaves the tracking record and the store
     * session in place, so {@code complete} can be called again. A {@link UploadNotFoundException}
     * from the store means the session was already finalized or discarded; the record is left to
     * whoever holds it.
     *
     * @throws UploadIncompleteException (as a Mono error) while parts are still missing
     */
    public Mono<StoredObject> complete(String key) {
        return Mono.fromCallable(() -> {
                    UploadStatus status = tracker.getStatus(key);
                    if (!status.isCompleted()) {
                        throw new UploadIncompleteException(key,
                                status.getCompletedPartsCount(), status.getTotalParts());
                    }
                    String uploadId = tracker.getUploadId(key);
                    return new CompleteChunkedUploadOperation(key, uploadId, sortParts(tracker.getParts(key)));
                })
                .flatMap(operation -> store.execute(operation)
                        .onErrorResume(e -> finalizeFailed(key, operation.getUploadId(), e))
                        .flatMap(object -> Mono.fromRunnable(() -> tracker.completeUpload(key))
                                .thenReturn(object)))
                .doOnSuccess(object -> log.info("Completed chunked upload: key={}", key));
    }

    /**
     * Abort the upload on the store and stop tracking it. A key that is not tracked is a no-op.
     */
    public Mono<Void> abort(String key) {
        return Mono.fromCallable(() -> tracker.getUploadId(key))
                .onErrorResume(UploadNotFoundException.class, e -> {
                    log.debug("Abort requested for untracked upload: {}", key);
                    return Mono.empty();
                })
                .flatMap(uploadId -> abortBoth(key, uploadId)
                        .doOnSuccess(v -> log.info("Aborted chunked upload: key={}, uploadId={}", key, uploadId)));
    }

    /**
     * Abort the store session of an upload the tracker no longer knows about
     */
    public Mono<Void> abortSession(String key, String uploadId) {
        return store.execute(new AbortChunkedUploadOperation(key, uploadId));
    }

    public Mono<UploadStatus> status(String key) {
        return Mono.fromCallable(() -> tracker.getStatus(key));
    }

    /**
     * Split {@code data} into {@code partSize} chunks, upload them and finalize.
     * Any failure aborts the whole upload.
     */
    public Mono<StoredObject> uploadAll(String key, byte[] data, long partSize,
                                        String contentType, ObjectAcl acl) {
        int totalParts;
        try {
            totalParts = PartSizing.partCount(data == null ? 0 : data.length, partSize);
        } catch (InvalidUploadArgumentException e) {
            return Mono.error(e);
        }

        return start(key, contentType, acl, totalParts)
                .flatMap(uploadId -> Flux.range(1, totalParts)
                        .flatMap(part -> uploadChunk(key, part, PartSizing.slice(data, part, partSize)),
                                concurrency)
                        .then(complete(key))
                        .onErrorResume(e -> cleanupThenFail(key, abort(key), e)));
    }

    // ==================== Whole objects ====================

    public Mono<StoredObject> putObject(String path, byte[] data, String contentType, ObjectAcl acl) {
        String error = UploadValidationUtils.validateKey(path);
        if (error == null && data == null) {
            error = "File is empty";
        }
        if (error != null) {
            return Mono.error(new InvalidUploadArgumentException(error));
        }
        return store.execute(PutObjectOperation.builder()
                .path(path)
                .content(data)
                .contentType(contentType)
                .acl(acl != null ? acl : defaultAcl)
                .build());
    }

    public Mono<StoredObjectData> getObject(String path) {
        return store.execute(new GetObjectOperation(path));
    }

    public Mono<Void> deleteObject(String path) {
        return store.execute(new DeleteObjectOperation(path));
    }

    // ==================== Helpers ====================

    /**
     * Parts in ascending part-number order, as required for finalization
     */
    public static List<CompletedPart> sortParts(Collection<CompletedPart> parts) {
        return parts.stream().sorted(BY_PART_NUMBER).toList();
    }

    private <T> Mono<T> finalizeFailed(String key, String uploadId, Throwable error) {
        if (error instanceof InvalidUploadArgumentException) {
            log.warn("Store refused to finalize upload {}, aborting: {}", key, error.getMessage());
            return cleanupThenFail(key, abortBoth(key, uploadId), error);
        }
        log.warn("Finalizing upload {} failed, session kept: {}", key, error.getMessage());
        return Mono.error(error);
    }

    private Mono<Void> abortBoth(String key, String uploadId) {
        Mono<Void> untrack = Mono.fromRunnable(() -> tracker.abortUpload(key));
        return store.execute(new AbortChunkedUploadOperation(key, uploadId))
                .onErrorResume(e -> untrack.then(Mono.error(e)))
                .then(untrack);
    }

    /**
     * Run a cleanup step and re-emit the original failure. Cleanup errors are logged and
     * attached as suppressed, never replacing the original.
     */
    private <T> Mono<T> cleanupThenFail(String key, Mono<Void> cleanup, Throwable original) {
        return cleanup
                .onErrorResume(cleanupError -> {
                    log.warn("Cleanup of upload {} failed: {}", key, cleanupError.getMessage());
                    if (cleanupError != original) {
                        original.addSuppressed(cleanupError);
                    }
                    return Mono.empty();
                })
                .then(Mono.error(original));
    }

    private static String firstError(String... errors) {
        for (String error : errors) {
            if (error != null) {
                return error;
            }
        }
        return null;
    }
}
