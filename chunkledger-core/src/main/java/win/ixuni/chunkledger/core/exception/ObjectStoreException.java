package win.ixuni.chunkledger.core.exception;

import lombok.Getter;

/**
 * Object store failure
 * <p>
 * Wraps an error raised by an object store backend. The message is prefixed with the
 * operation tag (e.g. {@code store.UploadChunk}) so the failing call can be identified.
 */
@Getter
public class ObjectStoreException extends ChunkLedgerException {

    private final String operation;

    public ObjectStoreException(String operation, Throwable cause) {
        super("ObjectStoreError", operation + ": " + cause.getMessage(), 502, cause);
        this.operation = operation;
    }

    public ObjectStoreException(String operation, String message) {
        super("ObjectStoreError", operation + ": " + message, 502);
        this.operation = operation;
    }
}
