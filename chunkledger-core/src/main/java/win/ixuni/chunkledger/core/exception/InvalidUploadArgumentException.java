package win.ixuni.chunkledger.core.exception;

/**
 * Invalid argument exception
 * <p>
 * Raised for caller bugs such as an empty upload key or an out-of-range part count. Never retried.
 */
public class InvalidUploadArgumentException extends ChunkLedgerException {

    public InvalidUploadArgumentException(String message) {
        super("InvalidArgument", message, 400);
    }

    protected InvalidUploadArgumentException(String errorCode, String message) {
        super(errorCode, message, 400);
    }
}
