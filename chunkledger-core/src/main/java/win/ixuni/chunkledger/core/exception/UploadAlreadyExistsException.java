package win.ixuni.chunkledger.core.exception;

/**
 * Upload already exists exception
 */
public class UploadAlreadyExistsException extends ChunkLedgerException {

    public UploadAlreadyExistsException(String key) {
        super("UploadAlreadyExists", "An upload is already in progress for key: " + key, 409);
    }
}
