package win.ixuni.chunkledger.core.exception;

/**
 * No tracking record, or no store session, exists for the upload
 */
public class UploadNotFoundException extends ChunkLedgerException {

    public UploadNotFoundException(String key) {
        super("NoSuchUpload", "The specified upload does not exist: " + key, 404);
    }
}
