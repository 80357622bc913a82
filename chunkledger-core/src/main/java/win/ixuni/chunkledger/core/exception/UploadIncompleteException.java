package win.ixuni.chunkledger.core.exception;

/**
 * Thrown when finalization is requested before every declared part has arrived.
 */
public class UploadIncompleteException extends ChunkLedgerException {

    public UploadIncompleteException(String key, int completedParts, int totalParts) {
        super("IncompleteUpload",
                String.format("Upload '%s' has %d of %d parts", key, completedParts, totalParts),
                409);
    }
}
