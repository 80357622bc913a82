package win.ixuni.chunkledger.core.exception;

/**
 * Object not found exception
 */
public class ObjectNotFoundException extends ChunkLedgerException {

    public ObjectNotFoundException(String path) {
        super("NoSuchKey", "The specified object does not exist: " + path, 404);
    }
}
