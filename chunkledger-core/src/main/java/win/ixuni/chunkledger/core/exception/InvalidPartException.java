package win.ixuni.chunkledger.core.exception;

/**
 * The store refused the part list of a finalization: a part is missing, its ETag does not match,
 * the list is out of order or a part is too small. Resending the same list fails the same way.
 */
public class InvalidPartException extends InvalidUploadArgumentException {

    public InvalidPartException(String message) {
        super("InvalidPart", message);
    }
}
