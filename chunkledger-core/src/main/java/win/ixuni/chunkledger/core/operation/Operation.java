package win.ixuni.chunkledger.core.operation;

/**
 * Object store operation
 * <p>
 * Every object store call (PutObject, UploadChunk, ...) is a separate command class so that
 * each backend registers one handler per supported operation.
 *
 * @param <R> operation result type
 */
public interface Operation<R> {

    /**
     * Get the operation name (for logging and error tagging)
     *
     * @return operation name, e.g. "PutObject", "UploadChunk"
     */
    default String getOperationName() {
        String className = getClass().getSimpleName();
        // Remove "Operation" suffix
        if (className.endsWith("Operation")) {
            return className.substring(0, className.length() - 9);
        }
        return className;
    }
}
