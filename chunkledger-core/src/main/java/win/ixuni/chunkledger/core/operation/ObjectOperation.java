package win.ixuni.chunkledger.core.operation;

/**
 * Operation addressing a single object path
 *
 * @param <R> operation result type
 */
public interface ObjectOperation<R> extends Operation<R> {

    /**
     * @return object path inside the store
     */
    String getPath();
}
