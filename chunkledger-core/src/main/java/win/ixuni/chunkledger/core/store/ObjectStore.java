package win.ixuni.chunkledger.core.store;

import reactor.core.publisher.Mono;
import win.ixuni.chunkledger.core.operation.Operation;
import win.ixuni.chunkledger.core.operation.OperationHandlerRegistry;
import win.ixuni.chunkledger.core.operation.StoreContext;

/**
 * Object store interface
 * <p>
 * Command-pattern architecture: every call (put/get/delete an object, start/upload/complete/abort
 * a chunked upload) is an {@link Operation} executed via {@link #execute(Operation)}.
 * Each backend registers its own handlers with the registry.
 */
public interface ObjectStore {

    // ==================== Core Methods ====================

    OperationHandlerRegistry getHandlerRegistry();

    StoreContext getStoreContext();

    /**
     * Execute an operation
     * <p>
     * Unified entry point for all object store operations, with interceptor chain support.
     *
     * @param operation the operation instance
     * @param <O>       operation type
     * @param <R>       result type
     * @return operation result
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, getStoreContext());
    }

    // ==================== Store Metadata ====================

    /**
     * @return store type (e.g. "s3", "memory")
     */
    String getStoreType();

    /**
     * @return instance name (as specified in configuration)
     */
    String getStoreName();

    Mono<Void> initialize();

    /**
     * Shut down the store and release resources
     */
    Mono<Void> shutdown();
}
