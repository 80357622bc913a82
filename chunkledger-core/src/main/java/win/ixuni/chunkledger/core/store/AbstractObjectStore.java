package win.ixuni.chunkledger.core.store;

import lombok.Getter;
import win.ixuni.chunkledger.core.operation.OperationHandlerRegistry;
import win.ixuni.chunkledger.core.operation.interceptor.LoggingInterceptor;
import win.ixuni.chunkledger.core.operation.interceptor.OperationTaggingInterceptor;

/**
 * Abstract base class for object stores
 * <p>
 * Installs the common interceptors; subclasses register their handlers and any
 * backend-specific interceptors.
 */
public abstract class AbstractObjectStore implements ObjectStore {

    @Getter
    protected final OperationHandlerRegistry handlerRegistry = new OperationHandlerRegistry();

    protected AbstractObjectStore() {
        handlerRegistry.addInterceptor(new LoggingInterceptor());
        handlerRegistry.addInterceptor(new OperationTaggingInterceptor());
    }
}
