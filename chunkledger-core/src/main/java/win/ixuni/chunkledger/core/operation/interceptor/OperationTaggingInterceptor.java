package win.ixuni.chunkledger.core.operation.interceptor;

import reactor.core.publisher.Mono;
import win.ixuni.chunkledger.core.exception.ChunkLedgerException;
import win.ixuni.chunkledger.core.exception.ObjectStoreException;
import win.ixuni.chunkledger.core.operation.HandlerInterceptor;
import win.ixuni.chunkledger.core.operation.InterceptorChain;
import win.ixuni.chunkledger.core.operation.Operation;
import win.ixuni.chunkledger.core.operation.StoreContext;

/**
 * Wraps backend failures into {@link ObjectStoreException} tagged with the operation name.
 * <p>
 * Errors that are already part of the ChunkLedger hierarchy pass through untouched.
 * Runs outside backend-specific translation interceptors so translated errors are kept.
 */
public class OperationTaggingInterceptor implements HandlerInterceptor {

    public static final String TAG_PREFIX = "store.";

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation, StoreContext context, InterceptorChain<O, R> chain) {
        return chain.proceed(operation, context)
                .onErrorMap(e -> !(e instanceof ChunkLedgerException),
                        e -> new ObjectStoreException(TAG_PREFIX + operation.getOperationName(), e));
    }

    @Override
    public int getOrder() {
        return -50;
    }
}
