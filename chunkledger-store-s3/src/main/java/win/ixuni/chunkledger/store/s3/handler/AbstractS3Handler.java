package win.ixuni.chunkledger.store.s3.handler;

import reactor.core.publisher.Mono;
import win.ixuni.chunkledger.core.operation.Operation;
import win.ixuni.chunkledger.core.operation.OperationHandler;
import win.ixuni.chunkledger.core.operation.StoreContext;
import win.ixuni.chunkledger.store.s3.context.S3StoreContext;

/**
 * S3 handler base class with type-safe context access
 *
 * @param <O> operation type
 * @param <R> result type
 */
public abstract class AbstractS3Handler<O extends Operation<R>, R> implements OperationHandler<O, R> {

    @Override
    public final Mono<R> handle(O operation, StoreContext context) {
        if (!(context instanceof S3StoreContext)) {
            return Mono.error(new IllegalArgumentException(
                    "Expected S3StoreContext but got: " + context.getClass().getName()));
        }
        return doHandle(operation, (S3StoreContext) context);
    }

    protected abstract Mono<R> doHandle(O operation, S3StoreContext context);

    /**
     * S3 returns ETags wrapped in double quotes; callers get the bare value.
     */
    protected static String unquote(String etag) {
        if (etag == null) {
            return null;
        }
        String result = etag;
        if (result.startsWith("\"")) {
            result = result.substring(1);
        }
        if (result.endsWith("\"")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
