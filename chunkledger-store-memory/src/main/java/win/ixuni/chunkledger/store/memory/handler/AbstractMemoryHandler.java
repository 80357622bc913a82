package win.ixuni.chunkledger.store.memory.handler;

import reactor.core.publisher.Mono;
import win.ixuni.chunkledger.core.operation.Operation;
import win.ixuni.chunkledger.core.operation.OperationHandler;
import win.ixuni.chunkledger.core.operation.StoreContext;
import win.ixuni.chunkledger.store.memory.context.MemoryStoreContext;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Memory handler base class
 * <p>
 * Provides type-safe context access so subclasses need no cast.
 *
 * @param <O> operation type
 * @param <R> result type
 */
public abstract class AbstractMemoryHandler<O extends Operation<R>, R> implements OperationHandler<O, R> {

    @Override
    public final Mono<R> handle(O operation, StoreContext context) {
        if (!(context instanceof MemoryStoreContext)) {
            return Mono.error(new IllegalArgumentException(
                    "Expected MemoryStoreContext but got: " + context.getClass().getName()));
        }
        return doHandle(operation, (MemoryStoreContext) context);
    }

    /**
     * @param operation operation
     * @param context   memory store context
     * @return operation result
     */
    protected abstract Mono<R> doHandle(O operation, MemoryStoreContext context);

    protected static String md5Hex(byte[] data) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(data);
            StringBuilder sb = new StringBuilder();
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
