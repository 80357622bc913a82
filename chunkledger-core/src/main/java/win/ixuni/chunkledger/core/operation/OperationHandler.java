package win.ixuni.chunkledger.core.operation;

import reactor.core.publisher.Mono;

/**
 * Operation handler interface
 * <p>
 * Each object store backend provides one handler per operation it supports.
 *
 * @param <O> operation type
 * @param <R> result type
 */
public interface OperationHandler<O extends Operation<R>, R> {

    /**
     * Handle the operation
     *
     * @param operation the operation instance
     * @param context   store context
     * @return operation result
     */
    Mono<R> handle(O operation, StoreContext context);

    /**
     * @return the operation class this handler serves
     */
    Class<O> getOperationType();
}
