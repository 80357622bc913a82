package win.ixuni.chunkledger.core.operation;

import reactor.core.publisher.Mono;

/**
 * Handler interceptor interface
 * <p>
 * Allows inserting common logic around handler execution (logging, error translation, ...).
 */
public interface HandlerInterceptor {

    /**
     * Intercept handler execution. Implementors call {@code chain.proceed()} to continue.
     *
     * @param operation the operation instance
     * @param context   store context
     * @param chain     remaining chain
     * @param <O>       operation type
     * @param <R>       result type
     * @return operation result
     */
    <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            StoreContext context,
            InterceptorChain<O, R> chain);

    /**
     * Get interceptor priority (lower number = outer position in the chain)
     *
     * @return priority ordinal
     */
    default int getOrder() {
        return 0;
    }
}
