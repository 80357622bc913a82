package win.ixuni.chunkledger.core.operation;

import reactor.core.publisher.Mono;

/**
 * Handler interceptor chain
 * <p>
 * Used in interceptors to invoke the next interceptor or the final handler.
 *
 * @param <O> operation type
 * @param <R> result type
 */
public interface InterceptorChain<O extends Operation<R>, R> {

    Mono<R> proceed(O operation, StoreContext context);
}
