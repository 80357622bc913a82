package win.ixuni.chunkledger.core.operation;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operation handler registry
 * <p>
 * Maps operation types to handlers. Stores register their handlers at construction time; at runtime
 * the handler is looked up by operation class and executed through the interceptor chain.
 */
@Slf4j
public class OperationHandlerRegistry {

    private static final Comparator<HandlerInterceptor> BY_ORDER =
            Comparator.comparingInt(HandlerInterceptor::getOrder);

    private final Map<Class<?>, OperationHandler<?, ?>> handlers = new ConcurrentHashMap<>();

    /**
     * Sorted by order, lowest (outermost) first. Replaced as a whole on every change.
     */
    private volatile List<HandlerInterceptor> interceptors = List.of();

    public <O extends Operation<R>, R> void register(OperationHandler<O, R> handler) {
        Class<O> operationType = handler.getOperationType();
        OperationHandler<?, ?> previous = handlers.put(operationType, handler);
        if (previous != null) {
            log.warn("Handler for {} replaced: {} -> {}", operationType.getSimpleName(),
                    previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
        } else {
            log.debug("Registered handler for operation: {}", operationType.getSimpleName());
        }
    }

    public synchronized void addInterceptor(HandlerInterceptor interceptor) {
        List<HandlerInterceptor> updated = new ArrayList<>(interceptors);
        updated.add(interceptor);
        updated.sort(BY_ORDER);
        interceptors = List.copyOf(updated);
        log.debug("Added interceptor: {} with order {}",
                interceptor.getClass().getSimpleName(), interceptor.getOrder());
    }

    /**
     * Execute an operation through the interceptor chain
     *
     * @param operation the operation instance
     * @param context   store context
     * @return operation result, or an {@link UnsupportedOperationException} error when no handler
     * is registered for the operation type
     */
    @SuppressWarnings("unchecked")
    public <O extends Operation<R>, R> Mono<R> execute(O operation, StoreContext context) {
        OperationHandler<O, R> handler = (OperationHandler<O, R>) handlers.get(operation.getClass());
        if (handler == null) {
            return Mono.error(new UnsupportedOperationException(
                    "No handler registered for operation: " + operation.getOperationName()));
        }

        List<HandlerInterceptor> chainInterceptors = interceptors;
        log.debug("Executing operation: {} with handler: {} through {} interceptors",
                operation.getOperationName(), handler.getClass().getSimpleName(), chainInterceptors.size());

        return chainOf(handler, chainInterceptors).proceed(operation, context);
    }

    /**
     * Wrap the handler from the innermost interceptor outwards
     */
    private static <O extends Operation<R>, R> InterceptorChain<O, R> chainOf(
            OperationHandler<O, R> handler, List<HandlerInterceptor> chainInterceptors) {
        // deferred so that handlers throwing synchronously still surface as Mono errors
        InterceptorChain<O, R> chain = (op, ctx) -> Mono.defer(() -> handler.handle(op, ctx));
        for (int i = chainInterceptors.size() - 1; i >= 0; i--) {
            HandlerInterceptor interceptor = chainInterceptors.get(i);
            InterceptorChain<O, R> next = chain;
            chain = (op, ctx) -> interceptor.intercept(op, ctx, next);
        }
        return chain;
    }

    public boolean supports(Class<? extends Operation<?>> operationType) {
        return handlers.containsKey(operationType);
    }

    /**
     * @return number of registered operations
     */
    public int size() {
        return handlers.size();
    }

    public int interceptorCount() {
        return interceptors.size();
    }
}
