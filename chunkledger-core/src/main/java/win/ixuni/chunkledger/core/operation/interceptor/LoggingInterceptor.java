package win.ixuni.chunkledger.core.operation.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.chunkledger.core.operation.HandlerInterceptor;
import win.ixuni.chunkledger.core.operation.InterceptorChain;
import win.ixuni.chunkledger.core.operation.ObjectOperation;
import win.ixuni.chunkledger.core.operation.Operation;
import win.ixuni.chunkledger.core.operation.StoreContext;

/**
 * Logging interceptor
 * <p>
 * Logs every operation with its execution time and outcome.
 */
@Slf4j
public class LoggingInterceptor implements HandlerInterceptor {

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            StoreContext context,
            InterceptorChain<O, R> chain) {

        final long startTime = System.currentTimeMillis();
        final String operationName = operation.getOperationName();
        final String storeName = context.getStoreName();
        final String path = operation instanceof ObjectOperation<?> objectOperation
                ? objectOperation.getPath()
                : "-";

        log.debug("[{}] Starting operation: {} on {}", storeName, operationName, path);

        return chain.proceed(operation, context)
                .doOnSuccess(result -> {
                    long duration = System.currentTimeMillis() - startTime;
                    log.debug("[{}] Operation {} completed successfully in {}ms",
                            storeName, operationName, duration);
                })
                .doOnError(error -> {
                    long duration = System.currentTimeMillis() - startTime;
                    log.warn("[{}] Operation {} on {} failed after {}ms: {}",
                            storeName, operationName, path, duration, error.getMessage());
                });
    }

    @Override
    public int getOrder() {
        return -100; // outermost
    }
}
