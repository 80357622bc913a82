package win.ixuni.chunkledger.store.s3.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.S3Exception;
import win.ixuni.chunkledger.core.exception.InvalidPartException;
import win.ixuni.chunkledger.core.exception.ObjectNotFoundException;
import win.ixuni.chunkledger.core.exception.UploadNotFoundException;
import win.ixuni.chunkledger.core.operation.HandlerInterceptor;
import win.ixuni.chunkledger.core.operation.InterceptorChain;
import win.ixuni.chunkledger.core.operation.ObjectOperation;
import win.ixuni.chunkledger.core.operation.Operation;
import win.ixuni.chunkledger.core.operation.StoreContext;
import win.ixuni.chunkledger.core.operation.chunked.AbortChunkedUploadOperation;
import win.ixuni.chunkledger.core.operation.chunked.CompleteChunkedUploadOperation;
import win.ixuni.chunkledger.core.operation.chunked.UploadChunkOperation;

import java.util.concurrent.CompletionException;

/**
 * S3 exception translation interceptor
 * <p>
 * Converts AWS SDK S3 exceptions to the ChunkLedger exception hierarchy so the S3 store
 * fails the same way as other stores. Unmapped errors pass through and are tagged by
 * the outer {@code OperationTaggingInterceptor}.
 */
@Slf4j
public class S3ExceptionTranslationInterceptor implements HandlerInterceptor {

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation, StoreContext context, InterceptorChain<O, R> chain) {
        return chain.proceed(operation, context)
                .onErrorMap(CompletionException.class,
                        e -> e.getCause() != null ? e.getCause() : e)
                .onErrorMap(S3Exception.class, e -> translateException(operation, e));
    }

    /**
     * Convert S3Exception to the corresponding ChunkLedger exception
     */
    private Throwable translateException(Operation<?> operation, S3Exception e) {
        String errorCode = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : "";

        return switch (errorCode) {
            case "NoSuchKey" -> new ObjectNotFoundException(extractPath(operation, e));
            case "NoSuchUpload" -> new UploadNotFoundException(extractUploadId(operation, e));
            case "InvalidPart", "InvalidPartOrder", "EntityTooSmall" ->
                    new InvalidPartException(errorCode + ": " + e.getMessage());
            default -> {
                log.debug("Unmapped S3 error code: {} (HTTP {}), passing through", errorCode, e.statusCode());
                yield e;
            }
        };
    }

    private String extractPath(Operation<?> operation, S3Exception e) {
        if (operation instanceof ObjectOperation<?> objectOperation) {
            return objectOperation.getPath();
        }
        return e.getMessage() != null ? e.getMessage() : "unknown";
    }

    private String extractUploadId(Operation<?> operation, S3Exception e) {
        if (operation instanceof UploadChunkOperation op) {
            return op.getUploadId();
        }
        if (operation instanceof CompleteChunkedUploadOperation op) {
            return op.getUploadId();
        }
        if (operation instanceof AbortChunkedUploadOperation op) {
            return op.getUploadId();
        }
        return e.getMessage() != null ? e.getMessage() : "unknown";
    }

    @Override
    public int getOrder() {
        // innermost: translate before the tagging interceptor sees the error
        return 100;
    }
}
