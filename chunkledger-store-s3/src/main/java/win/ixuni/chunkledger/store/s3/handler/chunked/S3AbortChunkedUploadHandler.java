package win.ixuni.chunkledger.store.s3.handler.chunked;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import win.ixuni.chunkledger.core.exception.InvalidUploadArgumentException;
import win.ixuni.chunkledger.core.operation.chunked.AbortChunkedUploadOperation;
import win.ixuni.chunkledger.core.util.UploadValidationUtils;
import win.ixuni.chunkledger.store.s3.context.S3StoreContext;
import win.ixuni.chunkledger.store.s3.handler.AbstractS3Handler;

/**
 * S3 abort-chunked-upload handler (AbortMultipartUpload)
 */
public class S3AbortChunkedUploadHandler extends AbstractS3Handler<AbortChunkedUploadOperation, Void> {

    @Override
    protected Mono<Void> doHandle(AbortChunkedUploadOperation operation, S3StoreContext ctx) {
        String error = UploadValidationUtils.validateUploadId(operation.getUploadId());
        if (error != null) {
            return Mono.error(new InvalidUploadArgumentException(error));
        }

        var request = AbortMultipartUploadRequest.builder()
                .bucket(ctx.getBucket())
                .key(operation.getPath())
                .uploadId(operation.getUploadId())
                .build();

        return Mono.fromFuture(() -> ctx.getS3Client().abortMultipartUpload(request))
                .then();
    }

    @Override
    public Class<AbortChunkedUploadOperation> getOperationType() {
        return AbortChunkedUploadOperation.class;
    }
}
