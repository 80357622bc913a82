package win.ixuni.chunkledger.store.s3.handler.chunked;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import win.ixuni.chunkledger.core.exception.ObjectStoreException;
import win.ixuni.chunkledger.core.model.ChunkedUpload;
import win.ixuni.chunkledger.core.operation.chunked.StartChunkedUploadOperation;
import win.ixuni.chunkledger.core.util.UploadValidationUtils;
import win.ixuni.chunkledger.store.s3.context.S3StoreContext;
import win.ixuni.chunkledger.store.s3.handler.AbstractS3Handler;

import java.time.Instant;

/**
 * S3 start-chunked-upload handler (CreateMultipartUpload)
 */
public class S3StartChunkedUploadHandler extends AbstractS3Handler<StartChunkedUploadOperation, ChunkedUpload> {

    @Override
    protected Mono<ChunkedUpload> doHandle(StartChunkedUploadOperation operation, S3StoreContext ctx) {
        var requestBuilder = CreateMultipartUploadRequest.builder()
                .bucket(ctx.getBucket())
                .key(operation.getPath());

        if (operation.getContentType() != null) {
            requestBuilder.contentType(operation.getContentType());
        }
        if (operation.getAcl() != null) {
            requestBuilder.acl(operation.getAcl().cannedAcl());
        }

        return Mono.fromFuture(() -> ctx.getS3Client().createMultipartUpload(requestBuilder.build()))
                .flatMap(response -> {
                    String error = UploadValidationUtils.validateUploadId(response.uploadId());
                    if (error != null) {
                        return Mono.error(new ObjectStoreException("store." + operation.getOperationName(), error));
                    }
                    return Mono.just(ChunkedUpload.builder()
                            .uploadId(response.uploadId())
                            .path(operation.getPath())
                            .contentType(operation.getContentType())
                            .initiated(Instant.now())
                            .build());
                });
    }

    @Override
    public Class<StartChunkedUploadOperation> getOperationType() {
        return StartChunkedUploadOperation.class;
    }
}
