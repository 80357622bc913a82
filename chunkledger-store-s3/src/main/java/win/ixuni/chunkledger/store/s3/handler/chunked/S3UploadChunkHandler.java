package win.ixuni.chunkledger.store.s3.handler.chunked;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import win.ixuni.chunkledger.core.exception.InvalidUploadArgumentException;
import win.ixuni.chunkledger.core.model.UploadedChunk;
import win.ixuni.chunkledger.core.operation.chunked.UploadChunkOperation;
import win.ixuni.chunkledger.core.util.UploadValidationUtils;
import win.ixuni.chunkledger.store.s3.context.S3StoreContext;
import win.ixuni.chunkledger.store.s3.handler.AbstractS3Handler;

import java.time.Instant;

/**
 * S3 upload-chunk handler (UploadPart)
 * <p>
 * The chunk is sent from memory; chunks are typically 5-100MB.
 */
public class S3UploadChunkHandler extends AbstractS3Handler<UploadChunkOperation, UploadedChunk> {

    @Override
    protected Mono<UploadedChunk> doHandle(UploadChunkOperation operation, S3StoreContext ctx) {
        String error = UploadValidationUtils.validateUploadId(operation.getUploadId());
        if (error != null) {
            return Mono.error(new InvalidUploadArgumentException(error));
        }

        byte[] data = operation.getContent();
        int partNumber = operation.getPartNumber();

        var request = UploadPartRequest.builder()
                .bucket(ctx.getBucket())
                .key(operation.getPath())
                .uploadId(operation.getUploadId())
                .partNumber(partNumber)
                .contentLength((long) data.length)
                .build();

        return Mono.fromFuture(() -> ctx.getS3Client().uploadPart(request, AsyncRequestBody.fromBytes(data)))
                .map(response -> UploadedChunk.builder()
                        .partNumber(partNumber)
                        .etag(unquote(response.eTag()))
                        .size((long) data.length)
                        .lastModified(Instant.now())
                        .build());
    }

    @Override
    public Class<UploadChunkOperation> getOperationType() {
        return UploadChunkOperation.class;
    }
}
