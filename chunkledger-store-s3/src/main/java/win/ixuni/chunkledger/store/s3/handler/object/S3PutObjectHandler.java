package win.ixuni.chunkledger.store.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import win.ixuni.chunkledger.core.model.StoredObject;
import win.ixuni.chunkledger.core.operation.object.PutObjectOperation;
import win.ixuni.chunkledger.store.s3.context.S3StoreContext;
import win.ixuni.chunkledger.store.s3.handler.AbstractS3Handler;

import java.time.Instant;

/**
 * S3 PutObject handler
 */
public class S3PutObjectHandler extends AbstractS3Handler<PutObjectOperation, StoredObject> {

    @Override
    protected Mono<StoredObject> doHandle(PutObjectOperation operation, S3StoreContext ctx) {
        byte[] data = operation.getContent();

        var requestBuilder = PutObjectRequest.builder()
                .bucket(ctx.getBucket())
                .key(operation.getPath())
                .contentType(operation.getContentType())
                .contentLength((long) data.length);

        if (operation.getAcl() != null) {
            requestBuilder.acl(operation.getAcl().cannedAcl());
        }

        return Mono.fromFuture(() -> ctx.getS3Client().putObject(
                        requestBuilder.build(),
                        AsyncRequestBody.fromBytes(data)))
                .map(response -> StoredObject.builder()
                        .path(operation.getPath())
                        .size((long) data.length)
                        .etag(unquote(response.eTag()))
                        .contentType(operation.getContentType())
                        .lastModified(Instant.now())
                        .build());
    }

    @Override
    public Class<PutObjectOperation> getOperationType() {
        return PutObjectOperation.class;
    }
}
