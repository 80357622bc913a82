package win.ixuni.chunkledger.store.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import win.ixuni.chunkledger.core.operation.object.DeleteObjectOperation;
import win.ixuni.chunkledger.store.s3.context.S3StoreContext;
import win.ixuni.chunkledger.store.s3.handler.AbstractS3Handler;

/**
 * S3 DeleteObject handler
 */
public class S3DeleteObjectHandler extends AbstractS3Handler<DeleteObjectOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteObjectOperation operation, S3StoreContext ctx) {
        return Mono.fromFuture(() -> ctx.getS3Client().deleteObject(
                        DeleteObjectRequest.builder()
                                .bucket(ctx.getBucket())
                                .key(operation.getPath())
                                .build()))
                .then();
    }

    @Override
    public Class<DeleteObjectOperation> getOperationType() {
        return DeleteObjectOperation.class;
    }
}
