package win.ixuni.chunkledger.store.s3.handler.object;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import win.ixuni.chunkledger.core.model.StoredObject;
import win.ixuni.chunkledger.core.model.StoredObjectData;
import win.ixuni.chunkledger.core.operation.object.GetObjectOperation;
import win.ixuni.chunkledger.store.s3.context.S3StoreContext;
import win.ixuni.chunkledger.store.s3.handler.AbstractS3Handler;

import java.nio.ByteBuffer;

/**
 * S3 GetObject handler
 * <p>
 * Streams the response body instead of loading the whole object into memory
 */
public class S3GetObjectHandler extends AbstractS3Handler<GetObjectOperation, StoredObjectData> {

    @Override
    protected Mono<StoredObjectData> doHandle(GetObjectOperation operation, S3StoreContext ctx) {
        return Mono.fromFuture(() -> ctx.getS3Client().getObject(
                        GetObjectRequest.builder()
                                .bucket(ctx.getBucket())
                                .key(operation.getPath())
                                .build(),
                        AsyncResponseTransformer.toPublisher()))
                .map(publisher -> {
                    GetObjectResponse response = publisher.response();
                    StoredObject metadata = StoredObject.builder()
                            .path(operation.getPath())
                            .size(response.contentLength())
                            .etag(unquote(response.eTag()))
                            .lastModified(response.lastModified())
                            .contentType(response.contentType())
                            .build();

                    Flux<ByteBuffer> content = Flux.from(publisher);
                    return StoredObjectData.builder()
                            .metadata(metadata)
                            .content(content)
                            .build();
                });
    }

    @Override
    public Class<GetObjectOperation> getOperationType() {
        return GetObjectOperation.class;
    }
}
