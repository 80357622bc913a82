package win.ixuni.chunkledger.store.memory.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.chunkledger.core.model.ObjectAcl;
import win.ixuni.chunkledger.core.model.StoredObject;
import win.ixuni.chunkledger.core.operation.object.PutObjectOperation;
import win.ixuni.chunkledger.store.memory.context.MemoryStoreContext;
import win.ixuni.chunkledger.store.memory.handler.AbstractMemoryHandler;

import java.time.Instant;

/**
 * Memory PutObject handler
 */
public class MemoryPutObjectHandler extends AbstractMemoryHandler<PutObjectOperation, StoredObject> {

    @Override
    protected Mono<StoredObject> doHandle(PutObjectOperation operation, MemoryStoreContext ctx) {
        byte[] data = operation.getContent();
        String etag = md5Hex(data);
        String contentType = operation.getContentType() != null
                ? operation.getContentType()
                : "application/octet-stream";
        Instant now = Instant.now();

        ctx.getObjects().put(operation.getPath(), MemoryStoreContext.ObjectData.builder()
                .path(operation.getPath())
                .data(data)
                .etag(etag)
                .contentType(contentType)
                .acl(operation.getAcl() != null ? operation.getAcl() : ObjectAcl.PRIVATE)
                .lastModified(now)
                .build());

        return Mono.just(StoredObject.builder()
                .path(operation.getPath())
                .size((long) data.length)
                .etag(etag)
                .contentType(contentType)
                .lastModified(now)
                .build());
    }

    @Override
    public Class<PutObjectOperation> getOperationType() {
        return PutObjectOperation.class;
    }
}
