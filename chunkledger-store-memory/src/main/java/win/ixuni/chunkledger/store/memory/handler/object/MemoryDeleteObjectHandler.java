package win.ixuni.chunkledger.store.memory.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.chunkledger.core.operation.object.DeleteObjectOperation;
import win.ixuni.chunkledger.store.memory.context.MemoryStoreContext;
import win.ixuni.chunkledger.store.memory.handler.AbstractMemoryHandler;

/**
 * Memory DeleteObject handler
 */
public class MemoryDeleteObjectHandler extends AbstractMemoryHandler<DeleteObjectOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteObjectOperation operation, MemoryStoreContext ctx) {
        // deleting a missing object is idempotent, as on S3
        ctx.getObjects().remove(operation.getPath());
        return Mono.empty();
    }

    @Override
    public Class<DeleteObjectOperation> getOperationType() {
        return DeleteObjectOperation.class;
    }
}
