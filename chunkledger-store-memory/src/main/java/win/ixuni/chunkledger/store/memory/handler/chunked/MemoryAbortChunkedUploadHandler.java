package win.ixuni.chunkledger.store.memory.handler.chunked;

import reactor.core.publisher.Mono;
import win.ixuni.chunkledger.core.operation.chunked.AbortChunkedUploadOperation;
import win.ixuni.chunkledger.store.memory.context.MemoryStoreContext;
import win.ixuni.chunkledger.store.memory.handler.AbstractMemoryHandler;

/**
 * Memory abort-chunked-upload handler
 */
public class MemoryAbortChunkedUploadHandler extends AbstractMemoryHandler<AbortChunkedUploadOperation, Void> {

    @Override
    protected Mono<Void> doHandle(AbortChunkedUploadOperation operation, MemoryStoreContext ctx) {
        ctx.getChunkedUploads().remove(operation.getUploadId());
        return Mono.empty();
    }

    @Override
    public Class<AbortChunkedUploadOperation> getOperationType() {
        return AbortChunkedUploadOperation.class;
    }
}
