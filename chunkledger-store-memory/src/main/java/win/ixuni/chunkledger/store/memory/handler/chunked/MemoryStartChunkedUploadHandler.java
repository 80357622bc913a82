package win.ixuni.chunkledger.store.memory.handler.chunked;

import reactor.core.publisher.Mono;
import win.ixuni.chunkledger.core.model.ChunkedUpload;
import win.ixuni.chunkledger.core.model.ObjectAcl;
import win.ixuni.chunkledger.core.operation.chunked.StartChunkedUploadOperation;
import win.ixuni.chunkledger.store.memory.context.MemoryStoreContext;
import win.ixuni.chunkledger.store.memory.handler.AbstractMemoryHandler;

import java.time.Instant;
import java.util.UUID;

/**
 * Memory start-chunked-upload handler
 */
public class MemoryStartChunkedUploadHandler
        extends AbstractMemoryHandler<StartChunkedUploadOperation, ChunkedUpload> {

    @Override
    protected Mono<ChunkedUpload> doHandle(StartChunkedUploadOperation operation, MemoryStoreContext ctx) {
        String uploadId = UUID.randomUUID().toString();
        Instant now = Instant.now();

        var state = MemoryStoreContext.ChunkedState.builder()
                .uploadId(uploadId)
                .path(operation.getPath())
                .contentType(operation.getContentType())
                .acl(operation.getAcl() != null ? operation.getAcl() : ObjectAcl.PRIVATE)
                .initiated(now)
                .build();

        ctx.getChunkedUploads().put(uploadId, state);

        return Mono.just(ChunkedUpload.builder()
                .uploadId(uploadId)
                .path(operation.getPath())
                .contentType(operation.getContentType())
                .initiated(now)
                .build());
    }

    @Override
    public Class<StartChunkedUploadOperation> getOperationType() {
        return StartChunkedUploadOperation.class;
    }
}
