package win.ixuni.chunkledger.store.memory.handler.chunked;

import reactor.core.publisher.Mono;
import win.ixuni.chunkledger.core.exception.UploadNotFoundException;
import win.ixuni.chunkledger.core.model.UploadedChunk;
import win.ixuni.chunkledger.core.operation.chunked.UploadChunkOperation;
import win.ixuni.chunkledger.store.memory.context.MemoryStoreContext;
import win.ixuni.chunkledger.store.memory.handler.AbstractMemoryHandler;

import java.time.Instant;

/**
 * Memory upload-chunk handler
 * <p>
 * The ETag of a chunk is the hex MD5 of its bytes.
 */
public class MemoryUploadChunkHandler extends AbstractMemoryHandler<UploadChunkOperation, UploadedChunk> {

    @Override
    protected Mono<UploadedChunk> doHandle(UploadChunkOperation operation, MemoryStoreContext ctx) {
        var state = ctx.getChunkedUploads().get(operation.getUploadId());
        if (state == null) {
            return Mono.error(new UploadNotFoundException(operation.getUploadId()));
        }

        byte[] data = operation.getContent();
        String etag = md5Hex(data);
        Instant now = Instant.now();

        state.getChunks().put(operation.getPartNumber(), MemoryStoreContext.ChunkData.builder()
                .data(data)
                .etag(etag)
                .lastModified(now)
                .build());

        return Mono.just(UploadedChunk.builder()
                .partNumber(operation.getPartNumber())
                .etag(etag)
                .size((long) data.length)
                .lastModified(now)
                .build());
    }

    @Override
    public Class<UploadChunkOperation> getOperationType() {
        return UploadChunkOperation.class;
    }
}
