package win.ixuni.chunkledger.store.memory.handler.chunked;

import reactor.core.publisher.Mono;
import win.ixuni.chunkledger.core.exception.InvalidPartException;
import win.ixuni.chunkledger.core.exception.InvalidUploadArgumentException;
import win.ixuni.chunkledger.core.exception.UploadNotFoundException;
import win.ixuni.chunkledger.core.model.CompletedPart;
import win.ixuni.chunkledger.core.model.StoredObject;
import win.ixuni.chunkledger.core.operation.chunked.CompleteChunkedUploadOperation;
import win.ixuni.chunkledger.store.memory.context.MemoryStoreContext;
import win.ixuni.chunkledger.store.memory.handler.AbstractMemoryHandler;

import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.List;

/**
 * Memory complete-chunked-upload handler
 * <p>
 * Behaves like S3: parts must be listed in ascending order and every ETag must match the
 * stored chunk, otherwise the request is rejected and the session stays open.
 * <p>
 * The session is claimed before the object is assembled, so of two racing finalizations only
 * one writes the object; the other fails with {@link UploadNotFoundException}.
 */
public class MemoryCompleteChunkedUploadHandler
        extends AbstractMemoryHandler<CompleteChunkedUploadOperation, StoredObject> {

    @Override
    protected Mono<StoredObject> doHandle(CompleteChunkedUploadOperation operation, MemoryStoreContext ctx) {
        List<CompletedPart> parts = operation.getParts();
        if (parts == null || parts.isEmpty()) {
            return Mono.error(new InvalidUploadArgumentException("No completed parts, nothing to upload"));
        }

        var state = ctx.getChunkedUploads().remove(operation.getUploadId());
        if (state == null) {
            return Mono.error(new UploadNotFoundException(operation.getUploadId()));
        }

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        int previous = 0;
        for (CompletedPart part : parts) {
            if (part.getPartNumber() <= previous) {
                return release(ctx, operation, state, new InvalidPartException(
                        "InvalidPartOrder: part " + part.getPartNumber() + " listed after part " + previous));
            }
            previous = part.getPartNumber();

            var chunk = state.getChunks().get(part.getPartNumber());
            if (chunk == null || !chunk.getEtag().equals(part.getEtag())) {
                return release(ctx, operation, state, new InvalidPartException(
                        "InvalidPart: part " + part.getPartNumber() + " was not uploaded or its ETag does not match"));
            }
            baos.write(chunk.getData(), 0, chunk.getData().length);
        }

        byte[] data = baos.toByteArray();
        String etag = md5Hex(data) + "-" + parts.size();
        Instant now = Instant.now();

        ctx.getObjects().put(operation.getPath(), MemoryStoreContext.ObjectData.builder()
                .path(operation.getPath())
                .data(data)
                .etag(etag)
                .contentType(state.getContentType() != null ? state.getContentType() : "application/octet-stream")
                .acl(state.getAcl())
                .lastModified(now)
                .build());

        return Mono.just(StoredObject.builder()
                .path(operation.getPath())
                .size((long) data.length)
                .etag(etag)
                .contentType(state.getContentType())
                .lastModified(now)
                .build());
    }

    /**
     * Reopen a claimed session after a refused part list
     */
    private Mono<StoredObject> release(MemoryStoreContext ctx, CompleteChunkedUploadOperation operation,
                                       MemoryStoreContext.ChunkedState state, InvalidPartException error) {
        ctx.getChunkedUploads().putIfAbsent(operation.getUploadId(), state);
        return Mono.error(error);
    }

    @Override
    public Class<CompleteChunkedUploadOperation> getOperationType() {
        return CompleteChunkedUploadOperation.class;
    }
}
