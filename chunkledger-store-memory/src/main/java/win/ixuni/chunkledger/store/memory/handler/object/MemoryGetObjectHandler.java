package win.ixuni.chunkledger.store.memory.handler.object;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.chunkledger.core.exception.ObjectNotFoundException;
import win.ixuni.chunkledger.core.model.StoredObject;
import win.ixuni.chunkledger.core.model.StoredObjectData;
import win.ixuni.chunkledger.core.operation.object.GetObjectOperation;
import win.ixuni.chunkledger.store.memory.context.MemoryStoreContext;
import win.ixuni.chunkledger.store.memory.handler.AbstractMemoryHandler;

import java.nio.ByteBuffer;

/**
 * Memory GetObject handler
 */
public class MemoryGetObjectHandler extends AbstractMemoryHandler<GetObjectOperation, StoredObjectData> {

    @Override
    protected Mono<StoredObjectData> doHandle(GetObjectOperation operation, MemoryStoreContext ctx) {
        MemoryStoreContext.ObjectData objData = ctx.getObjects().get(operation.getPath());
        if (objData == null) {
            return Mono.error(new ObjectNotFoundException(operation.getPath()));
        }

        StoredObject metadata = StoredObject.builder()
                .path(objData.getPath())
                .size((long) objData.getData().length)
                .etag(objData.getEtag())
                .contentType(objData.getContentType())
                .lastModified(objData.getLastModified())
                .build();

        return Mono.just(StoredObjectData.builder()
                .metadata(metadata)
                .content(Flux.just(ByteBuffer.wrap(objData.getData())))
                .build());
    }

    @Override
    public Class<GetObjectOperation> getOperationType() {
        return GetObjectOperation.class;
    }
}
