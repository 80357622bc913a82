package win.ixuni.chunkledger.store.memory;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.chunkledger.core.config.ComponentConfig;
import win.ixuni.chunkledger.core.operation.StoreContext;
import win.ixuni.chunkledger.core.store.AbstractObjectStore;
import win.ixuni.chunkledger.store.memory.context.MemoryStoreContext;
import win.ixuni.chunkledger.store.memory.handler.chunked.MemoryAbortChunkedUploadHandler;
import win.ixuni.chunkledger.store.memory.handler.chunked.MemoryCompleteChunkedUploadHandler;
import win.ixuni.chunkledger.store.memory.handler.chunked.MemoryStartChunkedUploadHandler;
import win.ixuni.chunkledger.store.memory.handler.chunked.MemoryUploadChunkHandler;
import win.ixuni.chunkledger.store.memory.handler.object.MemoryDeleteObjectHandler;
import win.ixuni.chunkledger.store.memory.handler.object.MemoryGetObjectHandler;
import win.ixuni.chunkledger.store.memory.handler.object.MemoryPutObjectHandler;

/**
 * In-memory object store
 * <p>
 * Keeps objects and open chunked uploads in maps; intended for development and tests.
 */
@Slf4j
public class MemoryObjectStore extends AbstractObjectStore {

    @Getter
    private final ComponentConfig config;

    @Getter
    private final MemoryStoreContext context;

    public MemoryObjectStore(ComponentConfig config) {
        this.config = config;
        this.context = MemoryStoreContext.builder()
                .config(config)
                .build();
        registerHandlers();
    }

    private void registerHandlers() {
        // Object handlers (3)
        getHandlerRegistry().register(new MemoryPutObjectHandler());
        getHandlerRegistry().register(new MemoryGetObjectHandler());
        getHandlerRegistry().register(new MemoryDeleteObjectHandler());

        // Chunked upload handlers (4)
        getHandlerRegistry().register(new MemoryStartChunkedUploadHandler());
        getHandlerRegistry().register(new MemoryUploadChunkHandler());
        getHandlerRegistry().register(new MemoryCompleteChunkedUploadHandler());
        getHandlerRegistry().register(new MemoryAbortChunkedUploadHandler());

        log.info("Registered {} operation handlers for memory store", getHandlerRegistry().size());
    }

    @Override
    public StoreContext getStoreContext() {
        return context;
    }

    @Override
    public String getStoreType() {
        return MemoryObjectStoreFactory.STORE_TYPE;
    }

    @Override
    public String getStoreName() {
        return config.getName();
    }

    @Override
    public Mono<Void> initialize() {
        log.info("Initializing memory object store: {}", config.getName());
        return Mono.empty();
    }

    @Override
    public Mono<Void> shutdown() {
        log.info("Shutting down memory object store: {}", config.getName());
        context.getObjects().clear();
        context.getChunkedUploads().clear();
        return Mono.empty();
    }
}
