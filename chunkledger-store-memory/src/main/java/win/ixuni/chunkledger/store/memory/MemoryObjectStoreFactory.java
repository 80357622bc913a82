package win.ixuni.chunkledger.store.memory;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.chunkledger.core.config.ComponentConfig;
import win.ixuni.chunkledger.core.factory.ObjectStoreFactory;
import win.ixuni.chunkledger.core.store.ObjectStore;

/**
 * In-memory object store factory
 */
@Slf4j
public class MemoryObjectStoreFactory implements ObjectStoreFactory {

    public static final String STORE_TYPE = "memory";

    @Override
    public String getType() {
        return STORE_TYPE;
    }

    @Override
    public ObjectStore createStore(ComponentConfig config) {
        log.info("Creating memory object store instance: {}", config.getName());
        return new MemoryObjectStore(config);
    }

    @Override
    public String getDescription() {
        return "In-memory object store for development and tests";
    }
}
