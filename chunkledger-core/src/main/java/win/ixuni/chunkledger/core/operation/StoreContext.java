package win.ixuni.chunkledger.core.operation;

import win.ixuni.chunkledger.core.config.ComponentConfig;

/**
 * Object store context
 * <p>
 * Shared dependencies handlers need to execute operations (clients, in-memory state, config).
 * Each backend implements its own context class.
 */
public interface StoreContext {

    ComponentConfig getConfig();

    /**
     * @return store instance name
     */
    String getStoreName();

    /**
     * @return store type, e.g. "memory", "s3"
     */
    String getStoreType();
}
