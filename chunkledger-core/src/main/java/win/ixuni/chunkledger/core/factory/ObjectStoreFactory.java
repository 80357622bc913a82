package win.ixuni.chunkledger.core.factory;

import win.ixuni.chunkledger.core.config.ComponentConfig;
import win.ixuni.chunkledger.core.store.ObjectStore;

/**
 * Object store factory
 * <p>
 * Each backend provides a factory creating store instances from configuration.
 * Several instances of the same type may coexist (e.g. two buckets).
 */
public interface ObjectStoreFactory extends ComponentFactory {

    ObjectStore createStore(ComponentConfig config);
}
