package win.ixuni.chunkledger.test;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.chunkledger.core.config.ComponentConfig;
import win.ixuni.chunkledger.core.exception.ComponentNotFoundException;
import win.ixuni.chunkledger.core.factory.ComponentFactory;
import win.ixuni.chunkledger.core.factory.ComponentFactoryLoader;
import win.ixuni.chunkledger.core.factory.ObjectStoreFactory;
import win.ixuni.chunkledger.core.factory.TrackerFactory;
import win.ixuni.chunkledger.core.store.ObjectStore;
import win.ixuni.chunkledger.core.tracker.ExpirableTracker;
import win.ixuni.chunkledger.core.tracker.UploadTracker;

import static org.junit.jupiter.api.Assertions.*;

class FactoryLoaderTest {

    @Test
    @DisplayName("Memory backends are discovered through META-INF/services")
    void discoversMemoryBackends() {
        assertTrue(ComponentFactoryLoader.load(TrackerFactory.class).stream()
                .map(ComponentFactory::getType)
                .anyMatch("memory"::equals));
        assertTrue(ComponentFactoryLoader.load(ObjectStoreFactory.class).stream()
                .map(ComponentFactory::getType)
                .anyMatch("memory"::equals));
    }

    @Test
    @DisplayName("Found factories build working components")
    void createsComponents() {
        ComponentConfig config = ComponentConfig.of("spi", "memory");

        UploadTracker tracker = ComponentFactoryLoader.find(TrackerFactory.class, "memory").createTracker(config);
        ObjectStore store = ComponentFactoryLoader.find(ObjectStoreFactory.class, "memory").createStore(config);

        assertInstanceOf(ExpirableTracker.class, tracker);
        tracker.createUpload("k", "u", 1);
        assertEquals("u", tracker.getUploadId("k"));
        assertEquals("spi", store.getStoreName());
    }

    @Test
    @DisplayName("Unknown type fails with ComponentNotFoundException")
    void unknownType() {
        ComponentNotFoundException e = assertThrows(ComponentNotFoundException.class,
                () -> ComponentFactoryLoader.find(ObjectStoreFactory.class, "gcs"));

        assertTrue(e.getMessage().contains("gcs"));
    }
}
