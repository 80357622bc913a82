package win.ixuni.chunkledger.core.factory;

import win.ixuni.chunkledger.core.config.ComponentConfig;
import win.ixuni.chunkledger.core.tracker.UploadTracker;

/**
 * Upload tracker factory
 * <p>
 * Implementations are discovered through {@code META-INF/services}.
 */
public interface TrackerFactory extends ComponentFactory {

    UploadTracker createTracker(ComponentConfig config);
}
