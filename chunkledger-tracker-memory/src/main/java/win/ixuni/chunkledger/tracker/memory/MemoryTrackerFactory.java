package win.ixuni.chunkledger.tracker.memory;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.chunkledger.core.config.ComponentConfig;
import win.ixuni.chunkledger.core.factory.TrackerFactory;
import win.ixuni.chunkledger.core.tracker.UploadTracker;

/**
 * In-memory tracker factory
 */
@Slf4j
public class MemoryTrackerFactory implements TrackerFactory {

    public static final String TRACKER_TYPE = "memory";

    @Override
    public String getType() {
        return TRACKER_TYPE;
    }

    @Override
    public UploadTracker createTracker(ComponentConfig config) {
        log.info("Creating in-memory upload tracker: {}", config.getName());
        return new InMemoryUploadTracker();
    }

    @Override
    public String getDescription() {
        return "In-memory upload tracker, state is lost on restart";
    }
}
