package win.ixuni.chunkledger.core.tracker;

import win.ixuni.chunkledger.core.model.ExpiredUpload;

import java.time.Duration;
import java.util.List;

/**
 * Interface for trackers able to drop abandoned uploads
 * <p>
 * Expiry is opt-in: nothing calls it unless a cleanup schedule is configured.
 */
public interface ExpirableTracker {

    /**
     * Remove every record with no activity during the given period
     *
     * @param idleFor minimum idle time
     * @return the removed records, so that their object-store sessions can be aborted
     */
    List<ExpiredUpload> expireIdle(Duration idleFor);
}
