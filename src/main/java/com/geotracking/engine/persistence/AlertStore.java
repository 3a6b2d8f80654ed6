package com.geotracking.engine.persistence;

import com.geotracking.engine.dto.AlertRecord;

import java.util.Collection;
import java.util.List;

/**
 * Durable alert storage. Every method may throw
 * {@link com.geotracking.engine.exception.PersistenceFailureException}.
 */
public interface AlertStore {

    void save(AlertRecord alert);

    /**
     * @return false when no alert with this id exists
     */
    boolean markRead(String alertId);

    /**
     * @param deviceIds restricts the update to these devices; null means all devices
     * @return number of alerts flipped to read
     */
    int markAllRead(Collection<String> deviceIds);

    /**
     * Newest first.
     *
     * @param read      null for both read and unread
     * @param deviceIds null for all devices
     */
    List<AlertRecord> find(Boolean read, Collection<String> deviceIds);
}
