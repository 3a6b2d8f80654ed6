package com.geotracking.engine.persistence;

import com.geotracking.engine.dto.GeofenceRecord;

import java.util.List;

/**
 * Durable geofence storage. Every method may throw
 * {@link com.geotracking.engine.exception.PersistenceFailureException}.
 */
public interface GeofenceStore {

    List<GeofenceRecord> loadAll();

    void save(GeofenceRecord geofence);

    /**
     * @return false when the geofence did not exist
     */
    boolean delete(String geofenceId);
}
