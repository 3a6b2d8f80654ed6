package com.geotracking.engine.persistence;

import com.geotracking.engine.dto.GeofenceRecord;
import com.geotracking.engine.entity.GeofenceEntity;
import com.geotracking.engine.exception.PersistenceFailureException;
import com.geotracking.engine.repository.GeofenceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
@RequiredArgsConstructor
public class JpaGeofenceStore implements GeofenceStore {

    private final GeofenceRepository geofenceRepository;

    @Override
    @Transactional(readOnly = true)
    public List<GeofenceRecord> loadAll() {
        try {
            return geofenceRepository.findAllByOrderByIdAsc().stream().map(GeofenceEntity::toRecord).toList();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("LoadGeofences", e);
        }
    }

    @Override
    @Transactional
    public void save(GeofenceRecord geofence) {
        try {
            GeofenceEntity entity = geofenceRepository.findById(geofence.id())
                .map(existing -> existing.applyRecord(geofence))
                .orElseGet(() -> GeofenceEntity.fromRecord(geofence));
            geofenceRepository.save(entity);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("SaveGeofence", e);
        }
    }

    @Override
    @Transactional
    public boolean delete(String geofenceId) {
        try {
            if (!geofenceRepository.existsById(geofenceId)) {
                return false;
            }
            geofenceRepository.deleteById(geofenceId);
            return true;
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("DeleteGeofence", e);
        }
    }
}
