package com.geotracking.engine.repository;

import com.geotracking.engine.entity.GeofenceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GeofenceRepository extends JpaRepository<GeofenceEntity, String> {

    /**
     * All geofences, active or not. Used to warm the live registry on
     * startup and on reload; inactive ones are kept so they can be
     * re-activated without a full definition.
     */
    List<GeofenceEntity> findAllByOrderByIdAsc();
}
