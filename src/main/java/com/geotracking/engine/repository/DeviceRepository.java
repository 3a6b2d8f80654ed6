package com.geotracking.engine.repository;

import com.geotracking.engine.entity.DeviceEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DeviceRepository extends JpaRepository<DeviceEntity, String> {

    /**
     * Row-locked read used by state upserts so that the version comparison
     * and the write happen atomically.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DeviceEntity d WHERE d.deviceId = :deviceId")
    Optional<DeviceEntity> findForUpdate(@Param("deviceId") String deviceId);
}
