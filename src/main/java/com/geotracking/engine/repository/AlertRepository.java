package com.geotracking.engine.repository;

import com.geotracking.engine.entity.AlertEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for AlertEntity.
 *
 * Query methods back the alerts panel: newest first, optionally filtered by
 * read status and by the set of devices the caller may see.
 */
@Repository
public interface AlertRepository extends JpaRepository<AlertEntity, String> {

    List<AlertEntity> findAllByOrderByCreatedAtDesc();

    List<AlertEntity> findByReadOrderByCreatedAtDesc(Boolean read);

    List<AlertEntity> findByDeviceIdInOrderByCreatedAtDesc(Collection<String> deviceIds);

    List<AlertEntity> findByDeviceIdInAndReadOrderByCreatedAtDesc(Collection<String> deviceIds, Boolean read);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AlertEntity a SET a.read = true WHERE a.id = :id")
    int markRead(@Param("id") String id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AlertEntity a SET a.read = true WHERE a.read = false")
    int markAllRead();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AlertEntity a SET a.read = true WHERE a.read = false AND a.deviceId IN :deviceIds")
    int markAllReadForDevices(@Param("deviceIds") Collection<String> deviceIds);
}
