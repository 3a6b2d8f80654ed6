package com.geotracking.engine.persistence;

import com.geotracking.engine.dto.AlertRecord;
import com.geotracking.engine.entity.AlertEntity;
import com.geotracking.engine.exception.PersistenceFailureException;
import com.geotracking.engine.repository.AlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaAlertStore implements AlertStore {

    private final AlertRepository alertRepository;

    @Override
    @Transactional
    public void save(AlertRecord alert) {
        try {
            alertRepository.save(AlertEntity.fromRecord(alert));
            log.debug("Persisted {}", alert.toLogString());
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("SaveAlert", e);
        }
    }

    @Override
    @Transactional
    public boolean markRead(String alertId) {
        try {
            return alertRepository.markRead(alertId) > 0;
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("MarkAlertRead", e);
        }
    }

    @Override
    @Transactional
    public int markAllRead(Collection<String> deviceIds) {
        try {
            if (deviceIds == null) {
                return alertRepository.markAllRead();
            }
            if (deviceIds.isEmpty()) {
                return 0;
            }
            return alertRepository.markAllReadForDevices(deviceIds);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("MarkAllAlertsRead", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<AlertRecord> find(Boolean read, Collection<String> deviceIds) {
        try {
            List<AlertEntity> entities;
            if (deviceIds != null && deviceIds.isEmpty()) {
                return List.of();
            } else if (deviceIds == null && read == null) {
                entities = alertRepository.findAllByOrderByCreatedAtDesc();
            } else if (deviceIds == null) {
                entities = alertRepository.findByReadOrderByCreatedAtDesc(read);
            } else if (read == null) {
                entities = alertRepository.findByDeviceIdInOrderByCreatedAtDesc(deviceIds);
            } else {
                entities = alertRepository.findByDeviceIdInAndReadOrderByCreatedAtDesc(deviceIds, read);
            }
            return entities.stream().map(AlertEntity::toRecord).toList();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("FindAlerts", e);
        }
    }
}
