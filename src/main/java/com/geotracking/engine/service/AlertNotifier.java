package com.geotracking.engine.service;

import com.geotracking.engine.dto.AlertRecord;

/**
 * Hand-off point to notification delivery (push, e-mail, SMS).
 *
 * Delivery itself happens outside this service; implementations must
 * return quickly and must not throw for delivery problems.
 */
public interface AlertNotifier {

    void handOff(AlertRecord alert);
}
