package com.geotracking.engine.dto;

import com.geotracking.engine.model.RejectionReason;

import java.util.List;

/**
 * Outcome of ingesting one ping: {@code Accepted} or {@code Rejected(reason)}.
 *
 * @param alerts alerts actually created while processing the ping (after cool-down)
 */
public record IngestResult(
    String deviceId,
    boolean accepted,
    RejectionReason reason,
    String detail,
    List<AlertRecord> alerts
) {

    public static IngestResult accepted(String deviceId, List<AlertRecord> alerts) {
        return new IngestResult(deviceId, true, null, null, List.copyOf(alerts));
    }

    public static IngestResult rejected(String deviceId, RejectionReason reason, String detail) {
        return new IngestResult(deviceId, false, reason, detail, List.of());
    }
}
