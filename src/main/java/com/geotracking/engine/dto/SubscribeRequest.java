package com.geotracking.engine.dto;

import java.util.List;

/**
 * Body of a live subscription request: either an explicit device list
 * or {@code all = true}.
 */
public record SubscribeRequest(
    List<String> deviceIds,
    boolean all
) {
    public boolean isEmpty() {
        return !all && (deviceIds == null || deviceIds.isEmpty());
    }
}
