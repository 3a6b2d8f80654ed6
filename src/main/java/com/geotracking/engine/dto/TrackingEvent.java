package com.geotracking.engine.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Event delivered to live subscribers.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = DeviceStateDelta.class, name = "DEVICE_STATE"),
    @JsonSubTypes.Type(value = AlertRecord.class, name = "ALERT")
})
public sealed interface TrackingEvent permits DeviceStateDelta, AlertRecord {

    String deviceId();
}
