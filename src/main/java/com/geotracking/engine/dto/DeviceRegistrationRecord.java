package com.geotracking.engine.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Registration of a device ahead of its first ping.
 *
 * @param ownerId owning account; authorization for it lives outside this service
 */
public record DeviceRegistrationRecord(
    @NotBlank(message = "Device ID cannot be blank")
    String deviceId,
    String ownerId,
    String deviceType,
    String phoneNumber
) {
}
