package com.geotracking.engine.model;

/**
 * Why a location ping was discarded without touching device state.
 */
public enum RejectionReason {
    /** Malformed input: coordinates, accuracy or battery out of range, or missing fields. */
    INVALID_PING,
    /** Timestamp not strictly newer than the device's recorded position. */
    STALE_OR_DUPLICATE,
    /** The device's stored record could not be loaded; the ping can be resent. */
    STORAGE_UNAVAILABLE
}
