package com.presence.tracking.tracking;

/**
 * UNINITIALIZED → TRACKING → STALE. A stale track is dropped; a device that reappears gets a new
 * UNINITIALIZED track.
 */
public enum DeviceLifecycleState {
    UNINITIALIZED,
    TRACKING,
    STALE
}
