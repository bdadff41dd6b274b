package com.presence.tracking.publish;

import com.presence.tracking.dto.DeviceDiagnostic;
import com.presence.tracking.dto.PositionUpdate;
import com.presence.tracking.dto.ZoneEvent;

/**
 * Outbound seam towards the host that exposes positions, occupancy and diagnostics.
 *
 * <p>Implementations are called from tracking worker threads and must be thread-safe.
 */
public interface TrackingEventPublisher {

    void publishPosition(PositionUpdate update);

    void publishZoneEvent(ZoneEvent event);

    void publishDiagnostic(DeviceDiagnostic diagnostic);
}
