package com.presence.tracking.zone;

import java.util.List;

import com.presence.tracking.dto.Coordinate;

/**
 * Point-in-polygon test for simple polygons.
 *
 * <p>A point lying on an edge or vertex, within {@link #BOUNDARY_TOLERANCE} meters, counts as
 * inside. Any other point is classified with the even-odd rule: a ray is cast towards +x and
 * each edge it crosses toggles the result. Edges are treated as half-open in y
 * (min(y₁, y₂) &lt; y ≤ max(y₁, y₂)) so a ray through a vertex is counted once.
 */
public final class PolygonContainment {

    /** Distance, in meters, within which a point is considered to be on the boundary. */
    public static final double BOUNDARY_TOLERANCE = 1e-9;

    private PolygonContainment() {}

    public static boolean contains(List<Coordinate> vertices, Coordinate point) {
        int n = vertices.size();
        if (n < 3 || !point.isFinite()) {
            return false;
        }

        boolean inside = false;
        for (int i = 0, j = n - 1; i < n; j = i++) {
            Coordinate a = vertices.get(j);
            Coordinate b = vertices.get(i);

            if (distanceToSegment(point, a, b) <= BOUNDARY_TOLERANCE) {
                return true;
            }

            boolean spansY = (a.y() < point.y()) != (b.y() < point.y());
            if (spansY) {
                double xCrossing = a.x() + (point.y() - a.y()) * (b.x() - a.x()) / (b.y() - a.y());
                if (point.x() < xCrossing) {
                    inside = !inside;
                }
            }
        }
        return inside;
    }

    static double distanceToSegment(Coordinate p, Coordinate a, Coordinate b) {
        double dx = b.x() - a.x();
        double dy = b.y() - a.y();
        double lengthSquared = dx * dx + dy * dy;
        if (lengthSquared == 0) {
            return p.distanceTo(a);
        }
        double t = ((p.x() - a.x()) * dx + (p.y() - a.y()) * dy) / lengthSquared;
        t = Math.max(0.0, Math.min(1.0, t));
        return Math.hypot(p.x() - (a.x() + t * dx), p.y() - (a.y() + t * dy));
    }
}
