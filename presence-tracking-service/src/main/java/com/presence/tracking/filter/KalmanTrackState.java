package com.presence.tracking.filter;

import java.time.Instant;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import lombok.Getter;

/**
 * Filter state of one device: the vector (x, y, vx, vy), its 4×4 covariance and the time the
 * state refers to.
 *
 * <p>Not thread-safe. It lives inside a device track and is only touched while that track's
 * monitor is held.
 */
@Getter
public class KalmanTrackState {

    public static final int X = 0;
    public static final int Y = 1;
    public static final int VX = 2;
    public static final int VY = 3;

    private RealVector state;
    private RealMatrix covariance;
    private Instant lastUpdate;

    KalmanTrackState(RealVector state, RealMatrix covariance, Instant lastUpdate) {
        this.state = state;
        this.covariance = covariance;
        this.lastUpdate = lastUpdate;
    }

    void commit(RealVector newState, RealMatrix newCovariance, Instant time) {
        this.state = newState;
        this.covariance = newCovariance;
        this.lastUpdate = time;
    }

    public double x() {
        return state.getEntry(X);
    }

    public double y() {
        return state.getEntry(Y);
    }

    public double vx() {
        return state.getEntry(VX);
    }

    public double vy() {
        return state.getEntry(VY);
    }

    /**
     * Sum of the x and y variances, in m².
     */
    public double positionalVariance() {
        return covariance.getEntry(X, X) + covariance.getEntry(Y, Y);
    }
}
