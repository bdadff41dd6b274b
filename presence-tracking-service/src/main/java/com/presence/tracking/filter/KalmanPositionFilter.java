package com.presence.tracking.filter;

import java.time.Duration;
import java.time.Instant;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.springframework.stereotype.Component;

import com.presence.tracking.config.TrackingProperties;
import com.presence.tracking.dto.RawPosition;
import com.presence.tracking.exception.NumericalFailureException;

import lombok.extern.slf4j.Slf4j;

/**
 * Constant-velocity Kalman filter over the state (x, y, vx, vy).
 *
 * <p>MATHEMATICAL FOUNDATION:
 * <pre>
 * Predict:  x⁻ = F·x            P⁻ = F·P·Fᵀ + Q
 *           F  = [[1, 0, dt, 0], [0, 1, 0, dt], [0, 0, 1, 0], [0, 0, 0, 1]]
 *           Q  = q × [[dt³/3, dt²/2], [dt²/2, dt]]  per axis (position, velocity)
 *
 * Correct:  H = [[1, 0, 0, 0], [0, 1, 0, 0]]     R = σ² / max(c, c_min) × I₂
 *           S = H·P⁻·Hᵀ + R     K = P⁻·Hᵀ·S⁻¹
 *           x = x⁻ + K·(z - H·x⁻)
 *           P = (I - K·H)·P⁻·(I - K·H)ᵀ + K·R·Kᵀ      (Joseph form)
 * </pre>
 * The Joseph form keeps P symmetric positive semi-definite under rounding; the result is also
 * re-symmetrised explicitly. Lower raw confidence means a larger R and therefore a smaller
 * correction.
 *
 * <p>Published confidence is 1 / (1 + (Pxx + Pyy) / scale), so it falls as positional
 * uncertainty grows.
 */
@Slf4j
@Component
public class KalmanPositionFilter {

    private static final int STATE_SIZE = 4;
    private static final int MEASUREMENT_SIZE = 2;
    private static final double MILLIS_PER_SECOND = 1000.0;

    private static final RealMatrix H = MatrixUtils.createRealMatrix(new double[][] {
        {1, 0, 0, 0},
        {0, 1, 0, 0}
    });

    private final TrackingProperties.Filter config;

    public KalmanPositionFilter(TrackingProperties properties) {
        this.config = properties.getFilter();
    }

    /**
     * Start a track at the raw position with zero velocity.
     */
    public KalmanTrackState initialize(RawPosition raw, Instant time) {
        double r = measurementVariance(raw.confidence());
        RealVector state = new ArrayRealVector(new double[] {raw.x(), raw.y(), 0.0, 0.0});
        RealMatrix covariance = initialCovariance(r);
        log.debug("Initialised track at ({}, {}) with position variance {}", raw.x(), raw.y(), r);
        return new KalmanTrackState(state, covariance, time);
    }

    /**
     * Advance the state to {@code time}. Nothing happens when time does not move forward.
     *
     * <p>A covariance that becomes non-finite or exceeds the divergence bound is reset to the
     * widest initial uncertainty; the predicted position is kept if it is finite.
     */
    public void predict(KalmanTrackState track, Instant time) {
        double dt = Duration.between(track.getLastUpdate(), time).toMillis() / MILLIS_PER_SECOND;
        if (dt <= 0) {
            return;
        }

        RealMatrix f = transition(dt);
        RealVector predictedState = f.operate(track.getState());
        RealMatrix predictedCovariance = symmetrize(
            f.multiply(track.getCovariance()).multiply(f.transpose()).add(processNoise(dt)));

        if (!isFinite(predictedState)) {
            log.warn("Prediction over {}s produced a non-finite state, keeping the previous estimate", dt);
            track.commit(track.getState(), initialCovariance(widestMeasurementVariance()), time);
            return;
        }
        if (!isHealthy(predictedCovariance)) {
            log.warn("Covariance diverged after prediction over {}s (trace {}), resetting uncertainty",
                dt, predictedCovariance.getTrace());
            predictedCovariance = initialCovariance(widestMeasurementVariance());
        }
        track.commit(predictedState, predictedCovariance, time);
    }

    /**
     * Correct the state with a raw position observation of (x, y).
     *
     * @throws NumericalFailureException if the update is singular or produces a non-finite or
     *     diverged estimate; the track keeps its prior estimate in that case
     */
    public void correct(KalmanTrackState track, RawPosition raw) {
        if (!raw.isValid()) {
            throw new NumericalFailureException("Raw position is not finite");
        }
        double r = measurementVariance(raw.confidence());
        RealMatrix measurementNoise = MatrixUtils.createRealIdentityMatrix(MEASUREMENT_SIZE).scalarMultiply(r);

        RealMatrix p = track.getCovariance();
        RealVector x = track.getState();

        RealMatrix s = H.multiply(p).multiply(H.transpose()).add(measurementNoise);
        RealMatrix sInverse;
        try {
            DecompositionSolver solver = new LUDecomposition(s).getSolver();
            sInverse = solver.getInverse();
        } catch (SingularMatrixException e) {
            throw new NumericalFailureException("Innovation covariance is singular", e);
        }

        RealMatrix gain = p.multiply(H.transpose()).multiply(sInverse);
        RealVector innovation = new ArrayRealVector(new double[] {raw.x(), raw.y()}).subtract(H.operate(x));
        RealVector updatedState = x.add(gain.operate(innovation));

        RealMatrix iMinusKh = MatrixUtils.createRealIdentityMatrix(STATE_SIZE).subtract(gain.multiply(H));
        RealMatrix updatedCovariance = symmetrize(
            iMinusKh.multiply(p).multiply(iMinusKh.transpose())
                .add(gain.multiply(measurementNoise).multiply(gain.transpose())));

        if (!isFinite(updatedState) || !isHealthy(updatedCovariance)) {
            throw new NumericalFailureException(String.format(
                "Filter update diverged (covariance trace %s)", updatedCovariance.getTrace()));
        }
        track.commit(updatedState, updatedCovariance, track.getLastUpdate());
    }

    /**
     * Confidence in [0, 1] derived from the positional covariance.
     */
    public double confidence(KalmanTrackState track) {
        double variance = track.positionalVariance();
        if (!Double.isFinite(variance) || variance < 0) {
            return 0.0;
        }
        double confidence = 1.0 / (1.0 + variance / config.getConfidenceScale());
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    double measurementVariance(double confidence) {
        return config.getBaseMeasurementVariance() / Math.max(confidence, config.getMinMeasurementConfidence());
    }

    private double widestMeasurementVariance() {
        return config.getBaseMeasurementVariance() / config.getMinMeasurementConfidence();
    }

    private RealMatrix initialCovariance(double positionVariance) {
        double v0 = config.getInitialVelocityVariance();
        return MatrixUtils.createRealDiagonalMatrix(new double[] {positionVariance, positionVariance, v0, v0});
    }

    private static RealMatrix transition(double dt) {
        return MatrixUtils.createRealMatrix(new double[][] {
            {1, 0, dt, 0},
            {0, 1, 0, dt},
            {0, 0, 1, 0},
            {0, 0, 0, 1}
        });
    }

    private RealMatrix processNoise(double dt) {
        double q = config.getProcessNoise();
        double pp = q * dt * dt * dt / 3.0;
        double pv = q * dt * dt / 2.0;
        double vv = q * dt;
        return MatrixUtils.createRealMatrix(new double[][] {
            {pp, 0, pv, 0},
            {0, pp, 0, pv},
            {pv, 0, vv, 0},
            {0, pv, 0, vv}
        });
    }

    private static RealMatrix symmetrize(RealMatrix m) {
        return m.add(m.transpose()).scalarMultiply(0.5);
    }

    private static boolean isFinite(RealVector v) {
        return !v.isNaN() && !v.isInfinite();
    }

    private boolean isHealthy(RealMatrix covariance) {
        double trace = covariance.getTrace();
        if (!Double.isFinite(trace) || trace > config.getDivergenceBound()) {
            return false;
        }
        for (int i = 0; i < STATE_SIZE; i++) {
            for (int j = 0; j < STATE_SIZE; j++) {
                if (!Double.isFinite(covariance.getEntry(i, j))) {
                    return false;
                }
            }
        }
        return true;
    }
}
