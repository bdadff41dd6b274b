package com.presence.tracking.algorithm.impl;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.springframework.stereotype.Component;

import com.presence.tracking.algorithm.RangeMeasurement;
import com.presence.tracking.algorithm.util.GeometryQualityCalculator;
import com.presence.tracking.config.TrackingProperties;
import com.presence.tracking.dto.Coordinate;
import com.presence.tracking.dto.PositioningMethod;
import com.presence.tracking.dto.RawPosition;
import com.presence.tracking.exception.NumericalFailureException;

import lombok.extern.slf4j.Slf4j;

/**
 * Multilateration of a device from three or more sensor distance estimates.
 *
 * <p>MATHEMATICAL FOUNDATION:
 *
 * <p>1. Linearisation. For each sensor i: (x - xᵢ)² + (y - yᵢ)² = dᵢ². Subtracting the equation of
 * a reference sensor 0 removes the quadratic terms:
 * <pre>
 *    A = 2 × [(xᵢ - x₀), (yᵢ - y₀)]                          for i = 1..n-1
 *    b = (xᵢ² + yᵢ²) - (x₀² + y₀²) + (d₀² - dᵢ²)
 * </pre>
 * The reference is the sensor with the smallest estimated distance, the one whose RSSI is the
 * least distorted by path loss.
 *
 * <p>2. Solve. With exactly three sensors A is 2×2 and is solved directly (Cramer's rule). With
 * more sensors the overdetermined system is solved in the least-squares sense through QR
 * decomposition.
 *
 * <p>3. Conditioning. The normal matrix N = AᵀA is tested before solving:
 * <pre>
 *    ν = det(N) / (trace(N)² / 4) = 4λ₁λ₂ / (λ₁ + λ₂)²      ∈ [0, 1]
 * </pre>
 * ν is scale free: 1 for perfectly orthogonal geometry, 0 for collinear sensors. A system with ν
 * below the configured epsilon is reported as a numerical failure.
 *
 * <p>4. Confidence = residualFactor × spreadFactor × countFactor, where
 * <pre>
 *    residualFactor = 1 / (1 + RMS(|p - sᵢ| - dᵢ) / residualScale)
 *    spreadFactor   = min(1, λmin(cov(sensor positions)) / spreadReferenceVariance)
 *    countFactor    = floor + (1 - floor) × min(1, (n - 3) / (saturation - 3))
 * </pre>
 */
@Slf4j
@Component
public class MultilaterationSolver {

    /** Minimum number of ranges that constrain a 2D position. */
    public static final int MIN_RANGES = 3;

    /** Coefficient of the linearised system: 2(pᵢ - p₀). */
    private static final double LINEARIZATION_FACTOR = 2.0;

    private final TrackingProperties.Solver config;

    public MultilaterationSolver(TrackingProperties properties) {
        this.config = properties.getSolver();
    }

    /**
     * Solve for the device position.
     *
     * @param ranges one range per distinct sensor, at least {@value #MIN_RANGES}
     * @return the solved position with method {@link PositioningMethod#MULTILATERATION}
     * @throws NumericalFailureException if the geometry is singular or near-singular, or the
     *     solution is not finite
     */
    public RawPosition solve(List<RangeMeasurement> ranges) {
        if (ranges == null || ranges.size() < MIN_RANGES) {
            throw new IllegalArgumentException("Multilateration requires at least " + MIN_RANGES + " ranges");
        }

        List<RangeMeasurement> ordered = new ArrayList<>(ranges);
        ordered.sort(Comparator.comparingDouble(RangeMeasurement::distance));
        RangeMeasurement ref = ordered.get(0);

        int rows = ordered.size() - 1;
        double[][] matrixData = new double[rows][2];
        double[] constants = new double[rows];
        for (int i = 1; i < ordered.size(); i++) {
            RangeMeasurement r = ordered.get(i);
            matrixData[i - 1][0] = LINEARIZATION_FACTOR * (r.x() - ref.x());
            matrixData[i - 1][1] = LINEARIZATION_FACTOR * (r.y() - ref.y());
            constants[i - 1] = (r.x() * r.x() + r.y() * r.y())
                - (ref.x() * ref.x() + ref.y() * ref.y())
                + (ref.distance() * ref.distance() - r.distance() * r.distance());
        }

        RealMatrix a = new Array2DRowRealMatrix(matrixData, false);
        RealVector b = new ArrayRealVector(constants, false);

        double conditioning = normalizedDeterminant(a);
        if (!(conditioning >= config.getSingularityEpsilon())) {
            throw new NumericalFailureException(String.format(
                "Sensor geometry is near-singular (normalized determinant %.2e)", conditioning));
        }

        double[] solution = rows == 2 ? solveExact(matrixData, constants) : solveLeastSquares(a, b);
        double x = solution[0];
        double y = solution[1];
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new NumericalFailureException("Multilateration produced a non-finite position");
        }

        double confidence = calculateConfidence(ordered, x, y);
        log.debug("Multilateration from {} sensors (reference {}): ({}, {}) confidence {}",
            ordered.size(), ref.sensorId(), x, y, confidence);
        return new RawPosition(x, y, confidence, ordered.size(), PositioningMethod.MULTILATERATION);
    }

    /**
     * ν = det(AᵀA) / (trace(AᵀA)² / 4). Returns 0 when the rows carry no information.
     */
    static double normalizedDeterminant(RealMatrix a) {
        RealMatrix normal = a.transpose().multiply(a);
        double trace = normal.getTrace();
        if (!(trace > 0) || !Double.isFinite(trace)) {
            return 0.0;
        }
        double det = normal.getEntry(0, 0) * normal.getEntry(1, 1)
            - normal.getEntry(0, 1) * normal.getEntry(1, 0);
        return det / (trace * trace / 4.0);
    }

    private double[] solveExact(double[][] m, double[] c) {
        double det = m[0][0] * m[1][1] - m[0][1] * m[1][0];
        double x = (c[0] * m[1][1] - m[0][1] * c[1]) / det;
        double y = (m[0][0] * c[1] - c[0] * m[1][0]) / det;
        return new double[] {x, y};
    }

    private double[] solveLeastSquares(RealMatrix a, RealVector b) {
        DecompositionSolver solver = new QRDecomposition(a).getSolver();
        if (!solver.isNonSingular()) {
            throw new NumericalFailureException("Linearised multilateration system is singular");
        }
        try {
            return solver.solve(b).toArray();
        } catch (SingularMatrixException e) {
            throw new NumericalFailureException("Linearised multilateration system is singular", e);
        }
    }

    private double calculateConfidence(List<RangeMeasurement> ranges, double x, double y) {
        double sumSquares = 0;
        List<Coordinate> sensorPositions = new ArrayList<>(ranges.size());
        for (RangeMeasurement r : ranges) {
            double residual = Math.hypot(x - r.x(), y - r.y()) - r.distance();
            sumSquares += residual * residual;
            sensorPositions.add(new Coordinate(r.x(), r.y()));
        }
        double rms = Math.sqrt(sumSquares / ranges.size());
        double residualFactor = 1.0 / (1.0 + rms / config.getResidualScaleMeters());

        double minVariance = GeometryQualityCalculator.minimumSpreadVariance(sensorPositions);
        double spreadFactor = Math.min(1.0, minVariance / config.getSpreadReferenceVariance());

        double countFactor = countFactor(ranges.size());

        double confidence = residualFactor * spreadFactor * countFactor;
        log.trace("Confidence factors - residual: {} (rms {}), spread: {}, count: {}",
            residualFactor, rms, spreadFactor, countFactor);
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    double countFactor(int sensorCount) {
        int saturation = config.getSensorCountSaturation();
        double floor = config.getCountFactorFloor();
        if (saturation <= MIN_RANGES) {
            return 1.0;
        }
        double progress = Math.min(1.0, (double) (sensorCount - MIN_RANGES) / (saturation - MIN_RANGES));
        return floor + (1.0 - floor) * Math.max(0.0, progress);
    }
}
