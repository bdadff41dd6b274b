package com.presence.tracking.algorithm.util;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.presence.tracking.dto.Coordinate;

/**
 * Geometry helpers used to judge how well a set of sensor locations constrains a multilateration
 * solve.
 *
 * <p>The solver uses the spread of the sensors as a coarse dilution-of-precision proxy: the
 * smallest eigenvalue of the sensors' positional covariance matrix is the variance of the
 * sensors along their "thinnest" direction. It is zero when all sensors are collinear and grows
 * as they surround the device.
 *
 * <p>Mathematical Foundation: for a symmetric 2×2 matrix [[a, c], [c, b]] the eigenvalues are
 * λ₁,λ₂ = (trace ± √(trace² - 4×det)) / 2 with trace = a + b and det = ab - c².
 */
public final class GeometryQualityCalculator {

  private static final Logger logger = LoggerFactory.getLogger(GeometryQualityCalculator.class);

  private static final int EIGENVALUE_DETERMINANT_COEFFICIENT = 4;
  private static final double EIGENVALUE_CALCULATION_DIVISOR = 2.0;

  private GeometryQualityCalculator() {}

  /**
   * Population covariance of a set of points.
   *
   * @param points at least one point
   * @return [covXX, covYY, covXY]
   * @throws IllegalArgumentException if the list is empty
   */
  public static double[] calculatePositionCovarianceMatrix(List<Coordinate> points) {
    if (points.isEmpty()) {
      throw new IllegalArgumentException("Position list cannot be empty");
    }

    double meanX = 0;
    double meanY = 0;
    for (Coordinate p : points) {
      meanX += p.x();
      meanY += p.y();
    }
    meanX /= points.size();
    meanY /= points.size();

    double covXX = 0, covYY = 0, covXY = 0;
    for (Coordinate p : points) {
      double dx = p.x() - meanX;
      double dy = p.y() - meanY;
      covXX += dx * dx;
      covYY += dy * dy;
      covXY += dx * dy;
    }
    int n = points.size();
    covXX /= n;
    covYY /= n;
    covXY /= n;

    logger.debug("Sensor covariance matrix: [{}, {}; {}, {}]", covXX, covXY, covXY, covYY);
    return new double[] {covXX, covYY, covXY};
  }

  /**
   * Eigenvalues of a symmetric 2×2 matrix, largest first. Negative rounding noise is clamped to 0.
   */
  public static double[] symmetricEigenvalues(double a, double b, double c) {
    double trace = a + b;
    double determinant = a * b - c * c;
    double discriminant = trace * trace - EIGENVALUE_DETERMINANT_COEFFICIENT * determinant;
    double sqrtDiscriminant = Math.sqrt(Math.max(0.0, discriminant));
    double lambda1 = (trace + sqrtDiscriminant) / EIGENVALUE_CALCULATION_DIVISOR;
    double lambda2 = (trace - sqrtDiscriminant) / EIGENVALUE_CALCULATION_DIVISOR;
    return new double[] {Math.max(0.0, lambda1), Math.max(0.0, lambda2)};
  }

  /**
   * Variance of the points along their least spread direction, in m².
   */
  public static double minimumSpreadVariance(List<Coordinate> points) {
    double[] cov = calculatePositionCovarianceMatrix(points);
    return symmetricEigenvalues(cov[0], cov[1], cov[2])[1];
  }
}
