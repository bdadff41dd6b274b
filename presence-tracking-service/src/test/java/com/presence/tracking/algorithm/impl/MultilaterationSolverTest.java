package com.presence.tracking.algorithm.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.presence.tracking.algorithm.RangeMeasurement;
import com.presence.tracking.config.TrackingProperties;
import com.presence.tracking.dto.PositioningMethod;
import com.presence.tracking.dto.RawPosition;
import com.presence.tracking.exception.NumericalFailureException;

class MultilaterationSolverTest {

    private static final double TOLERANCE = 1e-6;

    private MultilaterationSolver solver;

    @BeforeEach
    void setUp() {
        solver = new MultilaterationSolver(new TrackingProperties());
    }

    private static RangeMeasurement range(String id, double x, double y, double trueX, double trueY) {
        return new RangeMeasurement(id, x, y, Math.hypot(trueX - x, trueY - y));
    }

    @Nested
    @DisplayName("Exact Three Sensor Solve")
    class ThreeSensorTests {

        @Test
        @DisplayName("should recover the device position from an equilateral sensor triangle")
        void should_RecoverPosition_When_DistancesAreExact() {
            List<RangeMeasurement> ranges = List.of(
                range("s1", 0, 0, 5.0, 4.33),
                range("s2", 10, 0, 5.0, 4.33),
                range("s3", 5, 8.66, 5.0, 4.33));

            RawPosition position = solver.solve(ranges);

            assertThat(position.x()).isCloseTo(5.0, within(TOLERANCE));
            assertThat(position.y()).isCloseTo(4.33, within(TOLERANCE));
            assertThat(position.method()).isEqualTo(PositioningMethod.MULTILATERATION);
            assertThat(position.sensorCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("should give the count floor as confidence for a perfect three sensor fix")
        void should_UseCountFloor_When_ResidualIsZeroAndSpreadIsWide() {
            List<RangeMeasurement> ranges = List.of(
                range("s1", 0, 0, 5.0, 4.33),
                range("s2", 10, 0, 5.0, 4.33),
                range("s3", 5, 8.66, 5.0, 4.33));

            assertThat(solver.solve(ranges).confidence()).isCloseTo(0.8, within(TOLERANCE));
        }

        @Test
        @DisplayName("should solve at the circumcenter when all three distances are equal")
        void should_SolveCircumcenter_When_DistancesAreEqual() {
            List<RangeMeasurement> ranges = List.of(
                new RangeMeasurement("s1", 0, 0, 5.0),
                new RangeMeasurement("s2", 10, 0, 5.0),
                new RangeMeasurement("s3", 5, 8.66, 5.0));

            RawPosition position = solver.solve(ranges);

            assertThat(position.x()).isCloseTo(5.0, within(1e-3));
            assertThat(position.y()).isCloseTo(2.887, within(1e-3));
            assertThat(position.confidence()).isLessThan(0.8);
        }
    }

    @Nested
    @DisplayName("Least Squares Solve")
    class LeastSquaresTests {

        @Test
        @DisplayName("should recover the position from four sensors through QR decomposition")
        void should_RecoverPosition_When_OverDetermined() {
            List<RangeMeasurement> ranges = List.of(
                range("a", 0, 0, 3, 4),
                range("b", 10, 0, 3, 4),
                range("c", 10, 10, 3, 4),
                range("d", 0, 10, 3, 4));

            RawPosition position = solver.solve(ranges);

            assertThat(position.x()).isCloseTo(3.0, within(TOLERANCE));
            assertThat(position.y()).isCloseTo(4.0, within(TOLERANCE));
            assertThat(position.sensorCount()).isEqualTo(4);
            assertThat(position.confidence()).isCloseTo(0.8 + 0.2 / 3.0, within(TOLERANCE));
        }

        @Test
        @DisplayName("should not depend on the order of the measurements")
        void should_IgnoreInputOrder() {
            List<RangeMeasurement> ordered = List.of(
                range("a", 0, 0, 7, 2),
                range("b", 10, 0, 7, 2),
                range("c", 10, 10, 7, 2),
                range("d", 0, 10, 7, 2),
                range("e", 5, 5, 7, 2));
            List<RangeMeasurement> shuffled = List.of(
                ordered.get(3), ordered.get(0), ordered.get(4), ordered.get(2), ordered.get(1));

            RawPosition first = solver.solve(ordered);
            RawPosition second = solver.solve(shuffled);

            assertThat(second.x()).isCloseTo(first.x(), within(TOLERANCE));
            assertThat(second.y()).isCloseTo(first.y(), within(TOLERANCE));
        }
    }

    @Nested
    @DisplayName("Confidence Factors")
    class ConfidenceTests {

        @Test
        @DisplayName("should lower confidence when distances disagree with the solution")
        void should_LowerConfidence_When_ResidualGrows() {
            List<RangeMeasurement> exact = List.of(
                range("a", 0, 0, 3, 4),
                range("b", 10, 0, 3, 4),
                range("c", 10, 10, 3, 4),
                range("d", 0, 10, 3, 4));
            List<RangeMeasurement> noisy = List.of(
                new RangeMeasurement("a", 0, 0, exact.get(0).distance() + 1.5),
                new RangeMeasurement("b", 10, 0, exact.get(1).distance() - 1.0),
                new RangeMeasurement("c", 10, 10, exact.get(2).distance() + 2.0),
                new RangeMeasurement("d", 0, 10, exact.get(3).distance() - 0.5));

            assertThat(solver.solve(noisy).confidence()).isLessThan(solver.solve(exact).confidence());
        }

        @Test
        @DisplayName("should penalise sensors clustered along one direction")
        void should_LowerConfidence_When_SensorsAreNearlyCollinear() {
            List<RangeMeasurement> ranges = List.of(
                range("a", 0, 0, 2, 0.5),
                range("b", 4, 0, 2, 0.5),
                range("c", 2, 1, 2, 0.5));

            RawPosition position = solver.solve(ranges);

            assertThat(position.x()).isCloseTo(2.0, within(TOLERANCE));
            assertThat(position.y()).isCloseTo(0.5, within(TOLERANCE));
            assertThat(position.confidence()).isLessThan(0.1);
        }

        @Test
        @DisplayName("should reward more sensors up to the saturation point")
        void should_SaturateCountFactor() {
            assertThat(solver.countFactor(3)).isCloseTo(0.8, within(TOLERANCE));
            assertThat(solver.countFactor(4)).isGreaterThan(solver.countFactor(3));
            assertThat(solver.countFactor(6)).isCloseTo(1.0, within(TOLERANCE));
            assertThat(solver.countFactor(12)).isCloseTo(1.0, within(TOLERANCE));
        }

        @Test
        @DisplayName("should keep confidence inside [0, 1]")
        void should_BoundConfidence() {
            List<RangeMeasurement> wild = List.of(
                new RangeMeasurement("a", 0, 0, 100),
                new RangeMeasurement("b", 10, 0, 0.1),
                new RangeMeasurement("c", 5, 9, 50));

            assertThat(solver.solve(wild).confidence()).isBetween(0.0, 1.0);
        }
    }

    @Nested
    @DisplayName("Failure Handling")
    class FailureTests {

        @Test
        @DisplayName("should report collinear sensors as a numerical failure")
        void should_Fail_When_SensorsAreCollinear() {
            List<RangeMeasurement> ranges = List.of(
                new RangeMeasurement("a", 0, 0, 3),
                new RangeMeasurement("b", 5, 0, 3),
                new RangeMeasurement("c", 10, 0, 7));

            assertThatThrownBy(() -> solver.solve(ranges))
                .isInstanceOf(NumericalFailureException.class)
                .hasMessageContaining("near-singular");
        }

        @Test
        @DisplayName("should report nearly collinear sensors as a numerical failure")
        void should_Fail_When_DeterminantIsBelowEpsilon() {
            List<RangeMeasurement> ranges = List.of(
                range("a", 0, 0, 5, 5),
                range("b", 10, 0, 5, 5),
                range("c", 20, 0.001, 5, 5));

            assertThatThrownBy(() -> solver.solve(ranges)).isInstanceOf(NumericalFailureException.class);
        }

        @Test
        @DisplayName("should report co-located sensors as a numerical failure")
        void should_Fail_When_SensorsShareALocation() {
            List<RangeMeasurement> ranges = List.of(
                new RangeMeasurement("a", 1, 1, 2),
                new RangeMeasurement("b", 1, 1, 3),
                new RangeMeasurement("c", 1, 1, 4));

            assertThatThrownBy(() -> solver.solve(ranges)).isInstanceOf(NumericalFailureException.class);
        }

        @Test
        @DisplayName("should refuse fewer than three ranges")
        void should_RejectTooFewRanges() {
            List<RangeMeasurement> ranges = List.of(
                new RangeMeasurement("a", 0, 0, 3),
                new RangeMeasurement("b", 5, 0, 3));

            assertThatThrownBy(() -> solver.solve(ranges)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
