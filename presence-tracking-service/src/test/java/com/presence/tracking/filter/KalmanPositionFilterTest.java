package com.presence.tracking.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.presence.tracking.config.TrackingProperties;
import com.presence.tracking.dto.PositioningMethod;
import com.presence.tracking.dto.RawPosition;
import com.presence.tracking.exception.NumericalFailureException;

class KalmanPositionFilterTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private KalmanPositionFilter filter;

    @BeforeEach
    void setUp() {
        filter = new KalmanPositionFilter(new TrackingProperties());
    }

    private static RawPosition raw(double x, double y, double confidence) {
        return new RawPosition(x, y, confidence, 3, PositioningMethod.MULTILATERATION);
    }

    @Nested
    @DisplayName("Initialisation")
    class InitialisationTests {

        @Test
        @DisplayName("should start at the raw position with zero velocity")
        void should_StartAtRawPosition() {
            KalmanTrackState state = filter.initialize(raw(3, 4, 0.8), T0);

            assertThat(state.x()).isEqualTo(3.0);
            assertThat(state.y()).isEqualTo(4.0);
            assertThat(state.vx()).isZero();
            assertThat(state.vy()).isZero();
            assertThat(state.getLastUpdate()).isEqualTo(T0);
        }

        @Test
        @DisplayName("should size the initial position variance from the raw confidence")
        void should_UseMeasurementVarianceAsInitialUncertainty() {
            KalmanTrackState state = filter.initialize(raw(0, 0, 0.8), T0);

            assertThat(state.getCovariance().getEntry(0, 0)).isCloseTo(1.25, within(1e-12));
            assertThat(state.getCovariance().getEntry(1, 1)).isCloseTo(1.25, within(1e-12));
            assertThat(state.getCovariance().getEntry(2, 2)).isCloseTo(1.0, within(1e-12));
            assertThat(state.getCovariance().getEntry(0, 1)).isZero();
        }
    }

    @Nested
    @DisplayName("Prediction")
    class PredictionTests {

        @Test
        @DisplayName("should leave the state untouched when time does not advance")
        void should_SkipPredict_When_DtIsNotPositive() {
            KalmanTrackState state = filter.initialize(raw(1, 1, 0.5), T0);
            double before = state.positionalVariance();

            filter.predict(state, T0);
            filter.predict(state, T0.minusSeconds(5));

            assertThat(state.positionalVariance()).isEqualTo(before);
            assertThat(state.getLastUpdate()).isEqualTo(T0);
        }

        @Test
        @DisplayName("should grow uncertainty with the prediction interval")
        void should_GrowUncertainty_When_TimePasses() {
            KalmanTrackState shortGap = filter.initialize(raw(1, 1, 0.5), T0);
            KalmanTrackState longGap = filter.initialize(raw(1, 1, 0.5), T0);

            filter.predict(shortGap, T0.plusSeconds(1));
            filter.predict(longGap, T0.plusSeconds(10));

            assertThat(longGap.positionalVariance()).isGreaterThan(shortGap.positionalVariance());
            assertThat(filter.confidence(longGap)).isLessThan(filter.confidence(shortGap));
        }

        @Test
        @DisplayName("should reset the covariance when it diverges")
        void should_ResetCovariance_When_TraceExceedsBound() {
            KalmanTrackState state = filter.initialize(raw(2, 2, 0.9), T0);

            filter.predict(state, T0.plusSeconds(1_000_000));

            // widest measurement variance = 1.0 / 0.05 on each axis
            assertThat(state.positionalVariance()).isCloseTo(40.0, within(1e-9));
            assertThat(state.x()).isCloseTo(2.0, within(1e-9));
            assertThat(state.getLastUpdate()).isEqualTo(T0.plusSeconds(1_000_000));
        }
    }

    @Nested
    @DisplayName("Correction")
    class CorrectionTests {

        @Test
        @DisplayName("should correct less for a low confidence observation")
        void should_CorrectLess_When_ConfidenceIsLow() {
            KalmanTrackState confident = filter.initialize(raw(0, 0, 0.8), T0);
            KalmanTrackState doubtful = filter.initialize(raw(0, 0, 0.8), T0);
            filter.predict(confident, T0.plusSeconds(1));
            filter.predict(doubtful, T0.plusSeconds(1));

            filter.correct(confident, raw(10, 0, 0.9));
            filter.correct(doubtful, raw(10, 0, 0.1));

            assertThat(confident.x()).isGreaterThan(doubtful.x());
            assertThat(doubtful.x()).isGreaterThan(0.0);
        }

        @Test
        @DisplayName("should keep the covariance symmetric")
        void should_KeepCovarianceSymmetric() {
            KalmanTrackState state = filter.initialize(raw(0, 0, 0.8), T0);
            for (int i = 1; i <= 10; i++) {
                filter.predict(state, T0.plusSeconds(i));
                filter.correct(state, raw(i * 0.5, i * 0.25, 0.7));
            }

            for (int r = 0; r < 4; r++) {
                for (int c = 0; c < 4; c++) {
                    assertThat(state.getCovariance().getEntry(r, c))
                        .isCloseTo(state.getCovariance().getEntry(c, r), within(1e-12));
                }
            }
        }

        @Test
        @DisplayName("should retain the prior estimate when the observation is not finite")
        void should_RetainPrior_When_ObservationIsInvalid() {
            KalmanTrackState state = filter.initialize(raw(1, 2, 0.8), T0);
            filter.predict(state, T0.plusSeconds(1));
            double varianceBefore = state.positionalVariance();

            assertThatThrownBy(() -> filter.correct(state, raw(Double.NaN, 2, 0.8)))
                .isInstanceOf(NumericalFailureException.class);
            assertThat(state.x()).isEqualTo(1.0);
            assertThat(state.positionalVariance()).isEqualTo(varianceBefore);
        }
    }

    @Nested
    @DisplayName("Convergence")
    class ConvergenceTests {

        @Test
        @DisplayName("should converge to a static device position from noise-free observations")
        void should_ConvergeToStaticPosition() {
            KalmanTrackState state = filter.initialize(raw(0, 0, 0.8), T0);
            for (int i = 1; i <= 100; i++) {
                filter.predict(state, T0.plusSeconds(i));
                filter.correct(state, raw(3, 4, 0.8));
            }

            assertThat(state.x()).isCloseTo(3.0, within(1e-3));
            assertThat(state.y()).isCloseTo(4.0, within(1e-3));
        }

        @Test
        @DisplayName("should not lose confidence once converged")
        void should_KeepConfidence_When_Converged() {
            KalmanTrackState state = filter.initialize(raw(3, 4, 0.8), T0);
            double previous = -1;
            for (int i = 1; i <= 60; i++) {
                filter.predict(state, T0.plusSeconds(i));
                filter.correct(state, raw(3, 4, 0.8));
                double confidence = filter.confidence(state);
                if (i > 30) {
                    assertThat(confidence).isGreaterThanOrEqualTo(previous - 1e-6);
                }
                previous = confidence;
            }
            assertThat(state.x()).isCloseTo(3.0, within(1e-9));
            assertThat(previous).isBetween(0.0, 1.0);
        }
    }
}
