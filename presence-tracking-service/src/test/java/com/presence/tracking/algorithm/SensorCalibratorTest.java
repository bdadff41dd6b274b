package com.presence.tracking.algorithm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.presence.tracking.dto.CalibrationSample;
import com.presence.tracking.dto.SignalCalibration;
import com.presence.tracking.exception.ConfigurationException;

class SensorCalibratorTest {

    private final SensorCalibrator calibrator = new SensorCalibrator();

    private static CalibrationSample sample(double distance, double referenceRssi, double exponent) {
        return new CalibrationSample(distance, referenceRssi - 10 * exponent * Math.log10(distance));
    }

    @Test
    void should_RecoverCalibration_When_SamplesFollowTheModel() {
        List<CalibrationSample> samples = List.of(
            sample(1, -50, 3.0), sample(2, -50, 3.0), sample(5, -50, 3.0), sample(10, -50, 3.0));

        SignalCalibration calibration = calibrator.calibrate(samples);

        assertThat(calibration.referenceRssi()).isCloseTo(-50.0, within(1e-9));
        assertThat(calibration.pathLossExponent()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void should_FitBestLine_When_SamplesAreNoisy() {
        List<CalibrationSample> samples = List.of(
            new CalibrationSample(1, -58), new CalibrationSample(1, -60),
            new CalibrationSample(10, -83), new CalibrationSample(10, -85));

        SignalCalibration calibration = calibrator.calibrate(samples);

        assertThat(calibration.referenceRssi()).isCloseTo(-59.0, within(1e-9));
        assertThat(calibration.pathLossExponent()).isCloseTo(2.5, within(1e-9));
    }

    @Test
    void should_Reject_When_OnlyOneSample() {
        assertThatThrownBy(() -> calibrator.calibrate(List.of(new CalibrationSample(1, -59))))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void should_Reject_When_AllSamplesShareADistance() {
        assertThatThrownBy(() -> calibrator.calibrate(List.of(
            new CalibrationSample(2, -60), new CalibrationSample(2, -62))))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("distinct distances");
    }

    @Test
    void should_Reject_When_SignalGrowsWithDistance() {
        assertThatThrownBy(() -> calibrator.calibrate(List.of(
            new CalibrationSample(1, -70), new CalibrationSample(10, -50))))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void should_Reject_When_DistanceIsNotPositive() {
        assertThatThrownBy(() -> calibrator.calibrate(List.of(
            new CalibrationSample(0, -40), new CalibrationSample(3, -70))))
            .isInstanceOf(ConfigurationException.class);
    }
}
