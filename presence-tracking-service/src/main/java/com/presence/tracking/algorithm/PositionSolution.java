package com.presence.tracking.algorithm;

import java.util.Objects;
import java.util.Optional;

import com.presence.tracking.dto.RawPosition;
import com.presence.tracking.dto.TrackingOutcome;

/**
 * Result of solving one device's readings for one tick.
 *
 * <p>"No position" is always explicit and carries the reason: {@link TrackingOutcome#INSUFFICIENT_SENSORS}
 * when there was not enough input, {@link TrackingOutcome#SOLVER_FAILURE} when the input was
 * numerically unusable. A low-confidence position is still a {@link TrackingOutcome#SUCCESS}.
 */
public record PositionSolution(TrackingOutcome outcome, RawPosition position, String detail) {

    public PositionSolution {
        Objects.requireNonNull(outcome, "outcome");
        if (outcome == TrackingOutcome.SUCCESS && position == null) {
            throw new IllegalArgumentException("A successful solution needs a position");
        }
    }

    public static PositionSolution success(RawPosition position) {
        return new PositionSolution(TrackingOutcome.SUCCESS, position, null);
    }

    public static PositionSolution insufficient(String detail) {
        return new PositionSolution(TrackingOutcome.INSUFFICIENT_SENSORS, null, detail);
    }

    public static PositionSolution failure(String detail) {
        return new PositionSolution(TrackingOutcome.SOLVER_FAILURE, null, detail);
    }

    public boolean isSuccess() {
        return outcome == TrackingOutcome.SUCCESS;
    }

    public Optional<RawPosition> raw() {
        return Optional.ofNullable(position);
    }
}
