package com.presence.tracking.algorithm;

import java.util.List;

import com.presence.tracking.dto.PositioningMethod;
import com.presence.tracking.dto.RawPosition;

/**
 * Strategy for merging several candidate positions of the same device into one.
 */
public interface PositionCombiner {

    /**
     * Combine candidate positions into a single position tagged with {@code method}.
     *
     * @param candidates at least one candidate
     * @param method the method tag of the combined position
     * @return the combined position, its sensor count being the sum of the candidates' counts
     */
    RawPosition combine(List<RawPosition> candidates, PositioningMethod method);
}
