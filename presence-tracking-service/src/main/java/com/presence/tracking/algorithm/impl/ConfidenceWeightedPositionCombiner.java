package com.presence.tracking.algorithm.impl;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.presence.tracking.algorithm.PositionCombiner;
import com.presence.tracking.dto.PositioningMethod;
import com.presence.tracking.dto.RawPosition;

/**
 * Combines candidate positions by confidence-weighted averaging.
 *
 * <p>MATHEMATICAL FOUNDATION:
 * <pre>
 * Position:   P = Σ(cᵢ × Pᵢ) / Σcᵢ
 * Confidence: C = Σ(cᵢ × cᵢ) / Σcᵢ
 * </pre>
 * The combined confidence is the weighted average of the inputs, so it never exceeds the largest
 * input confidence and two agreeing candidates are not penalised the way a product would.
 *
 * <p>When every candidate has zero confidence the weights degenerate; the positions are then
 * averaged with equal weights and the result carries confidence 0.
 */
@Component
public class ConfidenceWeightedPositionCombiner implements PositionCombiner {

    private static final Logger logger = LoggerFactory.getLogger(ConfidenceWeightedPositionCombiner.class);

    @Override
    public RawPosition combine(List<RawPosition> candidates, PositioningMethod method) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate position is required");
        }

        int sensorCount = candidates.stream().mapToInt(RawPosition::sensorCount).sum();
        double totalWeight = candidates.stream().mapToDouble(RawPosition::confidence).sum();
        double maxConfidence = candidates.stream().mapToDouble(RawPosition::confidence).max().orElse(0.0);

        if (totalWeight <= 0) {
            double meanX = candidates.stream().mapToDouble(RawPosition::x).average().orElse(0.0);
            double meanY = candidates.stream().mapToDouble(RawPosition::y).average().orElse(0.0);
            logger.debug("All {} candidates have zero confidence, using equal weights", candidates.size());
            return new RawPosition(meanX, meanY, 0.0, sensorCount, method);
        }

        double x = 0, y = 0, confidence = 0;
        for (RawPosition candidate : candidates) {
            double normalizedWeight = candidate.confidence() / totalWeight;
            x += candidate.x() * normalizedWeight;
            y += candidate.y() * normalizedWeight;
            confidence += candidate.confidence() * normalizedWeight;
        }

        // rounding can push the weighted mean a hair above its largest input
        confidence = Math.min(confidence, maxConfidence);

        logger.debug("Combined {} candidates into ({}, {}) with confidence {} [{}]",
            candidates.size(), x, y, confidence, method);
        return new RawPosition(x, y, confidence, sensorCount, method);
    }
}
