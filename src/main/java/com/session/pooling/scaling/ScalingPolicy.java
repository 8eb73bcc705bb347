package com.session.pooling.scaling;

/**
 * Utilization thresholds and step size of the auto-scaler.
 *
 * @param highWaterMark utilization above which the pool grows
 * @param lowWaterMark  utilization below which the pool shrinks
 * @param maxStep       most sessions added or removed per cycle
 */
public record ScalingPolicy(double highWaterMark, double lowWaterMark, int maxStep) {

    public ScalingPolicy {
        if (lowWaterMark < 0 || highWaterMark > 1 || lowWaterMark >= highWaterMark) {
            throw new IllegalArgumentException("water marks must satisfy 0 <= low < high <= 1");
        }
        if (maxStep < 1) {
            throw new IllegalArgumentException("maxStep must be at least 1");
        }
    }

    public static ScalingPolicy defaults() {
        return new ScalingPolicy(0.75, 0.25, 2);
    }
}
