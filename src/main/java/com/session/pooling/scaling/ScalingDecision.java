package com.session.pooling.scaling;

/**
 * What one auto-scaler cycle decided for a pool.
 *
 * @param delta number of sessions to add (GROW) or remove (SHRINK); 0 for HOLD
 */
public record ScalingDecision(Action action, int delta, double utilization, String reason) {

    public enum Action { GROW, SHRINK, HOLD }

    public static ScalingDecision hold(double utilization, String reason) {
        return new ScalingDecision(Action.HOLD, 0, utilization, reason);
    }
}
