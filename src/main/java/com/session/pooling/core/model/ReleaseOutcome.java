package com.session.pooling.core.model;

/**
 * Result of the work done with an acquired session, reported on release.
 *
 * @param successful whether the request served by the session succeeded
 * @param broken  whether the session itself is unusable and must be destroyed instead of reused
 * @param error   optional error description for failed outcomes
 */
public record ReleaseOutcome(boolean successful, boolean broken, String error) {

    private static final ReleaseOutcome SUCCESS = new ReleaseOutcome(true, false, null);

    public static ReleaseOutcome success() {
        return SUCCESS;
    }

    public static ReleaseOutcome failure(String error) {
        return new ReleaseOutcome(false, false, error);
    }

    /**
     * A failed request after which the session cannot be reused.
     */
    public static ReleaseOutcome broken(String error) {
        return new ReleaseOutcome(false, true, error);
    }
}
