package com.example.retrain.lifecycle;

/**
 * {@code Promoted(version)} or {@code PromotionFailed(cause)}.
 *
 * @param version         the new current version, only when promoted
 * @param previousVersion the version that was serving before, {@code null} if none
 */
public record PromotionResult(boolean promoted, Long version, Long previousVersion, Failure failure, String detail) {

    public enum Failure {
        /** Writing the candidate artifact failed. */
        STORAGE,
        /** The prior current artifact could not be secured as a backup. */
        BACKUP,
        POINTER_SWAP,
        /** The post-promotion check failed; the pointer was reverted. */
        HEALTH_CHECK
    }

    public static PromotionResult promoted(long version, Long previousVersion, String detail) {
        return new PromotionResult(true, version, previousVersion, null, detail);
    }

    public static PromotionResult failed(Failure failure, Long previousVersion, String detail) {
        return new PromotionResult(false, null, previousVersion, failure, detail);
    }
}
