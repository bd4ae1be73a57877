package my.sitescreener.app.domain;

/**
 * Outcome of one stage execution. {@code PARTIAL} means some candidates could not be resolved
 * because their facts were unavailable and should be retried by re-running the stage.
 */
public enum StageStatus {
	COMPLETE,
	PARTIAL
}
