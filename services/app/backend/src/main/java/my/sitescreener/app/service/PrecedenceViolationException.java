package my.sitescreener.app.service;

import java.util.UUID;

public class PrecedenceViolationException extends RuntimeException {
	private final UUID runId;
	private final int stage;

	public PrecedenceViolationException(UUID runId, int stage, String message) {
		super(message);
		this.runId = runId;
		this.stage = stage;
	}

	public UUID getRunId() {
		return runId;
	}

	public int getStage() {
		return stage;
	}
}
