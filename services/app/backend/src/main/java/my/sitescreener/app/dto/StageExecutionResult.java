package my.sitescreener.app.dto;

import my.sitescreener.app.domain.StageStatus;

import java.util.Map;
import java.util.UUID;

public record StageExecutionResult(
		UUID runId,
		int stage,
		int input,
		int output,
		int killed,
		int advanced,
		int unresolved,
		int alreadyAdvanced,
		Map<String, Integer> killsByRule,
		StageStatus status
) {
}
