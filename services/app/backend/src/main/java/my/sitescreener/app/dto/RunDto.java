package my.sitescreener.app.dto;

import my.sitescreener.app.domain.RunStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record RunDto(
		UUID runId,
		LocalDateTime createdAt,
		String createdBy,
		List<String> targetStates,
		Map<String, Object> config,
		RunStatus status,
		Integer currentStage,
		Integer totalZips,
		Integer survivingZips,
		LocalDateTime completedAt,
		String errorMessage
) {
}
