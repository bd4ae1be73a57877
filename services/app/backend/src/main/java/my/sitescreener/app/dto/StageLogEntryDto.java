package my.sitescreener.app.dto;

import my.sitescreener.app.domain.StageStatus;

import java.time.LocalDateTime;

public record StageLogEntryDto(
		int stage,
		LocalDateTime startedAt,
		LocalDateTime completedAt,
		int zipsInput,
		int zipsOutput,
		int zipsKilled,
		StageStatus status
) {
}
