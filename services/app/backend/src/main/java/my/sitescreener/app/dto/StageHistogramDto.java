package my.sitescreener.app.dto;

import java.util.Map;
import java.util.UUID;

/**
 * Candidate count per {@code stageReached}; {@code -1} counts candidates that never passed stage 0.
 */
public record StageHistogramDto(UUID runId, Map<Integer, Long> counts, long total) {
}
