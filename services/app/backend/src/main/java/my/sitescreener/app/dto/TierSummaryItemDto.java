package my.sitescreener.app.dto;

import my.sitescreener.app.domain.Tier;

public record TierSummaryItemDto(Tier tier, long count, Double avgScore, Double minScore, Double maxScore) {
}
