package my.sitescreener.app.dto;

public record KillSummaryItemDto(Integer stage, String ruleId, long count, Double avgObservedValue) {
}
