package my.sitescreener.app.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.Map;

public record RunStartRequest(@NotEmpty List<String> targetStates, Map<String, Object> config, String createdBy) {
}
