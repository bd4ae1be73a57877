package my.sitescreener.app.dto;

import jakarta.validation.constraints.NotBlank;

public record RunFailRequest(@NotBlank String error) {
}
