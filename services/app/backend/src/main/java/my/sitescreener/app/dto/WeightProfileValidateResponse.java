package my.sitescreener.app.dto;

import java.util.List;

public record WeightProfileValidateResponse(boolean valid, List<String> errors) {
}
