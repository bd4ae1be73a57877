package my.sitescreener.app.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores recommendations by label ({@code strong_pursue}, {@code avoid}, ...).
 */
@Converter
public class RecommendationConverter implements AttributeConverter<Recommendation, String> {
	@Override
	public String convertToDatabaseColumn(Recommendation recommendation) {
		return recommendation == null ? null : recommendation.getLabel();
	}

	@Override
	public Recommendation convertToEntityAttribute(String label) {
		return label == null ? null : Recommendation.fromLabel(label);
	}
}
