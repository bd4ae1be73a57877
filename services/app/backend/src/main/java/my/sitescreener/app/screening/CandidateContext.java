package my.sitescreener.app.screening;

import my.sitescreener.app.provider.FactRecord;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * What a kill switch may look at: the provider record for the current stage plus the metrics
 * accumulated by earlier stages. Provider fields take precedence over metrics of the same name.
 */
public record CandidateContext(String zip, FactRecord facts, Map<String, Object> metrics) {
	public CandidateContext {
		facts = facts == null ? FactRecord.noData(zip) : facts;
		metrics = metrics == null ? Map.of() : metrics;
	}

	public OptionalDouble number(String field) {
		OptionalDouble fromFacts = facts.number(field);
		if (fromFacts.isPresent()) {
			return fromFacts;
		}
		Object value = metrics.get(field);
		if (value instanceof Number number) {
			return OptionalDouble.of(number.doubleValue());
		}
		return OptionalDouble.empty();
	}

	public Optional<String> text(String field) {
		Optional<String> fromFacts = facts.text(field);
		if (fromFacts.isPresent()) {
			return fromFacts;
		}
		Object value = metrics.get(field);
		return value instanceof String text && !text.isBlank() ? Optional.of(text.trim()) : Optional.empty();
	}
}
