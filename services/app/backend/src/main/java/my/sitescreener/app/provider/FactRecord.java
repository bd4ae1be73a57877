package my.sitescreener.app.provider;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Named facts for one candidate or aggregate key. A field that is absent (or null) is unknown,
 * never zero. An empty record stands for "the provider has no data for this key".
 */
public final class FactRecord {
	private final String key;
	private final Map<String, Object> fields;
	private final LocalDate asOf;

	private FactRecord(String key, Map<String, Object> fields, LocalDate asOf) {
		this.key = key;
		this.fields = fields;
		this.asOf = asOf;
	}

	public static FactRecord of(String key, Map<String, ?> fields) {
		return of(key, fields, null);
	}

	public static FactRecord of(String key, Map<String, ?> fields, LocalDate asOf) {
		Map<String, Object> copy = new LinkedHashMap<>();
		if (fields != null) {
			fields.forEach((name, value) -> {
				if (name != null && value != null) {
					copy.put(name, value);
				}
			});
		}
		return new FactRecord(key, Collections.unmodifiableMap(copy), asOf);
	}

	public static FactRecord noData(String key) {
		return new FactRecord(key, Map.of(), null);
	}

	public String key() {
		return key;
	}

	public boolean isEmpty() {
		return fields.isEmpty();
	}

	public OptionalDouble number(String field) {
		Object value = fields.get(field);
		if (value instanceof Number number) {
			return OptionalDouble.of(number.doubleValue());
		}
		if (value instanceof String text && !text.isBlank()) {
			try {
				return OptionalDouble.of(Double.parseDouble(text.trim()));
			} catch (NumberFormatException ignored) {
				return OptionalDouble.empty();
			}
		}
		return OptionalDouble.empty();
	}

	public Optional<String> text(String field) {
		Object value = fields.get(field);
		if (value == null) {
			return Optional.empty();
		}
		String text = value.toString().trim();
		return text.isEmpty() ? Optional.empty() : Optional.of(text);
	}

	public Optional<LocalDate> asOf() {
		return Optional.ofNullable(asOf);
	}

	public Map<String, Object> fields() {
		return fields;
	}
}
