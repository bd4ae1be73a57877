package my.sitescreener.app.config;

import org.hibernate.type.format.AbstractJsonFormatMapper;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.lang.reflect.Type;

/**
 * Serializes the jsonb columns (candidate metrics, run config, score inputs and fatal-flaw
 * reasons) with Jackson 3. Registered through {@code hibernate.type.json_format_mapper}.
 */
public final class ToolsJacksonJsonFormatMapper extends AbstractJsonFormatMapper {
	private final ObjectMapper objectMapper;

	public ToolsJacksonJsonFormatMapper() {
		this(JsonMapper.builderWithJackson2Defaults().build());
	}

	public ToolsJacksonJsonFormatMapper(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	protected <T> T fromString(CharSequence charSequence, Type type) {
		try {
			return objectMapper.readValue(charSequence.toString(), objectMapper.constructType(type));
		} catch (JacksonException e) {
			throw new IllegalArgumentException("Could not read jsonb column as " + type, e);
		}
	}

	@Override
	protected <T> String toString(T value, Type type) {
		try {
			return objectMapper.writerFor(objectMapper.constructType(type)).writeValueAsString(value);
		} catch (JacksonException e) {
			throw new IllegalArgumentException("Could not write " + type + " to jsonb column", e);
		}
	}
}
