package io.prism.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes the model types as JSON with snake_case property names.
 */
public final class JsonCodec {

	@Nonnull
	private final ObjectMapper mapper;

	public JsonCodec() {
		this.mapper = new ObjectMapper()
			.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
			.enable(SerializationFeature.INDENT_OUTPUT);
	}

	/**
	 * Serializes a value to JSON.
	 *
	 * @param value the value to serialize
	 * @return pretty-printed JSON
	 * @throws IOException if the value cannot be serialized
	 */
	@Nonnull
	public String write(@Nonnull Object value) throws IOException {
		Objects.requireNonNull(value, "value must not be null");
		try {
			return this.mapper.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new IOException("Failed to serialize " + value.getClass().getSimpleName() + ": " + e.getOriginalMessage(), e);
		}
	}

	/**
	 * Parses JSON into the requested type.
	 *
	 * @param json the JSON text
	 * @param type the target type
	 * @param <T>  target type
	 * @return the parsed value
	 * @throws IOException if the JSON is malformed or does not match the type
	 */
	@Nonnull
	public <T> T read(@Nonnull String json, @Nonnull Class<T> type) throws IOException {
		Objects.requireNonNull(json, "json must not be null");
		Objects.requireNonNull(type, "type must not be null");
		return this.mapper.readValue(json, type);
	}

	/**
	 * Reads a suggestion from a UTF-8 encoded JSON file.
	 *
	 * @param file the file to read
	 * @return the parsed suggestion
	 * @throws IOException if the file cannot be read or parsed
	 */
	@Nonnull
	public Suggestion readSuggestion(@Nonnull Path file) throws IOException {
		Objects.requireNonNull(file, "file must not be null");
		return read(Files.readString(file, StandardCharsets.UTF_8), Suggestion.class);
	}
}
