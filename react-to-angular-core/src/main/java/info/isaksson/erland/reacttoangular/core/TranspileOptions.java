package info.isaksson.erland.reacttoangular.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.reacttoangular.emitter.EmitterOptions;

import java.nio.file.Path;

/**
 * Core options for one conversion.
 *
 * <p>Mirrors the CLI flags in structured form. Only {@link #indentWidth} and {@link #emitSpec} can
 * come from a JSON options file.</p>
 */
public final class TranspileOptions {
    /** Spaces per indentation level, 1..8. */
    public int indentWidth = EmitterOptions.DEFAULT_INDENT;

    /** Also emit a {@code .component.spec.ts} scaffold. */
    public boolean emitSpec = false;

    /** Component name to use instead of the declared one; null keeps the declared name. */
    public String name;

    /** When set, the component model is also written here as JSON. */
    public Path irOutput;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    /** Keys accepted in an options file. */
    static final class FileOptions {
        final Integer indentWidth;
        final Boolean emitSpec;

        @JsonCreator
        FileOptions(@JsonProperty("indentWidth") Integer indentWidth,
                    @JsonProperty("emitSpec") Boolean emitSpec) {
            this.indentWidth = indentWidth;
            this.emitSpec = emitSpec;
        }
    }

    /**
     * Applies the keys present in a JSON options document to this instance.
     *
     * @throws IllegalArgumentException on malformed JSON, unknown keys or values of the wrong type
     */
    public TranspileOptions applyJson(String json, String origin) {
        FileOptions file;
        try {
            file = MAPPER.readValue(json, FileOptions.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid options file " + origin + ": " + e.getOriginalMessage(), e);
        }
        if (file == null) {
            throw new IllegalArgumentException("Invalid options file " + origin + ": expected a JSON object");
        }
        if (file.indentWidth != null) indentWidth = file.indentWidth;
        if (file.emitSpec != null) emitSpec = file.emitSpec;
        return this;
    }

    /** @throws IllegalArgumentException when the indent width is out of range */
    public EmitterOptions toEmitterOptions() {
        return new EmitterOptions(indentWidth, emitSpec);
    }

    @Override
    public String toString() {
        return "TranspileOptions{" +
                "indentWidth=" + indentWidth +
                ", emitSpec=" + emitSpec +
                ", name=" + name +
                ", irOutput=" + irOutput +
                '}';
    }
}
