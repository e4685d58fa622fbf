package controlmap.domain.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.blackbird.BlackbirdModule;
import controlmap.domain.exceptions.InternalFailure;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.logging.Logger;

/**
 * A service for serializing and deserializing JSON.
 */
@ApplicationScoped
public class JsonDeserializerJackson implements JsonDeserializer {

    private final ObjectMapper objectMapper = createObjectMapper();

    @Inject
    private Logger logger;

    @Override
    public String serialize(final Object object) {
        return Try.of(() -> objectMapper.writeValueAsString(object))
                .onFailure(ex -> logger.warning("Failed to serialize object of type " + object.getClass().getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(ex -> new InternalFailure("Failed to serialize object", ex));
    }

    @Override
    public <T> T deserialize(final String json, final Class<T> clazz) {
        return Try.of(() -> objectMapper.readValue(json, clazz))
                .onFailure(ex -> logger.warning("Failed to deserialize object of type " + clazz.getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(ex -> new InternalFailure("Failed to deserialize object", ex));
    }

    @Override
    public <U> List<U> deserializeCollection(final String json, final Class<U> value) {
        return Try.of(() -> objectMapper.<List<U>>readValue(
                        json,
                        objectMapper.getTypeFactory().constructCollectionType(List.class, value)))
                .getOrElseThrow(ex -> new InternalFailure("Failed to deserialize list", ex));
    }

    private static ObjectMapper createObjectMapper() {
        final ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.registerModule(new BlackbirdModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return objectMapper;
    }
}
