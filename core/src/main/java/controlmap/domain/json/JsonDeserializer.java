package controlmap.domain.json;

import java.util.List;

public interface JsonDeserializer {
    String serialize(Object object);

    <T> T deserialize(String json, Class<T> clazz);

    <U> List<U> deserializeCollection(String json, Class<U> value);
}
