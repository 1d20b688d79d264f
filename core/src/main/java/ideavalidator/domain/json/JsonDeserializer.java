package ideavalidator.domain.json;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public interface JsonDeserializer {
    String serialize(Object object);

    String serializePretty(Object object);

    <T> T deserialize(String json, Class<T> clazz);

    <U, V> Map<U, V> deserializeMap(String json, Class<U> key, Class<V> value);

    /**
     * Parses loosely structured JSON, such as a model response, without binding it to a type.
     */
    JsonNode readTree(String json);
}
