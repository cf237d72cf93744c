package step.bounded.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.msgpack.jackson.dataformat.MessagePackFactory;
import step.bounded.common.ContentTypes;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Converts structured values to bytes and back, for the content types listed in
 * {@link ContentTypes#DESERIALIZABLE_TYPES}:
 * <ul>
 *     <li>{@code application/json} (Jackson)</li>
 *     <li>{@code application/msgpack} (Jackson with the MessagePack data format)</li>
 *     <li>{@code application/x-www-form-urlencoded} (UTF-8, maps only)</li>
 * </ul>
 * Any other content type is a programming error and results in an {@link IllegalArgumentException}.
 */
public final class Serializer {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper MSGPACK_MAPPER = new ObjectMapper(new MessagePackFactory());

    private Serializer() {
    }

    /**
     * Serializes a value.
     *
     * @param contentType the MIME essence selecting the format
     * @param value       the value to serialize; for form encoding, it must be convertible to a map
     * @return the serialized bytes
     * @throws IOException              if the value cannot be serialized
     * @throws IllegalArgumentException if the content type is not supported
     */
    public static byte[] serialize(String contentType, Object value) throws IOException {
        switch (checkSupported(contentType)) {
            case ContentTypes.APPLICATION_JSON:
                return JSON_MAPPER.writeValueAsBytes(value);
            case ContentTypes.APPLICATION_MSGPACK:
                return MSGPACK_MAPPER.writeValueAsBytes(value);
            default:
                return FormUrlEncoding.encode(toMap(value)).getBytes(StandardCharsets.UTF_8);
        }
    }

    /**
     * Deserializes bytes into a generic value (maps, lists, strings, numbers, booleans or {@code null}).
     *
     * @param contentType the MIME essence selecting the format
     * @param data        the serialized bytes
     * @return the deserialized value
     * @throws IOException              if the data is malformed
     * @throws IllegalArgumentException if the content type is not supported
     */
    public static Object deserialize(String contentType, byte[] data) throws IOException {
        return deserialize(contentType, data, Object.class);
    }

    public static <T> T deserialize(String contentType, byte[] data, Class<T> type) throws IOException {
        switch (checkSupported(contentType)) {
            case ContentTypes.APPLICATION_JSON:
                return JSON_MAPPER.readValue(data, type);
            case ContentTypes.APPLICATION_MSGPACK:
                return MSGPACK_MAPPER.readValue(data, type);
            default:
                Map<String, Object> map = FormUrlEncoding.decode(new String(data, StandardCharsets.UTF_8));
                try {
                    return JSON_MAPPER.convertValue(map, type);
                } catch (IllegalArgumentException e) {
                    throw new IOException("Cannot convert form data to " + type.getName(), e);
                }
        }
    }

    private static String checkSupported(String contentType) {
        if (!ContentTypes.isDeserializable(contentType)) {
            throw new IllegalArgumentException("unknown MIME-type \"" + contentType + "\"!");
        }
        return contentType;
    }

    private static Map<?, ?> toMap(Object value) throws IOException {
        if (value == null) {
            throw new IOException("Cannot form-encode null");
        }
        if (value instanceof Map) {
            return (Map<?, ?>) value;
        }
        try {
            return JSON_MAPPER.convertValue(value, Map.class);
        } catch (IllegalArgumentException e) {
            throw new IOException("Cannot form-encode value of type " + value.getClass().getName(), e);
        }
    }
}
