package step.bounded.common;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Content type constants and classification helpers.
 * <p>
 * A content type consists of a MIME essence of the form {@code type/subtype}, where {@code type} is one of
 * {@code application, audio, image, multipart, text, video}, optionally followed by parameters after a
 * semicolon (e.g. {@code text/plain; charset=UTF-8}). Parameters are preserved in the raw value but
 * ignored for classification.
 */
public final class ContentTypes {

    public static final String APPLICATION_JSON = "application/json";
    public static final String APPLICATION_MSGPACK = "application/msgpack";
    public static final String APPLICATION_FORM_URLENCODED = "application/x-www-form-urlencoded";
    public static final String APPLICATION_NDJSON = "application/ndjson";
    public static final String APPLICATION_OCTET_STREAM = "application/octet-stream";
    public static final String TEXT_EVENT_STREAM = "text/event-stream";
    public static final String TEXT_PLAIN = "text/plain";

    /**
     * Pattern for valid raw content types. Group 1 is the MIME essence.
     */
    private static final Pattern CONTENT_TYPE_PATTERN =
            Pattern.compile("^((application|audio|image|multipart|text|video)/[\\w.+-]+)\\s*(;.*)?$");

    /**
     * Content types whose bytes can be parsed into a single structured value.
     */
    public static final List<String> DESERIALIZABLE_TYPES =
            List.of(APPLICATION_JSON, APPLICATION_MSGPACK, APPLICATION_FORM_URLENCODED);

    /**
     * Content types carrying a sequence of serialized objects; recognized, but never deserialized as a whole.
     */
    public static final List<String> OBJECT_STREAM_TYPES = List.of(APPLICATION_NDJSON, TEXT_EVENT_STREAM);

    private ContentTypes() {
    }

    public static boolean isValid(String rawContentType) {
        return rawContentType != null && CONTENT_TYPE_PATTERN.matcher(rawContentType).matches();
    }

    /**
     * Extracts the MIME essence from a raw content type, dropping any parameters.
     *
     * @param rawContentType the content type as supplied, e.g. {@code application/json; charset=utf-8}
     * @return the essence, e.g. {@code application/json}
     * @throws IllegalArgumentException if the content type is null or invalid
     */
    public static String essenceOf(String rawContentType) {
        if (rawContentType == null) {
            throw new IllegalArgumentException("\"null\" is not a valid MIME type!");
        }
        Matcher matcher = CONTENT_TYPE_PATTERN.matcher(rawContentType);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("\"" + rawContentType + "\" is not a valid MIME type!");
        }
        return matcher.group(1);
    }

    public static boolean isDeserializable(String contentType) {
        return DESERIALIZABLE_TYPES.contains(contentType);
    }

    public static boolean isObjectStream(String contentType) {
        return OBJECT_STREAM_TYPES.contains(contentType);
    }

    public static boolean isAppSpecific(String contentType) {
        return contentType.startsWith("application/");
    }

    public static boolean isAudio(String contentType) {
        return contentType.startsWith("audio/");
    }

    public static boolean isImage(String contentType) {
        return contentType.startsWith("image/");
    }

    public static boolean isMultipart(String contentType) {
        return contentType.startsWith("multipart/");
    }

    public static boolean isText(String contentType) {
        return contentType.startsWith("text/");
    }

    public static boolean isVideo(String contentType) {
        return contentType.startsWith("video/");
    }
}
