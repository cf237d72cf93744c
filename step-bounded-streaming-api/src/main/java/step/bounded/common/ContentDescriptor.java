package step.bounded.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot describing the content of a stream: its (raw) content type, its transfer encoding,
 * and optionally its length in bytes.
 * <p>
 * A descriptor obtained from a stream is always acceptable input for constructing a new stream with
 * equivalent semantics, see {@link StreamProperties#from(ContentDescriptor)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ContentDescriptor {

    private final String contentType;
    private final ContentEncoding contentEncoding;
    private final Long contentLength;

    /**
     * Creates a new descriptor.
     *
     * @param contentType     the raw content type, including parameters if any (must be valid)
     * @param contentEncoding the transfer encoding (must not be null)
     * @param contentLength   the length in bytes, or {@code null} if unknown (must be positive if given)
     * @throws NullPointerException     if {@code contentEncoding} is null
     * @throws IllegalArgumentException if the content type is invalid or the length is not positive
     */
    @JsonCreator
    public ContentDescriptor(@JsonProperty("contentType") String contentType,
                             @JsonProperty("contentEncoding") ContentEncoding contentEncoding,
                             @JsonProperty("contentLength") Long contentLength) {
        if (!ContentTypes.isValid(contentType)) {
            throw new IllegalArgumentException("\"" + contentType + "\" is not a valid MIME type!");
        }
        if (contentLength != null && contentLength <= 0) {
            throw new IllegalArgumentException(contentLength + " is an invalid content-length!");
        }
        this.contentType = contentType;
        this.contentEncoding = Objects.requireNonNull(contentEncoding, "contentEncoding must not be null");
        this.contentLength = contentLength;
    }

    public ContentDescriptor(String contentType, ContentEncoding contentEncoding) {
        this(contentType, contentEncoding, null);
    }

    public String getContentType() {
        return contentType;
    }

    public ContentEncoding getContentEncoding() {
        return contentEncoding;
    }

    /**
     * @return the content length in bytes, or {@code null} if unknown
     */
    public Long getContentLength() {
        return contentLength;
    }

    /**
     * Returns a copy of this descriptor with a different encoding. The content length is dropped, since it
     * no longer applies to the re-encoded bytes.
     *
     * @param encoding the new encoding
     * @return a new descriptor
     */
    public ContentDescriptor withContentEncoding(ContentEncoding encoding) {
        return new ContentDescriptor(contentType, encoding, null);
    }

    /**
     * Returns the descriptor as a map, using the same keys as the JSON representation. Absent lengths are omitted.
     *
     * @return a new, mutable map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("contentType", contentType);
        map.put("contentEncoding", contentEncoding.getName());
        if (contentLength != null) {
            map.put("contentLength", contentLength);
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ContentDescriptor)) return false;
        ContentDescriptor that = (ContentDescriptor) o;
        return contentType.equals(that.contentType) && contentEncoding == that.contentEncoding && Objects.equals(contentLength, that.contentLength);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contentType, contentEncoding, contentLength);
    }

    @Override
    public String toString() {
        return "ContentDescriptor{" +
                "contentType='" + contentType + '\'' +
                ", contentEncoding=" + contentEncoding +
                ", contentLength=" + contentLength +
                '}';
    }
}
