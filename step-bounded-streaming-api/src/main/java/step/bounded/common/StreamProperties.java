package step.bounded.common;

/**
 * Construction properties for a bounded stream.
 * <p>
 * All fields are optional at this level; validation happens when a stream is constructed from the properties.
 * Unset values ({@code null}) are replaced by the defaults defined in this class, where the default limit
 * depends on the content type: deserializable payloads are always fully materialized in memory, so their
 * ceiling is much lower than the one for opaque payloads, which are expected to be streamed.
 */
public class StreamProperties {

    /**
     * Default limit for deserializable content types (64 KiB).
     */
    public static final long DEFAULT_DESERIALIZABLE_LIMIT = 1024 * 64;

    /**
     * Default limit for all other content types (10 MiB).
     */
    public static final long DEFAULT_LIMIT = 1024 * 1024 * 10;

    /**
     * Limit value meaning "no limit at all".
     */
    public static final long UNBOUNDED = Long.MAX_VALUE;

    /**
     * Default inactivity timeout in milliseconds.
     */
    public static final long DEFAULT_TIMEOUT_MILLIS = 30000;

    /**
     * Default interval for checking for inactivity, in milliseconds.
     */
    public static final long DEFAULT_INTERVAL_MILLIS = 1000;

    private String contentType;
    private String contentEncoding;
    private Long contentLength;
    private Long limit;
    private Long timeout;
    private Long interval;

    public StreamProperties() {
    }

    public StreamProperties(String contentType, String contentEncoding) {
        this.contentType = contentType;
        this.contentEncoding = contentEncoding;
    }

    /**
     * Copy constructor.
     *
     * @param other the properties to copy, may be {@code null} (resulting in empty properties)
     */
    public StreamProperties(StreamProperties other) {
        if (other != null) {
            this.contentType = other.contentType;
            this.contentEncoding = other.contentEncoding;
            this.contentLength = other.contentLength;
            this.limit = other.limit;
            this.timeout = other.timeout;
            this.interval = other.interval;
        }
    }

    /**
     * Creates properties from a content descriptor, leaving limit and timing at their defaults.
     *
     * @param descriptor the descriptor
     * @return new properties
     */
    public static StreamProperties from(ContentDescriptor descriptor) {
        StreamProperties properties = new StreamProperties(descriptor.getContentType(), descriptor.getContentEncoding().getName());
        properties.setContentLength(descriptor.getContentLength());
        return properties;
    }

    /**
     * Returns a copy of these properties where an unset content type and encoding are replaced by the given values.
     *
     * @param defaultContentType     content type to use if none is set
     * @param defaultContentEncoding encoding to use if none is set
     * @return a new instance
     */
    public StreamProperties withDefaults(String defaultContentType, String defaultContentEncoding) {
        StreamProperties copy = new StreamProperties(this);
        if (copy.contentType == null) {
            copy.contentType = defaultContentType;
        }
        if (copy.contentEncoding == null) {
            copy.contentEncoding = defaultContentEncoding;
        }
        return copy;
    }

    /**
     * Returns a copy of these properties with limit and timeout checks disabled.
     * This is used when the data source is already bounded by another stream.
     *
     * @return a new instance
     */
    public StreamProperties unbounded() {
        return new StreamProperties(this).withLimit(UNBOUNDED).withTimeout(0L).withInterval(0L);
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    public StreamProperties withContentType(String contentType) {
        setContentType(contentType);
        return this;
    }

    public String getContentEncoding() {
        return contentEncoding;
    }

    public void setContentEncoding(String contentEncoding) {
        this.contentEncoding = contentEncoding;
    }

    public StreamProperties withContentEncoding(String contentEncoding) {
        setContentEncoding(contentEncoding);
        return this;
    }

    public Long getContentLength() {
        return contentLength;
    }

    public void setContentLength(Long contentLength) {
        this.contentLength = contentLength;
    }

    public StreamProperties withContentLength(Long contentLength) {
        setContentLength(contentLength);
        return this;
    }

    public Long getLimit() {
        return limit;
    }

    public void setLimit(Long limit) {
        this.limit = limit;
    }

    public StreamProperties withLimit(Long limit) {
        setLimit(limit);
        return this;
    }

    public Long getTimeout() {
        return timeout;
    }

    public void setTimeout(Long timeout) {
        this.timeout = timeout;
    }

    public StreamProperties withTimeout(Long timeout) {
        setTimeout(timeout);
        return this;
    }

    public Long getInterval() {
        return interval;
    }

    public void setInterval(Long interval) {
        this.interval = interval;
    }

    public StreamProperties withInterval(Long interval) {
        setInterval(interval);
        return this;
    }

    @Override
    public String toString() {
        return "StreamProperties{" +
                "contentType='" + contentType + '\'' +
                ", contentEncoding='" + contentEncoding + '\'' +
                ", contentLength=" + contentLength +
                ", limit=" + limit +
                ", timeout=" + timeout +
                ", interval=" + interval +
                '}';
    }
}
