package step.bounded.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import step.bounded.codec.Serializer;
import step.bounded.codec.Transcoder;
import step.bounded.common.ContentEncoding;
import step.bounded.common.ContentTypes;
import step.bounded.common.MimeTypes;
import step.bounded.common.StreamProperties;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Convenience constructors for {@link BoundedStream}s over common sources.
 * <p>
 * All methods accept {@code null} properties, meaning "all defaults". The given properties object is never
 * modified; content type and encoding defaults are filled in on a copy.
 */
public final class StreamFactory {
    private static final Logger logger = LoggerFactory.getLogger(StreamFactory.class);

    private StreamFactory() {
    }

    private static StreamProperties withDefaults(StreamProperties properties, String contentType, String contentEncoding) {
        return (properties == null ? new StreamProperties() : properties).withDefaults(contentType, contentEncoding);
    }

    /**
     * Creates a stream without a source. Data is provided later using {@link BoundedStream#pipeFrom(InputStream)}.
     *
     * @param properties stream properties, may be null
     * @return a new stream
     */
    public static BoundedStream create(StreamProperties properties) {
        return new BoundedStream(withDefaults(properties, ContentTypes.APPLICATION_OCTET_STREAM, ContentEncoding.IDENTITY.getName()));
    }

    /**
     * Creates a stream delivering the contents of a buffer. Content length and limit are both set to the buffer
     * length, unless the buffer is empty.
     *
     * @param buffer     the data
     * @param properties stream properties, may be null
     * @return a new stream
     */
    public static BoundedStream fromBuffer(byte[] buffer, StreamProperties properties) {
        Objects.requireNonNull(buffer, "buffer must not be null");
        StreamProperties effective = withDefaults(properties, ContentTypes.APPLICATION_OCTET_STREAM, ContentEncoding.IDENTITY.getName());
        if (buffer.length > 0) {
            effective.setContentLength((long) buffer.length);
            effective.setLimit((long) buffer.length);
        }
        return new BoundedStream(effective, new ByteArrayInputStream(buffer));
    }

    /**
     * Creates a stream containing the serialized form of a value. If the requested encoding is a compressed one,
     * the serialized bytes are compressed accordingly.
     *
     * @param value      the value to serialize
     * @param properties stream properties, may be null; the content type defaults to {@code application/json}
     * @return a new stream
     * @throws IllegalArgumentException if the content type is not deserializable
     * @throws IOException              if the value cannot be serialized
     */
    public static BoundedStream fromObject(Object value, StreamProperties properties) throws IOException {
        StreamProperties effective = withDefaults(properties, ContentTypes.APPLICATION_JSON, ContentEncoding.IDENTITY.getName());
        String contentType = ContentTypes.essenceOf(effective.getContentType());
        if (!ContentTypes.isDeserializable(contentType)) {
            throw new IllegalArgumentException("unknown MIME-type \"" + contentType + "\"!");
        }
        ContentEncoding encoding = ContentEncoding.fromName(effective.getContentEncoding());
        byte[] data = Serializer.serialize(contentType, value);
        if (encoding.isCompressed()) {
            try (InputStream compressed = Transcoder.compress(encoding, data)) {
                data = compressed.readAllBytes();
            }
        }
        return fromBuffer(data, effective);
    }

    /**
     * Wraps an arbitrary input stream. If the source is itself a {@link BoundedStream}, it already enforces its
     * own bounds, so the new stream is made unbounded (no limit, no timeout).
     *
     * @param source     the source
     * @param properties stream properties, may be null
     * @return a new stream
     */
    public static BoundedStream fromStream(InputStream source, StreamProperties properties) {
        Objects.requireNonNull(source, "source must not be null");
        StreamProperties effective = withDefaults(properties, ContentTypes.APPLICATION_OCTET_STREAM, ContentEncoding.IDENTITY.getName());
        if (source instanceof BoundedStream) {
            effective = effective.unbounded();
        }
        return new BoundedStream(effective, source);
    }

    /**
     * Creates a stream over a file. Unless given, content type and encoding are derived from the file name,
     * see {@link MimeTypes}.
     *
     * @param path       the file
     * @param properties stream properties, may be null
     * @return a new stream
     * @throws IOException if the file cannot be opened
     */
    public static BoundedStream fromFile(Path path, StreamProperties properties) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        String fileName = String.valueOf(path.getFileName());
        StreamProperties effective = withDefaults(properties, MimeTypes.getContentType(fileName), MimeTypes.getContentEncoding(fileName).getName());
        BoundedStream stream = new BoundedStream(effective);
        try {
            stream.pipeFrom(Files.newInputStream(path));
        } catch (IOException e) {
            logger.warn("Unable to open {}", path, e);
            stream.destroy();
            throw e;
        }
        return stream;
    }

    /**
     * Like {@link #fromFile(Path, StreamProperties)}, but with content length and limit set to the file size.
     *
     * @param path       the file
     * @param properties stream properties, may be null
     * @return a new stream
     * @throws IOException if the file size cannot be determined or the file cannot be opened
     */
    public static BoundedStream fromFileWithLength(Path path, StreamProperties properties) throws IOException {
        long size = Files.size(path);
        StreamProperties effective = properties == null ? new StreamProperties() : new StreamProperties(properties);
        if (size > 0) {
            effective.setContentLength(size);
            effective.setLimit(size);
        }
        return fromFile(path, effective);
    }
}
