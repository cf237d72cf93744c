package step.bounded.codec;

import step.bounded.common.ContentEncoding;
import step.bounded.data.DeferredInputStream;
import step.bounded.data.GzipCompressingInputStream;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Objects;
import java.util.zip.DeflaterInputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

/**
 * Wraps byte sources in compression or decompression streams.
 * <p>
 * All returned streams are lazy: no data is read from the source before the first read on the returned stream.
 * Closing a returned stream closes its source.
 */
public final class Transcoder {

    private Transcoder() {
    }

    /**
     * Returns a stream producing the compressed form of the source.
     *
     * @param encoding the target encoding
     * @param source   the uncompressed data
     * @return the source itself for {@link ContentEncoding#IDENTITY}, otherwise a compressing stream
     */
    public static InputStream compress(ContentEncoding encoding, InputStream source) {
        Objects.requireNonNull(source, "source must not be null");
        switch (Objects.requireNonNull(encoding, "encoding must not be null")) {
            case IDENTITY:
                return source;
            case GZIP:
                return new GzipCompressingInputStream(source);
            case DEFLATE:
                return new DeflaterInputStream(source);
            default:
                throw new IllegalArgumentException("unknown compression \"" + encoding + "\"!");
        }
    }

    public static InputStream compress(ContentEncoding encoding, byte[] data) {
        return compress(encoding, new ByteArrayInputStream(data));
    }

    /**
     * Returns a stream producing the decompressed form of the source.
     *
     * @param encoding the encoding of the source
     * @param source   the compressed data
     * @return the source itself for {@link ContentEncoding#IDENTITY}, otherwise a decompressing stream
     */
    public static InputStream decompress(ContentEncoding encoding, InputStream source) {
        Objects.requireNonNull(source, "source must not be null");
        switch (Objects.requireNonNull(encoding, "encoding must not be null")) {
            case IDENTITY:
                return source;
            case GZIP:
                return new DeferredInputStream(source, GZIPInputStream::new);
            case DEFLATE:
                return new InflaterInputStream(source);
            default:
                throw new IllegalArgumentException("unknown compression \"" + encoding + "\"!");
        }
    }

    public static InputStream decompress(ContentEncoding encoding, byte[] data) {
        return decompress(encoding, new ByteArrayInputStream(data));
    }

    /**
     * Converts a source from one encoding to another. Between two compressed encodings, the data is always
     * decompressed first, then compressed again.
     *
     * @param from   the current encoding of the source
     * @param to     the desired encoding
     * @param source the data
     * @return a stream producing the data in the target encoding (the source itself if both encodings are equal)
     */
    public static InputStream transcode(ContentEncoding from, ContentEncoding to, InputStream source) {
        if (from == to) {
            return source;
        }
        if (from == ContentEncoding.IDENTITY) {
            return compress(to, source);
        }
        if (to == ContentEncoding.IDENTITY) {
            return decompress(from, source);
        }
        return compress(to, decompress(from, source));
    }
}
