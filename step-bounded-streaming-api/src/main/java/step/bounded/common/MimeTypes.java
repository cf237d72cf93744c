package step.bounded.common;

import java.util.Locale;
import java.util.Map;

/**
 * Infers content types and encodings from file names.
 * <p>
 * Compression suffixes ({@code .gz}, {@code .deflate}) determine the encoding, and are stripped before
 * the content type is looked up, so that {@code image.jpg.gz} yields {@code image/jpeg} with {@code gzip} encoding.
 * Unknown extensions map to {@link ContentTypes#APPLICATION_OCTET_STREAM}.
 */
public final class MimeTypes {

    private static final Map<String, String> TYPES_BY_EXTENSION = Map.ofEntries(
            Map.entry("bin", ContentTypes.APPLICATION_OCTET_STREAM),
            Map.entry("bmp", "image/bmp"),
            Map.entry("css", "text/css"),
            Map.entry("csv", "text/csv"),
            Map.entry("gif", "image/gif"),
            Map.entry("htm", "text/html"),
            Map.entry("html", "text/html"),
            Map.entry("java", "text/x-java-source"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("jpg", "image/jpeg"),
            Map.entry("js", "application/javascript"),
            Map.entry("json", ContentTypes.APPLICATION_JSON),
            Map.entry("log", ContentTypes.TEXT_PLAIN),
            Map.entry("md", "text/markdown"),
            Map.entry("mp3", "audio/mpeg"),
            Map.entry("mp4", "video/mp4"),
            Map.entry("msgpack", ContentTypes.APPLICATION_MSGPACK),
            Map.entry("ndjson", ContentTypes.APPLICATION_NDJSON),
            Map.entry("ogg", "audio/ogg"),
            Map.entry("pdf", "application/pdf"),
            Map.entry("png", "image/png"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("txt", ContentTypes.TEXT_PLAIN),
            Map.entry("wav", "audio/wav"),
            Map.entry("webm", "video/webm"),
            Map.entry("webp", "image/webp"),
            Map.entry("xml", "application/xml"),
            Map.entry("zip", "application/zip")
    );

    private MimeTypes() {
    }

    /**
     * Returns the encoding implied by a file name's final extension.
     *
     * @param fileName the file name (or path)
     * @return {@link ContentEncoding#GZIP} for {@code .gz}, {@link ContentEncoding#DEFLATE} for {@code .deflate},
     * {@link ContentEncoding#IDENTITY} otherwise
     */
    public static ContentEncoding getContentEncoding(String fileName) {
        switch (extensionOf(fileName)) {
            case "gz":
                return ContentEncoding.GZIP;
            case "deflate":
                return ContentEncoding.DEFLATE;
            default:
                return ContentEncoding.IDENTITY;
        }
    }

    /**
     * Returns the content type for a file name, ignoring a trailing compression extension.
     *
     * @param fileName the file name (or path)
     * @return the content type, never {@code null}
     */
    public static String getContentType(String fileName) {
        String name = fileName;
        if (getContentEncoding(name) != ContentEncoding.IDENTITY) {
            name = name.substring(0, name.lastIndexOf('.'));
        }
        return TYPES_BY_EXTENSION.getOrDefault(extensionOf(name), ContentTypes.APPLICATION_OCTET_STREAM);
    }

    private static String extensionOf(String fileName) {
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        int dot = fileName.lastIndexOf('.');
        if (dot <= slash + 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
