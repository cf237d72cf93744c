package step.bounded.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Transfer encodings supported by bounded streams.
 * <p>
 * The wire names ({@code identity}, {@code gzip}, {@code deflate}) are the values used in
 * HTTP {@code Content-Encoding} headers; {@code deflate} denotes the zlib format.
 */
public enum ContentEncoding {
    IDENTITY("identity"),
    GZIP("gzip"),
    DEFLATE("deflate");

    private final String name;

    ContentEncoding(String name) {
        this.name = name;
    }

    /**
     * Returns the wire name of this encoding.
     *
     * @return the encoding name, e.g. {@code gzip}
     */
    @JsonValue
    public String getName() {
        return name;
    }

    /**
     * @return {@code true} for every encoding except {@link #IDENTITY}
     */
    public boolean isCompressed() {
        return this != IDENTITY;
    }

    /**
     * Resolves an encoding by its wire name. Matching is exact (case-sensitive).
     *
     * @param name the encoding name
     * @return the matching encoding
     * @throws IllegalArgumentException if {@code name} is null or not one of the supported encodings
     */
    @JsonCreator
    public static ContentEncoding fromName(String name) {
        for (ContentEncoding encoding : values()) {
            if (encoding.name.equals(name)) {
                return encoding;
            }
        }
        throw new IllegalArgumentException("\"" + name + "\" is not a valid encoding!");
    }

    /**
     * @param name the encoding name to check
     * @return whether {@code name} denotes a supported encoding
     */
    public static boolean isValid(String name) {
        for (ContentEncoding encoding : values()) {
            if (encoding.name.equals(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return name;
    }
}
