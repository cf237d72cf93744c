package step.bounded.common;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * This class indicates errors occurring while a bounded stream is being consumed.
 * <p>
 * Every fault carries a {@link Code} from a closed set, an immutable (possibly empty) metadata map
 * describing the circumstances, and optionally the underlying cause. Faults are terminal for the stream
 * that raised them; there is no retry.
 */
public class StreamFault extends IOException {

    /**
     * The known fault codes, each with a stable short code and a human-readable message.
     */
    public enum Code {
        UNEXPECTED("Unexpected", "An unexpected error occurred!"),
        TOO_LARGE("TooLarge", "The stream is larger than the allowed maximum."),
        TIMED_OUT("TimedOut", "Timed-out reading the stream source!"),
        MULTIPLE_SOURCES("MultipleSources", "Piped multiple sources simultaneously!");

        private final String code;
        private final String message;

        Code(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }
    }

    public static final String NAME = "StreamFault";

    private final Code code;
    private final Map<String, Object> metadata;

    protected StreamFault(Code code, Map<String, Object> metadata, Throwable cause) {
        super(Objects.requireNonNull(code).getMessage(), cause);
        this.code = code;
        this.metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static StreamFault tooLarge(Map<String, Object> metadata) {
        return new StreamFault(Code.TOO_LARGE, metadata, null);
    }

    /**
     * @param durationMillis the time since the last observed activity
     * @return a new fault with a {@code duration} metadata entry
     */
    public static StreamFault timedOut(long durationMillis) {
        return new StreamFault(Code.TIMED_OUT, Map.of("duration", durationMillis), null);
    }

    public static StreamFault multipleSources(Map<String, Object> metadata) {
        return new StreamFault(Code.MULTIPLE_SOURCES, metadata, null);
    }

    public static StreamFault unexpected(Throwable cause) {
        return new StreamFault(Code.UNEXPECTED, null, cause);
    }

    public static StreamFault unexpected(Map<String, Object> metadata, Throwable cause) {
        return new StreamFault(Code.UNEXPECTED, metadata, cause);
    }

    /**
     * Returns {@code t} itself if it already is a {@link StreamFault}, otherwise wraps it as {@link Code#UNEXPECTED}.
     *
     * @param t the throwable to convert
     * @return a stream fault
     */
    public static StreamFault wrap(Throwable t) {
        if (t instanceof StreamFault) {
            return (StreamFault) t;
        }
        return unexpected(t);
    }

    public Code getCode() {
        return code;
    }

    public boolean is(Code code) {
        return this.code == code;
    }

    /**
     * @return the fault metadata; never {@code null}, and not modifiable
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Returns the structured representation of this fault. Causes are included recursively;
     * causes that are not stream faults are represented by their type and message only.
     *
     * @return a new map with the keys {@code name, code, message}, plus {@code metadata} and {@code cause} if present
     */
    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("name", NAME);
        result.put("code", code.getCode());
        result.put("message", getMessage());
        if (!metadata.isEmpty()) {
            result.put("metadata", metadata);
        }
        Throwable cause = getCause();
        if (cause instanceof StreamFault) {
            result.put("cause", ((StreamFault) cause).toMap());
        } else if (cause != null) {
            Map<String, Object> causeMap = new LinkedHashMap<>();
            causeMap.put("type", cause.getClass().getName());
            causeMap.put("message", cause.getMessage());
            result.put("cause", causeMap);
        }
        return result;
    }

    @Override
    public String toString() {
        return NAME + "[" + code.getCode() + "]: " + getMessage();
    }
}
