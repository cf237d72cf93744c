package step.bounded.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import step.bounded.codec.Serializer;
import step.bounded.codec.Transcoder;
import step.bounded.common.ContentDescriptor;
import step.bounded.common.ContentEncoding;
import step.bounded.common.ContentTypes;
import step.bounded.common.StreamFault;
import step.bounded.common.StreamProperties;
import step.bounded.common.StreamState;
import step.bounded.timer.InactivityTimer;
import step.bounded.util.ThreadPools;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * A byte stream that is bounded by size and time, and describes its own content.
 * <p>
 * Every instance carries a content type, a transfer encoding and optionally a declared content length.
 * Data is pulled from a source stream chunk by chunk as the consumer reads; the stream enforces that
 * <ul>
 *     <li>no more than {@code limit} bytes are received in total, and</li>
 *     <li>no more than {@code timeout} milliseconds pass without receiving data (see {@link InactivityTimer}).</li>
 * </ul>
 * A violation of either bound is terminal: the stream records a {@link StreamFault}, releases its timer and
 * closes its source. The fault is thrown from every subsequent read, and delivered to the listeners registered
 * using {@link #onFault(Consumer)} exactly once.
 * <p>
 * If the declared content length already exceeds the limit, the {@code TooLarge} fault is raised shortly after
 * construction (on the scheduler thread, never inside the constructor), or on the first read, whichever comes
 * first. No data is read from the source in that case.
 * <p>
 * A stream may be created without a source; in that case, readers block until one is attached using
 * {@link #pipeFrom(InputStream)}. The inactivity timer runs regardless, so a source that never shows up
 * results in a {@code TimedOut} fault.
 * <p>
 * Instances are meant to be consumed by a single reader thread. Timer checks run on a scheduler thread;
 * {@link #destroy()} may be called from any thread and unblocks a reader waiting for data (to the extent that
 * closing the source does so).
 */
@SuppressWarnings("NullableProblems") // silence IntelliJ-specific bogus warning
public class BoundedStream extends InputStream {
    private static final Logger logger = LoggerFactory.getLogger(BoundedStream.class);

    private final String rawContentType;
    private final String contentType;
    private final ContentEncoding contentEncoding;
    private final long limit;
    private final long timeout;
    private final long interval;
    private final ScheduledExecutorService scheduler;
    private final InactivityTimer timer;
    private final boolean declaredTooLarge;
    private final List<Consumer<StreamFault>> faultListeners = new CopyOnWriteArrayList<>();

    private volatile Long contentLength;
    private volatile long size = 0;
    private volatile StreamState state = StreamState.OPEN;
    private volatile StreamFault fault;
    private InputStream source;

    /**
     * Creates a stream without a source, see {@link #pipeFrom(InputStream)}.
     *
     * @param properties the stream properties
     * @throws IllegalArgumentException if the properties are invalid
     */
    public BoundedStream(StreamProperties properties) {
        this(properties, null);
    }

    public BoundedStream(StreamProperties properties, InputStream source) {
        this(properties, source, ThreadPools.sharedScheduler());
    }

    /**
     * Creates a new stream.
     * <p>
     * Unset properties take the defaults from {@link StreamProperties}; the default limit depends on whether the
     * content type is deserializable. If only a timeout is given, the interval defaults to the smaller of the
     * default interval and the timeout.
     *
     * @param properties the stream properties (must not be null)
     * @param source     the source to read from, or {@code null} to attach one later
     * @param scheduler  the scheduler running inactivity checks
     * @throws NullPointerException     if {@code properties} or {@code scheduler} is null
     * @throws IllegalArgumentException if the content type or encoding is invalid, the content length or limit
     *                                  is not positive, timeout or interval are negative, or the interval exceeds the timeout
     */
    public BoundedStream(StreamProperties properties, InputStream source, ScheduledExecutorService scheduler) {
        Objects.requireNonNull(properties, "properties must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");

        this.rawContentType = properties.getContentType();
        this.contentType = ContentTypes.essenceOf(rawContentType);
        this.contentEncoding = ContentEncoding.fromName(properties.getContentEncoding());

        Long declaredLength = properties.getContentLength();
        if (declaredLength != null && declaredLength <= 0) {
            throw new IllegalArgumentException(declaredLength + " is an invalid content-length!");
        }
        Long requestedLimit = properties.getLimit();
        if (requestedLimit != null && requestedLimit <= 0) {
            throw new IllegalArgumentException(requestedLimit + " is an invalid limit!");
        }
        Long requestedTimeout = properties.getTimeout();
        Long requestedInterval = properties.getInterval();
        if (requestedTimeout != null && requestedTimeout < 0) {
            throw new IllegalArgumentException(requestedTimeout + " is an invalid timeout!");
        }
        if (requestedInterval != null && requestedInterval < 0) {
            throw new IllegalArgumentException(requestedInterval + " is an invalid interval!");
        }
        if (requestedTimeout != null && requestedInterval != null && requestedTimeout < requestedInterval) {
            throw new IllegalArgumentException("timeout (" + requestedTimeout + "ms) must be higher than the interval (" + requestedInterval + "ms)");
        }

        this.contentLength = declaredLength;
        this.limit = requestedLimit != null
                ? requestedLimit
                : (ContentTypes.isDeserializable(contentType) ? StreamProperties.DEFAULT_DESERIALIZABLE_LIMIT : StreamProperties.DEFAULT_LIMIT);
        this.timeout = requestedTimeout != null ? requestedTimeout : StreamProperties.DEFAULT_TIMEOUT_MILLIS;
        if (requestedInterval != null) {
            this.interval = requestedInterval;
        } else if (requestedTimeout != null && requestedTimeout < StreamProperties.DEFAULT_INTERVAL_MILLIS) {
            this.interval = requestedTimeout;
        } else {
            this.interval = StreamProperties.DEFAULT_INTERVAL_MILLIS;
        }
        this.declaredTooLarge = declaredLength != null && declaredLength > limit;
        this.source = source;

        if (declaredTooLarge) {
            this.timer = InactivityTimer.start(0, 0, elapsed -> { }, scheduler);
            scheduler.execute(() -> fail(StreamFault.tooLarge(faultMetadata()), StreamState.ERRORED));
        } else {
            this.timer = InactivityTimer.start(timeout, interval, this::onTimedOut, scheduler);
        }
        logger.debug("Created {}", this);
    }

    // ---- metadata

    /**
     * @return the MIME essence of the content type, without parameters
     */
    public String getContentType() {
        return contentType;
    }

    /**
     * @return the content type as supplied at construction, including parameters
     */
    public String getRawContentType() {
        return rawContentType;
    }

    public ContentEncoding getContentEncoding() {
        return contentEncoding;
    }

    /**
     * Returns the content length. If none was declared, this is {@code null} until the stream is flushed,
     * after which it is the number of bytes received.
     *
     * @return the content length, or {@code null} if not (yet) known
     */
    public Long getContentLength() {
        return contentLength;
    }

    /**
     * @return the number of bytes received from the source so far
     */
    public long getSize() {
        return size;
    }

    /**
     * @return the maximum number of bytes accepted; {@link StreamProperties#UNBOUNDED} if unlimited
     */
    public long getLimit() {
        return limit;
    }

    public long getTimeout() {
        return timeout;
    }

    public long getInterval() {
        return interval;
    }

    public StreamState getState() {
        return state;
    }

    /**
     * @return the terminal fault, or {@code null} if none occurred
     */
    public StreamFault getFault() {
        return fault;
    }

    /**
     * @return {@code true} if the stream reached a terminal state, and its resources were released
     */
    public boolean isDestroyed() {
        return state.isTerminal();
    }

    public boolean isCompressed() {
        return contentEncoding.isCompressed();
    }

    public boolean isDeserializable() {
        return ContentTypes.isDeserializable(contentType);
    }

    public boolean isObjectStream() {
        return ContentTypes.isObjectStream(contentType);
    }

    public boolean isAppSpecific() {
        return ContentTypes.isAppSpecific(contentType);
    }

    public boolean isAudio() {
        return ContentTypes.isAudio(contentType);
    }

    public boolean isImage() {
        return ContentTypes.isImage(contentType);
    }

    public boolean isMultipart() {
        return ContentTypes.isMultipart(contentType);
    }

    public boolean isText() {
        return ContentTypes.isText(contentType);
    }

    public boolean isVideo() {
        return ContentTypes.isVideo(contentType);
    }

    /**
     * Returns the content descriptor of this stream. It can be used to construct another stream with
     * equivalent semantics, using {@link StreamProperties#from(ContentDescriptor)}.
     *
     * @return an immutable snapshot of the content metadata
     */
    public ContentDescriptor metadataDescriptor() {
        Long length = contentLength;
        return new ContentDescriptor(rawContentType, contentEncoding, length != null && length > 0 ? length : null);
    }

    private Map<String, Object> faultMetadata() {
        Map<String, Object> metadata = metadataDescriptor().toMap();
        metadata.put("size", size);
        return metadata;
    }

    // ---- fault notification

    /**
     * Registers a listener for the terminal fault of this stream. If a fault already occurred, the listener
     * is invoked immediately. Exceptions thrown by listeners are logged and otherwise ignored.
     *
     * @param listener the listener
     */
    public void onFault(Consumer<StreamFault> listener) {
        Objects.requireNonNull(listener);
        StreamFault existing;
        synchronized (this) {
            existing = fault;
            if (existing == null) {
                faultListeners.add(listener);
                return;
            }
        }
        invokeListener(listener, existing);
    }

    private void invokeListener(Consumer<StreamFault> listener, StreamFault streamFault) {
        try {
            listener.accept(streamFault);
        } catch (Exception e) {
            logger.error("Fault listener {} unexpectedly threw exception on {}", listener, this, e);
        }
    }

    private void notifyListeners(StreamFault streamFault) {
        for (Consumer<StreamFault> listener : faultListeners) {
            invokeListener(listener, streamFault);
        }
        faultListeners.clear();
    }

    // ---- state transitions

    /**
     * Records a fault and releases all resources, unless the stream already is in a terminal state.
     *
     * @param candidate   the fault to record
     * @param targetState the state to transition to
     * @return the fault that is effective for the stream: the candidate, or a previously recorded one
     */
    private StreamFault fail(StreamFault candidate, StreamState targetState) {
        InputStream toClose;
        synchronized (this) {
            if (fault != null) {
                return fault;
            }
            if (state.isTerminal()) {
                return candidate;
            }
            fault = candidate;
            state = targetState;
            timer.destroy();
            toClose = source;
            notifyAll();
        }
        logger.warn("Stream failed: {}, metadata={}, state={}", candidate, candidate.getMetadata(), targetState);
        closeSource(toClose);
        notifyListeners(candidate);
        return candidate;
    }

    private void onTimedOut(long elapsed) {
        fail(StreamFault.timedOut(elapsed), StreamState.ERRORED);
    }

    /**
     * Tears the stream down without a cause. See {@link #destroy(Throwable)}.
     */
    public void destroy() {
        destroy(null);
    }

    /**
     * Tears the stream down: stops the inactivity timer, closes the source and wakes up blocked readers.
     * Any state transitions to {@link StreamState#DESTROYED}; an errored stream keeps its fault, which
     * remains available through {@link #getFault()} and is thrown by subsequent reads. This method is idempotent.
     * <p>
     * If a cause is given (and no fault occurred before), it becomes the terminal fault of the stream and is
     * delivered to the fault listeners; causes that are not {@link StreamFault}s are wrapped as {@code Unexpected}.
     *
     * @param cause the reason for destroying the stream, may be {@code null}
     */
    public void destroy(Throwable cause) {
        if (cause != null) {
            fail(cause instanceof StreamFault ? (StreamFault) cause : StreamFault.unexpected(faultMetadata(), cause), StreamState.DESTROYED);
        }
        InputStream toClose = null;
        synchronized (this) {
            if (state == StreamState.DESTROYED) {
                return;
            }
            if (state != StreamState.ERRORED) {
                // an errored stream already released its resources
                timer.destroy();
                toClose = source;
            }
            state = StreamState.DESTROYED;
            notifyAll();
        }
        logger.debug("Destroyed {}", this);
        closeSource(toClose);
    }

    /**
     * Closes the stream. An open stream is destroyed; on a flushed or terminated stream, this has no effect.
     */
    @Override
    public void close() {
        if (state == StreamState.OPEN) {
            destroy();
        }
    }

    private void closeSource(InputStream toClose) {
        if (toClose == null) {
            return;
        }
        try {
            toClose.close();
        } catch (IOException e) {
            logger.warn("Failed to close source of {}", this, e);
        }
    }

    /**
     * Attaches the source providing the data of this stream.
     *
     * @param newSource the source
     * @throws StreamFault           with code {@code MultipleSources} if a source was already attached; the stream fails
     * @throws IllegalStateException if the stream already reached a terminal state
     */
    public void pipeFrom(InputStream newSource) throws StreamFault {
        Objects.requireNonNull(newSource, "source must not be null");
        synchronized (this) {
            if (state.isTerminal()) {
                throw new IllegalStateException("Cannot attach a source to a stream in state " + state);
            }
            if (source == null) {
                source = newSource;
                notifyAll();
                logger.debug("Attached source to {}", this);
                return;
            }
        }
        throw fail(StreamFault.multipleSources(faultMetadata()), StreamState.ERRORED);
    }

    // ---- reading

    /**
     * Returns the source to read from, waiting for one to be attached if necessary.
     *
     * @return the source, or {@code null} if the stream has been flushed
     */
    private InputStream awaitSource() throws IOException {
        if (declaredTooLarge) {
            throw fail(StreamFault.tooLarge(faultMetadata()), StreamState.ERRORED);
        }
        synchronized (this) {
            while (true) {
                if (fault != null) {
                    throw fault;
                }
                switch (state) {
                    case FLUSHED:
                        return null;
                    case DESTROYED:
                        throw new IOException("Stream closed");
                    default:
                        if (source != null) {
                            return source;
                        }
                        try {
                            wait();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new InterruptedIOException("Interrupted while waiting for a source");
                        }
                }
            }
        }
    }

    @Override
    public int read() throws IOException {
        byte[] buffer = new byte[1];
        int r = read(buffer, 0, 1);
        return (r == -1) ? -1 : (buffer[0] & 0xFF);
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        InputStream in = awaitSource();
        if (in == null) {
            return -1;
        }
        if (len == 0) {
            return 0;
        }
        int n;
        try {
            n = in.read(b, off, len);
        } catch (IOException | RuntimeException e) {
            throw onSourceError(e);
        }
        return onChunk(n);
    }

    private IOException onSourceError(Exception e) {
        synchronized (this) {
            if (fault != null) {
                // e.g. the source was closed because of a timeout
                return fault;
            }
            if (state == StreamState.DESTROYED) {
                return new IOException("Stream closed", e);
            }
        }
        if (e instanceof StreamFault) {
            return fail((StreamFault) e, StreamState.ERRORED);
        }
        return fail(StreamFault.unexpected(faultMetadata(), e), StreamState.ERRORED);
    }

    private int onChunk(int n) throws IOException {
        StreamFault chunkFault;
        synchronized (this) {
            if (fault != null) {
                throw fault;
            }
            if (state == StreamState.DESTROYED) {
                throw new IOException("Stream closed");
            }
            if (n < 0) {
                chunkFault = null;
            } else {
                size += n;
                if (size > limit) {
                    chunkFault = StreamFault.tooLarge(faultMetadata());
                } else if (timer.touchIfAlive()) {
                    return n;
                } else {
                    // the timer fired, but its callback has not reached us yet
                    chunkFault = StreamFault.timedOut(timer.getTimedOutAfter());
                }
            }
        }
        if (chunkFault != null) {
            throw fail(chunkFault, StreamState.ERRORED);
        }
        flush();
        return -1;
    }

    private void flush() {
        InputStream toClose;
        synchronized (this) {
            if (state != StreamState.OPEN) {
                return;
            }
            state = StreamState.FLUSHED;
            timer.destroy();
            if (contentLength == null) {
                contentLength = size;
            }
            toClose = source;
            notifyAll();
        }
        logger.debug("Flushed {}", this);
        closeSource(toClose);
    }

    @Override
    public int available() throws IOException {
        InputStream in;
        synchronized (this) {
            in = state == StreamState.OPEN ? source : null;
        }
        return in == null ? 0 : in.available();
    }

    // ---- derived operations

    /**
     * Returns this stream in a different encoding.
     * <p>
     * If the target encoding is the current one, this very instance is returned. Otherwise, a new stream is
     * returned that reads from this one, transcoding on the fly. The new stream has no limit and no timeout,
     * because this instance already enforces them on the original data. Its content length is unknown until
     * it is flushed.
     *
     * @param targetEncoding the desired encoding
     * @return this instance, or a new stream in the target encoding
     */
    public BoundedStream transcode(ContentEncoding targetEncoding) {
        Objects.requireNonNull(targetEncoding, "targetEncoding must not be null");
        if (targetEncoding == contentEncoding) {
            return this;
        }
        InputStream transcoded = Transcoder.transcode(contentEncoding, targetEncoding, this);
        StreamProperties properties = StreamProperties.from(metadataDescriptor().withContentEncoding(targetEncoding)).unbounded();
        return new BoundedStream(properties, transcoded, scheduler);
    }

    /**
     * @param targetEncoding name of the desired encoding
     * @return this instance, or a new stream in the target encoding
     * @throws IllegalArgumentException if the encoding name is invalid
     * @see #transcode(ContentEncoding)
     */
    public BoundedStream transcode(String targetEncoding) {
        return transcode(ContentEncoding.fromName(targetEncoding));
    }

    /**
     * Reads the entire stream into a byte array.
     *
     * @param autoDecompress whether to decompress the data if the stream is compressed
     * @return the data
     * @throws StreamFault the terminal fault of the stream if one occurred; any other error is wrapped as {@code Unexpected},
     *                     and destroys the stream
     */
    public byte[] collectToBuffer(boolean autoDecompress) throws StreamFault {
        InputStream in = autoDecompress && isCompressed() ? Transcoder.decompress(contentEncoding, this) : this;
        try (in) {
            byte[] result = in.readAllBytes();
            if (in != this) {
                // decompressors may stop before the end of their input
                transferTo(OutputStream.nullOutputStream());
            }
            return result;
        } catch (StreamFault e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to collect {}", this, e);
            destroy(e);
            StreamFault effective = fault;
            throw effective != null ? effective : StreamFault.unexpected(faultMetadata(), e);
        }
    }

    /**
     * Reads the entire stream into a byte array on the given executor. Cancelling the returned future destroys
     * the stream, which aborts the collection.
     *
     * @param autoDecompress whether to decompress the data if the stream is compressed
     * @param executor       the executor to run the collection on
     * @return a future completing with the data, or exceptionally with a {@link StreamFault}
     */
    public CompletableFuture<byte[]> collectToBufferAsync(boolean autoDecompress, Executor executor) {
        CompletableFuture<byte[]> result = new CompletableFuture<>();
        result.whenComplete((data, t) -> {
            if (t instanceof CancellationException) {
                logger.debug("Collection cancelled, destroying {}", this);
                destroy();
            }
        });
        executor.execute(() -> {
            try {
                result.complete(collectToBuffer(autoDecompress));
            } catch (StreamFault e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Reads and deserializes the entire stream (decompressing it first if needed).
     *
     * @return the deserialized value
     * @throws StreamFault           the terminal fault of the stream, or {@code Unexpected} if the data is malformed
     * @throws IllegalStateException if the content type is not deserializable
     */
    public Object collectToObject() throws StreamFault {
        return collectToObject(Object.class);
    }

    public <T> T collectToObject(Class<T> type) throws StreamFault {
        if (!isDeserializable()) {
            throw new IllegalStateException("unknown MIME-type \"" + contentType + "\"!");
        }
        byte[] data = collectToBuffer(true);
        try {
            return Serializer.deserialize(contentType, data, type);
        } catch (IOException e) {
            throw StreamFault.unexpected(faultMetadata(), e);
        }
    }

    @Override
    public String toString() {
        return "BoundedStream{" +
                "contentType='" + rawContentType + '\'' +
                ", contentEncoding=" + contentEncoding +
                ", contentLength=" + contentLength +
                ", size=" + size +
                ", limit=" + limit +
                ", timeout=" + timeout +
                ", interval=" + interval +
                ", state=" + state +
                '}';
    }
}
