package step.bounded.data;

import org.junit.Test;
import step.bounded.codec.Transcoder;
import step.bounded.common.ContentDescriptor;
import step.bounded.common.ContentEncoding;
import step.bounded.common.ContentTypes;
import step.bounded.common.StreamFault;
import step.bounded.common.StreamProperties;
import step.bounded.common.StreamState;
import step.bounded.test.ChunkedInputStream;
import step.bounded.test.FailingInputStream;
import step.bounded.test.StallingInputStream;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class BoundedStreamTests {

    private static StreamProperties octets() {
        return new StreamProperties(ContentTypes.APPLICATION_OCTET_STREAM, "identity");
    }

    private static byte[] data(int size) {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) data[i] = (byte) i;
        return data;
    }

    private static boolean waitFor(java.util.function.BooleanSupplier condition, long millis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + millis;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }

    @Test
    public void testReadsEverythingAndFlushes() throws IOException {
        byte[] data = data(1000);
        BoundedStream stream = new BoundedStream(octets(), new ByteArrayInputStream(data));
        assertEquals(StreamState.OPEN, stream.getState());
        assertNull(stream.getContentLength());

        assertArrayEquals(data, stream.readAllBytes());
        assertEquals(StreamState.FLUSHED, stream.getState());
        assertEquals(1000, stream.getSize());
        // backfilled on flush
        assertEquals(Long.valueOf(1000), stream.getContentLength());
        assertEquals(-1, stream.read());
        assertFalse(stream.isDestroyed());
    }

    @Test
    public void testCloseAfterFlushKeepsState() throws IOException {
        BoundedStream stream = new BoundedStream(octets(), new ByteArrayInputStream(data(10)));
        try (stream) {
            stream.readAllBytes();
        }
        assertEquals(StreamState.FLUSHED, stream.getState());
    }

    @Test
    public void testEmptySourceBackfillsZero() throws IOException {
        BoundedStream stream = new BoundedStream(octets(), new ByteArrayInputStream(new byte[0]));
        assertEquals(-1, stream.read());
        assertEquals(StreamState.FLUSHED, stream.getState());
        assertEquals(Long.valueOf(0), stream.getContentLength());
        assertNull(stream.metadataDescriptor().getContentLength());
    }

    @Test
    public void testChunkExceedingLimit() throws IOException {
        // limit 10, chunks of 4: the third chunk brings the size to 12
        ChunkedInputStream source = ChunkedInputStream.ofChunks(5, 4);
        BoundedStream stream = new BoundedStream(octets().withLimit(10L), source);
        List<StreamFault> notified = new CopyOnWriteArrayList<>();
        stream.onFault(notified::add);

        byte[] buffer = new byte[100];
        assertEquals(4, stream.read(buffer));
        assertEquals(4, stream.read(buffer));
        StreamFault fault = assertThrows(StreamFault.class, () -> stream.read(buffer));
        assertEquals(StreamFault.Code.TOO_LARGE, fault.getCode());
        assertEquals(12L, fault.getMetadata().get("size"));
        assertEquals(ContentTypes.APPLICATION_OCTET_STREAM, fault.getMetadata().get("contentType"));

        assertEquals(StreamState.ERRORED, stream.getState());
        assertSame(fault, stream.getFault());
        assertTrue(source.isClosed());
        assertEquals(3, source.getReadCount());

        // same fault on every subsequent read, no further data pulled
        assertSame(fault, assertThrows(StreamFault.class, () -> stream.read(buffer)));
        assertEquals(3, source.getReadCount());
        assertEquals(List.of(fault), notified);
    }

    @Test
    public void testExactlyAtLimitFlushes() throws IOException {
        BoundedStream stream = new BoundedStream(octets().withLimit(12L), ChunkedInputStream.ofChunks(3, 4));
        assertEquals(12, stream.readAllBytes().length);
        assertEquals(StreamState.FLUSHED, stream.getState());
    }

    @Test
    public void testDeclaredLengthExceedingLimitFailsOnFirstRead() {
        ChunkedInputStream source = ChunkedInputStream.ofChunks(1, 4);
        BoundedStream stream = new BoundedStream(octets().withContentLength(100L).withLimit(10L), source);
        StreamFault fault = assertThrows(StreamFault.class, stream::read);
        assertTrue(fault.is(StreamFault.Code.TOO_LARGE));
        assertEquals(100L, fault.getMetadata().get("contentLength"));
        assertEquals(0, source.getReadCount());
        assertEquals(StreamState.ERRORED, stream.getState());
    }

    @Test
    public void testDeclaredLengthExceedingLimitFailsWithoutRead() throws InterruptedException {
        BoundedStream stream = new BoundedStream(octets().withContentLength(100L).withLimit(10L), new StallingInputStream());
        CountDownLatch notified = new CountDownLatch(1);
        stream.onFault(f -> notified.countDown());
        assertTrue(notified.await(2, TimeUnit.SECONDS));
        assertTrue(stream.getFault().is(StreamFault.Code.TOO_LARGE));
    }

    @Test
    public void testStalledSourceTimesOut() throws IOException {
        StallingInputStream source = new StallingInputStream(data(5));
        BoundedStream stream = new BoundedStream(octets().withTimeout(200L).withInterval(50L), source);
        byte[] buffer = new byte[10];
        assertEquals(5, stream.read(buffer));

        long start = System.currentTimeMillis();
        StreamFault fault = assertThrows(StreamFault.class, () -> stream.read(buffer));
        assertTrue(fault.is(StreamFault.Code.TIMED_OUT));
        long duration = (Long) fault.getMetadata().get("duration");
        assertTrue("duration " + duration, duration >= 200);
        assertTrue(System.currentTimeMillis() - start < 2000);
        assertTrue(source.isClosed());
        assertEquals(StreamState.ERRORED, stream.getState());
    }

    @Test
    public void testMissingSourceTimesOut() {
        BoundedStream stream = new BoundedStream(octets().withTimeout(150L));
        // interval defaults to the timeout if that is smaller than the default interval
        assertEquals(150, stream.getInterval());
        StreamFault fault = assertThrows(StreamFault.class, stream::read);
        assertTrue(fault.is(StreamFault.Code.TIMED_OUT));
    }

    @Test
    public void testZeroTimeoutDisablesStallDetection() throws Exception {
        BoundedStream stream = new BoundedStream(octets().withTimeout(0L), new StallingInputStream());
        assertEquals(0, stream.getInterval());
        Thread.sleep(200);
        assertEquals(StreamState.OPEN, stream.getState());
        stream.destroy();
    }

    @Test
    public void testPipeFromUnblocksReader() throws Exception {
        BoundedStream stream = new BoundedStream(octets());
        AtomicReference<byte[]> result = new AtomicReference<>();
        Thread reader = new Thread(() -> {
            try {
                result.set(stream.readAllBytes());
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        });
        reader.start();
        Thread.sleep(100);
        assertTrue(reader.isAlive());

        stream.pipeFrom(new ByteArrayInputStream(data(20)));
        reader.join(2000);
        assertArrayEquals(data(20), result.get());
        assertEquals(StreamState.FLUSHED, stream.getState());
    }

    @Test
    public void testSecondSourceFails() {
        ChunkedInputStream first = ChunkedInputStream.ofChunks(1, 4);
        BoundedStream stream = new BoundedStream(octets(), first);
        StreamFault fault = assertThrows(StreamFault.class, () -> stream.pipeFrom(new ByteArrayInputStream(data(4))));
        assertTrue(fault.is(StreamFault.Code.MULTIPLE_SOURCES));
        assertEquals(StreamState.ERRORED, stream.getState());
        assertTrue(first.isClosed());
        assertSame(fault, assertThrows(StreamFault.class, stream::read));
    }

    @Test
    public void testSourceErrorBecomesUnexpectedFault() {
        BoundedStream stream = new BoundedStream(octets(), new FailingInputStream(new ByteArrayInputStream(data(100)), 5));
        StreamFault fault = assertThrows(StreamFault.class, stream::readAllBytes);
        assertTrue(fault.is(StreamFault.Code.UNEXPECTED));
        assertTrue(fault.getCause() instanceof IOException);
        assertEquals(5, stream.getSize());
        assertEquals(StreamState.ERRORED, stream.getState());
    }

    @Test
    public void testDestroy() throws InterruptedException {
        StallingInputStream source = new StallingInputStream();
        BoundedStream stream = new BoundedStream(octets(), source);
        List<StreamFault> notified = new CopyOnWriteArrayList<>();
        stream.onFault(notified::add);

        AtomicReference<Throwable> readError = new AtomicReference<>();
        Thread reader = new Thread(() -> {
            try {
                stream.read();
            } catch (IOException e) {
                readError.set(e);
            }
        });
        reader.start();
        Thread.sleep(100);

        stream.destroy();
        stream.destroy();
        reader.join(2000);

        assertEquals(StreamState.DESTROYED, stream.getState());
        assertTrue(stream.isDestroyed());
        assertTrue(source.isClosed());
        assertNull(stream.getFault());
        assertTrue(notified.isEmpty());
        assertFalse(readError.get() instanceof StreamFault);
        IOException e = assertThrows(IOException.class, stream::read);
        assertEquals("Stream closed", e.getMessage());
    }

    @Test
    public void testDestroyWithCause() {
        BoundedStream stream = new BoundedStream(octets(), new StallingInputStream());
        List<StreamFault> notified = new CopyOnWriteArrayList<>();
        stream.onFault(notified::add);
        IllegalStateException cause = new IllegalStateException("consumer gone");

        stream.destroy(cause);
        stream.destroy(new IllegalStateException("again"));

        assertEquals(StreamState.DESTROYED, stream.getState());
        assertEquals(1, notified.size());
        StreamFault fault = notified.get(0);
        assertTrue(fault.is(StreamFault.Code.UNEXPECTED));
        assertSame(cause, fault.getCause());
        assertSame(fault, assertThrows(StreamFault.class, stream::read));
    }

    @Test
    public void testDestroyAfterFault() throws IOException {
        ChunkedInputStream source = ChunkedInputStream.ofChunks(1, 4);
        BoundedStream stream = new BoundedStream(octets().withLimit(2L), source);
        List<StreamFault> notified = new CopyOnWriteArrayList<>();
        stream.onFault(notified::add);
        StreamFault fault = assertThrows(StreamFault.class, () -> stream.read(new byte[16]));
        assertEquals(StreamState.ERRORED, stream.getState());

        // closing an errored stream has no effect, destroying it does
        stream.close();
        assertEquals(StreamState.ERRORED, stream.getState());
        stream.destroy();
        stream.destroy();
        assertEquals(StreamState.DESTROYED, stream.getState());
        assertTrue(stream.isDestroyed());

        assertSame(fault, stream.getFault());
        assertEquals(List.of(fault), notified);
        assertSame(fault, assertThrows(StreamFault.class, () -> stream.read(new byte[16])));
        assertTrue(source.isClosed());
    }

    @Test
    public void testDestroyWithCauseAfterFaultKeepsFirstFault() {
        BoundedStream stream = new BoundedStream(octets().withLimit(2L), ChunkedInputStream.ofChunks(1, 4));
        List<StreamFault> notified = new CopyOnWriteArrayList<>();
        stream.onFault(notified::add);
        StreamFault fault = assertThrows(StreamFault.class, () -> stream.read(new byte[16]));

        stream.destroy(new IllegalStateException("late"));
        assertEquals(StreamState.DESTROYED, stream.getState());
        assertSame(fault, stream.getFault());
        assertEquals(1, notified.size());
    }

    @Test
    public void testDestroyAfterFlush() throws IOException {
        BoundedStream stream = new BoundedStream(octets(), new ByteArrayInputStream(data(10)));
        stream.readAllBytes();
        stream.destroy();
        assertEquals(StreamState.DESTROYED, stream.getState());
        assertNull(stream.getFault());
    }

    @Test
    public void testLateListenerInvokedImmediately() {
        BoundedStream stream = new BoundedStream(octets().withLimit(2L), ChunkedInputStream.ofChunks(1, 4));
        StreamFault fault = assertThrows(StreamFault.class, () -> stream.read(new byte[16]));
        List<StreamFault> notified = new CopyOnWriteArrayList<>();
        stream.onFault(notified::add);
        assertEquals(List.of(fault), notified);
    }

    @Test
    public void testFailingListenerDoesNotAffectOthers() {
        BoundedStream stream = new BoundedStream(octets().withLimit(2L), ChunkedInputStream.ofChunks(1, 4));
        List<StreamFault> notified = new CopyOnWriteArrayList<>();
        stream.onFault(f -> {
            throw new IllegalStateException("expected");
        });
        stream.onFault(notified::add);
        StreamFault fault = assertThrows(StreamFault.class, stream::readAllBytes);
        assertEquals(List.of(fault), notified);
    }

    @Test
    public void testChunksArrivingAtTimeoutBoundary() throws Exception {
        // each chunk arrives roughly when the timeout expires, so reads race with the timer firing
        for (int run = 0; run < 20; run++) {
            BoundedStream stream = new BoundedStream(octets().withTimeout(2L).withInterval(0L), new SlowInputStream(200, 2));
            byte[] buffer = new byte[16];
            try {
                while (stream.read(buffer) != -1) {
                    // keep reading
                }
                assertEquals(StreamState.FLUSHED, stream.getState());
            } catch (StreamFault fault) {
                assertTrue(fault.toString(), fault.is(StreamFault.Code.TIMED_OUT));
                assertTrue((Long) fault.getMetadata().get("duration") >= 2);
                assertEquals(StreamState.ERRORED, stream.getState());
                assertSame(fault, stream.getFault());
            }
        }
    }

    @Test
    public void testFlushClosesSourceWithoutHoldingLock() throws Exception {
        CountDownLatch closing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ByteArrayInputStream source = new ByteArrayInputStream(data(10)) {
            @Override
            public void close() throws IOException {
                closing.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException(e);
                }
            }
        };
        BoundedStream stream = new BoundedStream(octets(), source);
        ExecutorService executor = Executors.newCachedThreadPool();
        try {
            CompletableFuture<byte[]> reading = CompletableFuture.supplyAsync(() -> {
                try {
                    return stream.readAllBytes();
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                }
            }, executor);
            try {
                assertTrue(closing.await(2, TimeUnit.SECONDS));
                // the reader is stuck in close(); other callers must not be blocked by it
                CompletableFuture.runAsync(() -> stream.onFault(f -> { }), executor).get(2, TimeUnit.SECONDS);
                assertEquals(StreamState.FLUSHED, stream.getState());
            } finally {
                release.countDown();
            }
            assertArrayEquals(data(10), reading.get(2, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Delivers single bytes, sleeping a fixed time before each one.
     */
    private static class SlowInputStream extends InputStream {
        private final int total;
        private final long delayMillis;
        private int delivered = 0;

        SlowInputStream(int total, long delayMillis) {
            this.total = total;
            this.delayMillis = delayMillis;
        }

        @Override
        public int read() throws IOException {
            if (delivered == total) {
                return -1;
            }
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException(e);
            }
            delivered++;
            return delivered & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (len == 0) {
                return 0;
            }
            int value = read();
            if (value == -1) {
                return -1;
            }
            b[off] = (byte) value;
            return 1;
        }
    }

    @Test
    public void testTranscodeSameEncodingReturnsSelf() {
        BoundedStream stream = new BoundedStream(octets(), new ByteArrayInputStream(data(10)));
        assertSame(stream, stream.transcode(ContentEncoding.IDENTITY));
        assertSame(stream, stream.transcode("identity"));
    }

    @Test
    public void testTranscodeToGzip() throws IOException {
        byte[] data = "hello hello hello hello".getBytes(StandardCharsets.UTF_8);
        BoundedStream stream = new BoundedStream(new StreamProperties(ContentTypes.TEXT_PLAIN, "identity").withContentLength((long) data.length),
                new ByteArrayInputStream(data));
        BoundedStream gzipped = stream.transcode("gzip");

        assertEquals(ContentEncoding.GZIP, gzipped.getContentEncoding());
        assertEquals(ContentTypes.TEXT_PLAIN, gzipped.getContentType());
        assertNull(gzipped.getContentLength());
        assertEquals(StreamProperties.UNBOUNDED, gzipped.getLimit());
        assertEquals(0, gzipped.getTimeout());
        assertEquals(0, gzipped.getInterval());

        byte[] compressed = gzipped.collectToBuffer(false);
        assertArrayEquals(data, Transcoder.decompress(ContentEncoding.GZIP, compressed).readAllBytes());
        assertEquals(StreamState.FLUSHED, stream.getState());
        assertEquals(StreamState.FLUSHED, gzipped.getState());
        assertEquals(Long.valueOf(compressed.length), gzipped.getContentLength());
    }

    @Test
    public void testTranscodedStreamSeesOriginalFault() {
        BoundedStream stream = new BoundedStream(octets().withLimit(6L), ChunkedInputStream.ofChunks(3, 4));
        BoundedStream deflated = stream.transcode(ContentEncoding.DEFLATE);
        StreamFault fault = assertThrows(StreamFault.class, () -> deflated.collectToBuffer(false));
        assertTrue(fault.is(StreamFault.Code.TOO_LARGE));
        assertTrue(stream.getFault().is(StreamFault.Code.TOO_LARGE));
    }

    @Test
    public void testCollectToBufferDecompresses() throws IOException {
        byte[] data = data(5000);
        byte[] compressed = Transcoder.compress(ContentEncoding.GZIP, data).readAllBytes();
        BoundedStream stream = new BoundedStream(new StreamProperties(ContentTypes.APPLICATION_OCTET_STREAM, "gzip"),
                new ByteArrayInputStream(compressed));
        assertTrue(stream.isCompressed());
        assertArrayEquals(data, stream.collectToBuffer(true));
        assertEquals(compressed.length, stream.getSize());
    }

    @Test
    public void testCollectToObject() throws IOException {
        byte[] json = "{\"a\":1,\"b\":[true,\"x\"]}".getBytes(StandardCharsets.UTF_8);
        BoundedStream stream = new BoundedStream(new StreamProperties("application/json; charset=utf-8", "identity"),
                new ByteArrayInputStream(json));
        assertEquals(ContentTypes.APPLICATION_JSON, stream.getContentType());
        assertEquals("application/json; charset=utf-8", stream.getRawContentType());
        Map<?, ?> value = (Map<?, ?>) stream.collectToObject();
        assertEquals(1, value.get("a"));
        assertEquals(List.of(true, "x"), value.get("b"));
    }

    @Test
    public void testCollectToObjectMalformed() {
        BoundedStream stream = new BoundedStream(new StreamProperties(ContentTypes.APPLICATION_JSON, "identity"),
                new ByteArrayInputStream("{nope".getBytes(StandardCharsets.UTF_8)));
        StreamFault fault = assertThrows(StreamFault.class, stream::collectToObject);
        assertTrue(fault.is(StreamFault.Code.UNEXPECTED));
    }

    @Test
    public void testCollectToObjectRequiresDeserializableType() {
        BoundedStream stream = new BoundedStream(new StreamProperties(ContentTypes.TEXT_PLAIN, "identity"),
                new ByteArrayInputStream(data(3)));
        assertThrows(IllegalStateException.class, stream::collectToObject);
    }

    @Test
    public void testCollectToBufferAsync() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            BoundedStream stream = new BoundedStream(octets(), new ByteArrayInputStream(data(100)));
            assertArrayEquals(data(100), stream.collectToBufferAsync(false, executor).get(2, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testCancelAsyncCollectionDestroysStream() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            StallingInputStream source = new StallingInputStream(data(10));
            BoundedStream stream = new BoundedStream(octets(), source);
            CompletableFuture<byte[]> future = stream.collectToBufferAsync(false, executor);
            Thread.sleep(100);
            future.cancel(true);
            assertEquals(StreamState.DESTROYED, stream.getState());
            assertTrue(waitFor(source::isClosed, 2000));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testDefaultsByContentType() {
        BoundedStream json = new BoundedStream(new StreamProperties(ContentTypes.APPLICATION_JSON, "identity"));
        BoundedStream octets = new BoundedStream(octets());
        assertEquals(StreamProperties.DEFAULT_DESERIALIZABLE_LIMIT, json.getLimit());
        assertEquals(StreamProperties.DEFAULT_LIMIT, octets.getLimit());
        assertEquals(StreamProperties.DEFAULT_TIMEOUT_MILLIS, octets.getTimeout());
        assertEquals(StreamProperties.DEFAULT_INTERVAL_MILLIS, octets.getInterval());
        assertTrue(json.isDeserializable());
        assertTrue(json.isAppSpecific());
        assertFalse(octets.isDeserializable());
        json.destroy();
        octets.destroy();
    }

    @Test
    public void testClassifiers() {
        BoundedStream stream = new BoundedStream(new StreamProperties("image/png", "gzip"));
        assertTrue(stream.isImage());
        assertTrue(stream.isCompressed());
        assertFalse(stream.isText());
        assertFalse(stream.isObjectStream());
        stream.destroy();

        BoundedStream ndjson = new BoundedStream(new StreamProperties(ContentTypes.APPLICATION_NDJSON, "identity"));
        assertTrue(ndjson.isObjectStream());
        ndjson.destroy();
    }

    @Test
    public void testMetadataDescriptorRoundTrip() {
        BoundedStream stream = new BoundedStream(new StreamProperties("text/plain; charset=utf-8", "deflate").withContentLength(42L));
        ContentDescriptor descriptor = stream.metadataDescriptor();
        assertEquals("text/plain; charset=utf-8", descriptor.getContentType());
        assertEquals(ContentEncoding.DEFLATE, descriptor.getContentEncoding());
        assertEquals(Long.valueOf(42), descriptor.getContentLength());

        BoundedStream copy = new BoundedStream(StreamProperties.from(descriptor));
        assertEquals(descriptor, copy.metadataDescriptor());
        stream.destroy();
        copy.destroy();
    }

    @Test
    public void testInvalidProperties() {
        assertThrows(NullPointerException.class, () -> new BoundedStream(null));
        assertThrows(IllegalArgumentException.class, () -> new BoundedStream(new StreamProperties("nonsense", "identity")));
        assertThrows(IllegalArgumentException.class, () -> new BoundedStream(new StreamProperties(ContentTypes.TEXT_PLAIN, "br")));
        assertThrows(IllegalArgumentException.class, () -> new BoundedStream(octets().withContentLength(0L)));
        assertThrows(IllegalArgumentException.class, () -> new BoundedStream(octets().withLimit(0L)));
        assertThrows(IllegalArgumentException.class, () -> new BoundedStream(octets().withTimeout(-1L)));
        assertThrows(IllegalArgumentException.class, () -> new BoundedStream(octets().withInterval(-1L)));
        assertThrows(IllegalArgumentException.class, () -> new BoundedStream(octets().withTimeout(100L).withInterval(200L)));
    }
}
