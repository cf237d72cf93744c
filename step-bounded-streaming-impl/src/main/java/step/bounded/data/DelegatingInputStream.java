package step.bounded.data;

import java.io.IOException;
import java.io.InputStream;

/**
 * An InputStream that delegates to a sequence of other InputStreams.
 * The first delegate is requested on first access; whenever the current delegate is exhausted (EOF),
 * {@code getNextDelegate()} is asked for the next one.
 */
@SuppressWarnings("NullableProblems") // silence IntelliJ-specific bogus warning
public abstract class DelegatingInputStream<Delegate extends InputStream> extends InputStream {

    private boolean closed = false;
    private boolean started = false;
    private boolean exhausted = false;
    protected Delegate delegate;

    /**
     * Provides the next InputStream to read from after the current one is exhausted.
     * Return null to signal end-of-stream.
     */
    protected abstract Delegate getNextDelegate() throws IOException;

    private Delegate currentDelegate() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
        if (!started) {
            started = true;
            delegate = getNextDelegate();
            exhausted = delegate == null;
        }
        return exhausted ? null : delegate;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        while (true) {
            Delegate current = currentDelegate();
            if (current == null) {
                return -1;
            }
            int result = current.read(b, off, len);
            if (result != -1) {
                return result;
            }

            Delegate next = getNextDelegate();
            current.close();
            if (next == null) {
                exhausted = true;
                return -1;
            }
            delegate = next;
        }
    }

    @Override
    public final int read() throws IOException {
        byte[] buffer = new byte[1];
        int r = read(buffer, 0, 1);
        return (r == -1) ? -1 : (buffer[0] & 0xFF);
    }

    @Override
    public final int read(byte[] b) throws IOException {
        return read(b, 0, b.length);
    }

    @Override
    public int available() throws IOException {
        Delegate current = currentDelegate();
        if (current == null) {
            return 0;
        }
        return current.available();
    }

    public final boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        if (!isClosed()) {
            this.closed = true;
            if (delegate != null && !exhausted) {
                delegate.close();
            }
        }
    }

    @Override
    public final synchronized void mark(int readlimit) {
        throw new UnsupportedOperationException("mark/reset not supported");
    }

    @Override
    public final synchronized void reset() {
        throw new UnsupportedOperationException("mark/reset not supported");
    }

}
