package step.bounded.data;

import step.bounded.data.util.ThrowingFunction;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * An InputStream that wraps its source using a given function, but only on first access.
 * <p>
 * This is needed for wrappers that already consume data in their constructor, such as
 * {@link java.util.zip.GZIPInputStream} (which parses the header right away): creating the wrapper
 * must not block or fail before anybody actually reads.
 */
@SuppressWarnings("NullableProblems") // silence IntelliJ-specific bogus warning
public class DeferredInputStream extends InputStream {
    private final InputStream source;
    private final ThrowingFunction<InputStream, InputStream> opener;
    private InputStream delegate;
    private boolean closed = false;

    public DeferredInputStream(InputStream source, ThrowingFunction<InputStream, InputStream> opener) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.opener = Objects.requireNonNull(opener, "opener must not be null");
    }

    private InputStream delegate() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
        if (delegate == null) {
            delegate = opener.apply(source);
        }
        return delegate;
    }

    @Override
    public int read() throws IOException {
        return delegate().read();
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        return delegate().read(b, off, len);
    }

    @Override
    public long skip(long n) throws IOException {
        return delegate().skip(n);
    }

    @Override
    public int available() throws IOException {
        return delegate().available();
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            if (delegate != null) {
                delegate.close();
            } else {
                source.close();
            }
        }
    }
}
