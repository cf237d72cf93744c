package step.bounded.data;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.zip.CRC32;
import java.util.zip.CheckedInputStream;
import java.util.zip.Deflater;
import java.util.zip.DeflaterInputStream;

/**
 * An InputStream returning the GZIP-compressed form of its source, produced on demand.
 * <p>
 * The JDK only offers GZIP compression as an {@link java.util.zip.GZIPOutputStream}; this class provides
 * the pull-based equivalent by emitting the GZIP header, the raw deflate data, and the trailer
 * (CRC-32 and size of the uncompressed input) as three consecutive parts.
 */
public class GzipCompressingInputStream extends DelegatingInputStream<InputStream> {

    private static final int BUFFER_SIZE = 8192;

    // magic, CM=deflate, no flags, no mtime, no extra flags, OS=unknown
    private static final byte[] HEADER = {
            (byte) 0x1f, (byte) 0x8b, Deflater.DEFLATED, 0, 0, 0, 0, 0, 0, (byte) 0xff
    };

    private final CheckedInputStream checkedSource;
    private final Deflater deflater;
    private int part = 0;

    public GzipCompressingInputStream(InputStream source) {
        this.checkedSource = new CheckedInputStream(Objects.requireNonNull(source, "source must not be null"), new CRC32());
        this.deflater = new Deflater(Deflater.DEFAULT_COMPRESSION, true);
    }

    @Override
    protected InputStream getNextDelegate() {
        switch (part++) {
            case 0:
                return new ByteArrayInputStream(HEADER);
            case 1:
                return new DeflaterInputStream(checkedSource, deflater, BUFFER_SIZE);
            case 2:
                return new ByteArrayInputStream(trailer());
            default:
                return null;
        }
    }

    private byte[] trailer() {
        long crc = checkedSource.getChecksum().getValue();
        long size = deflater.getBytesRead();
        return new byte[]{
                (byte) crc, (byte) (crc >> 8), (byte) (crc >> 16), (byte) (crc >> 24),
                (byte) size, (byte) (size >> 8), (byte) (size >> 16), (byte) (size >> 24)
        };
    }

    @Override
    public void close() throws IOException {
        try {
            super.close();
            checkedSource.close();
        } finally {
            deflater.end();
        }
    }
}
