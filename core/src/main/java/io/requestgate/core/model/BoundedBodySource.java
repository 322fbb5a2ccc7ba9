package io.requestgate.core.model;

import io.requestgate.core.error.PayloadTooLargeException;
import io.requestgate.core.spi.BodySource;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BodySource} over a request input stream. Reads exactly the declared number of bytes
 * the first time {@link #read()} is called and caches them for later calls.
 *
 * <p>
 * A positive {@code maxBytes} caps the body: a declared length above it is rejected before
 * anything is read, and a body of unknown length is rejected once it grows past it.
 */
public final class BoundedBodySource implements BodySource {

    private static final Logger LOG = LoggerFactory.getLogger(BoundedBodySource.class);

    private final InputStream in;
    private final long declaredLength;
    private final long maxBytes;
    private byte[] content; // guarded by this

    /**
     * @param in             the request input stream, owned by the hosting server
     * @param declaredLength the declared content length, {@code -1} if unknown
     * @param maxBytes       maximum accepted body size, {@code <= 0} for no limit
     */
    public BoundedBodySource(InputStream in, long declaredLength, long maxBytes) {
        this.in = Objects.requireNonNull(in, "in must not be null");
        this.declaredLength = declaredLength;
        this.maxBytes = maxBytes;
    }

    /** A source over bytes already in memory, with no size limit. */
    public static BoundedBodySource of(byte[] content) {
        byte[] bytes = content != null ? content : new byte[0];
        return new BoundedBodySource(new ByteArrayInputStream(bytes), bytes.length, -1);
    }

    @Override
    public synchronized byte[] read() throws IOException {
        if (content != null) {
            return content;
        }
        if (maxBytes > 0 && declaredLength > maxBytes) {
            LOG.warn("Request body too large: {} bytes declared (limit {})", declaredLength, maxBytes);
            throw new PayloadTooLargeException("Request body exceeds " + maxBytes + " bytes");
        }
        if (declaredLength >= 0) {
            content = in.readNBytes(Math.toIntExact(declaredLength));
        } else if (maxBytes > 0) {
            byte[] bytes = in.readNBytes(Math.toIntExact(maxBytes) + 1);
            if (bytes.length > maxBytes) {
                LOG.warn("Request body too large: more than {} bytes without a declared length", maxBytes);
                throw new PayloadTooLargeException("Request body exceeds " + maxBytes + " bytes");
            }
            content = bytes;
        } else {
            content = in.readAllBytes();
        }
        return content;
    }

    @Override
    public long declaredLength() {
        return declaredLength;
    }
}
