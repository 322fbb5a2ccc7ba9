package io.requestgate.core.spi;

import io.requestgate.core.model.BoundedBodySource;
import java.io.IOException;

/**
 * Request body supplied by the hosting adapter. The underlying stream is read at most once, up
 * to the length the request declares; later calls to {@link #read()} return the same bytes.
 *
 * <p>
 * Implementations MUST be safe to call from the single thread handling the request. They are
 * never shared across requests.
 */
public interface BodySource {

    /**
     * Reads the body.
     *
     * @return the body bytes, empty if the request carries none
     * @throws IOException if the underlying stream fails
     * @throws io.requestgate.core.error.PayloadTooLargeException if the body exceeds the
     *         adapter's configured maximum
     */
    byte[] read() throws IOException;

    /** The length the request declares, or {@code -1} if unknown (chunked transfer). */
    long declaredLength();

    /** A body source with no content. */
    static BodySource empty() {
        return BoundedBodySource.of(new byte[0]);
    }

    /** A body source over bytes already in memory. */
    static BodySource of(byte[] content) {
        return BoundedBodySource.of(content);
    }
}
