package io.requestgate.core.routing;

import io.requestgate.core.error.RequestRejectedException;
import io.requestgate.core.error.UnsupportedMediaTypeException;
import io.requestgate.core.model.MediaType;
import io.requestgate.core.model.RequestDescriptor;
import java.util.List;

/**
 * Matches the request Content-Type against each route's expectation:
 * <ul>
 * <li>{@code null}: the request must declare no content-type;</li>
 * <li>a value containing {@code /}: the request content-type must be exactly equal, so
 * {@code application/json} rejects {@code application/json; charset=utf-8};</li>
 * <li>a bare token: it must be one of the {@code +}-separated parts of the request's subtype,
 * so {@code json} matches {@code application/json} and {@code application/vnd.api+json}.
 * Parameters are dropped first, so {@code json} also matches
 * {@code application/json; charset=utf-8}.</li>
 * </ul>
 * Rejects with 415.
 */
public final class ContentTypeRule implements Rule<String> {

    /** Shared instance; the rule holds no state. */
    public static final ContentTypeRule INSTANCE = new ContentTypeRule();

    private ContentTypeRule() {}

    @Override
    public String dimension() {
        return "content-type";
    }

    @Override
    public Class<String> expectationType() {
        return String.class;
    }

    @Override
    public boolean acceptsNullExpectation() {
        return true;
    }

    @Override
    public boolean check(RequestDescriptor request, String expected) {
        String contentType = request.contentType();
        if (contentType == null) {
            return expected == null;
        }
        if (expected == null) {
            return false;
        }
        if (expected.indexOf('/') >= 0) {
            return expected.equals(contentType);
        }
        return MediaType.hasSubtypeToken(contentType, expected);
    }

    @Override
    public RequestRejectedException errorFor(RequestDescriptor request, List<String> candidates) {
        return new UnsupportedMediaTypeException("Unsupported Content-Type");
    }
}
