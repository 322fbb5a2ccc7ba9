package io.requestgate.core.error;

import io.requestgate.core.model.HttpHeaders;
import java.util.List;
import java.util.Map;

/**
 * Thrown when routes match the request path but none accepts its method (405). Carries an
 * {@code Allow} header listing the methods those routes do accept. URN:
 * {@code urn:request-gate:error:method-not-allowed}
 */
public final class MethodNotAllowedException extends RequestRejectedException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:request-gate:error:method-not-allowed";

    private final List<String> allowedMethods;

    public MethodNotAllowedException(String message, List<String> allowedMethods) {
        super(405, message, allowHeader(allowedMethods));
        this.allowedMethods = List.copyOf(allowedMethods);
    }

    /** Methods accepted by the routes that matched every earlier dimension. */
    public List<String> allowedMethods() {
        return allowedMethods;
    }

    @Override
    public String type() {
        return URN;
    }

    private static HttpHeaders allowHeader(List<String> allowedMethods) {
        if (allowedMethods.isEmpty()) {
            return HttpHeaders.empty();
        }
        return HttpHeaders.of(Map.of("Allow", String.join(", ", allowedMethods)));
    }
}
