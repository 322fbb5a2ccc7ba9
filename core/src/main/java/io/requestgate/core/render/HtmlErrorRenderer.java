package io.requestgate.core.render;

import io.requestgate.core.model.GateResponse;
import io.requestgate.core.spi.ErrorRenderer;

/**
 * Renders errors as a minimal HTML page:
 * {@code <html><head><title>404 Not Found</title></head><body><h1>404 Not Found</h1><p>Path not
 * found</p></body></html>}. The paragraph is omitted when there is no message.
 */
public final class HtmlErrorRenderer implements ErrorRenderer {

    @Override
    public GateResponse render(int status, String type, String detail, String instance) {
        String statusLine = escape(HttpStatus.statusLine(status));
        StringBuilder html = new StringBuilder()
                .append("<html><head><title>").append(statusLine).append("</title></head><body><h1>")
                .append(statusLine).append("</h1>");
        if (detail != null && !detail.isEmpty()) {
            html.append("<p>").append(escape(detail)).append("</p>");
        }
        html.append("</body></html>");
        return GateResponse.html(status, html.toString());
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
