package io.requestgate.core.shape;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.requestgate.core.error.BodyRequiredException;
import io.requestgate.core.error.MalformedBodyException;
import io.requestgate.core.error.RequestRejectedException;
import io.requestgate.core.error.ShapeValidationException;
import io.requestgate.core.error.UnsupportedMediaTypeException;
import io.requestgate.core.model.GateResponse;
import io.requestgate.core.model.RequestContext;
import io.requestgate.core.model.RequestDescriptor;
import io.requestgate.core.spi.RequestHandler;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link JsonBodyHandler}. */
@DisplayName("JsonBodyHandler")
class JsonBodyHandlerTest {

    private static final Filter ITEM = Filters.object()
            .required("id", Filters.integer().withMin(0))
            .optional("description", Filters.string())
            .build();

    /** Echoes the parsed body back as the response. */
    private static final RequestHandler ECHO = ctx -> GateResponse.json(200, JsonBodyHandler.body(ctx));

    private static RequestContext post(String contentType, String body) {
        return new RequestContext(RequestDescriptor.of(
                "POST", "/create", contentType, body == null ? null : body.getBytes(StandardCharsets.UTF_8)));
    }

    @Nested
    @DisplayName("Accepted bodies")
    class Accepted {

        @Test
        @DisplayName("parsed body and raw bytes are published to the context")
        void publishesBody() throws Exception {
            RequestContext ctx = post("application/json", "{\"id\": 5}");

            GateResponse response = new JsonBodyHandler(ECHO, ITEM).handle(ctx);

            assertThat(response.status()).isEqualTo(200);
            assertThat(response.body().asString()).isEqualTo("{\"id\":5}");
            assertThat(JsonBodyHandler.body(ctx).get("id").asInt()).isEqualTo(5);
            assertThat(ctx.attribute(JsonBodyHandler.RAW_BODY, byte[].class))
                    .hasValueSatisfying(raw -> assertThat(new String(raw, StandardCharsets.UTF_8))
                            .isEqualTo("{\"id\": 5}"));
        }

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {
            "application/json",
            "application/json; charset=utf-8",
            "application/vnd.api+json",
            "application/problem+json"
        })
        @DisplayName("any content type with a json subtype token is accepted")
        void jsonTokens(String contentType) throws Exception {
            GateResponse response = new JsonBodyHandler(ECHO).handle(post(contentType, "[1, 2]"));

            assertThat(response.status()).isEqualTo(200);
        }

        @Test
        @DisplayName("without a filter any JSON value is forwarded")
        void noFilter() throws Exception {
            JsonBodyHandler handler = new JsonBodyHandler(ECHO);

            assertThat(handler.filter()).isEmpty();
            assertThat(handler.handle(post("application/json", "\"text\"")).body().asString())
                    .isEqualTo("\"text\"");
            assertThat(handler.handle(post("application/json", "null")).body().asString())
                    .isEqualTo("null");
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("missing Content-Type is 400 Body required")
        void noContentType() {
            assertThatThrownBy(() -> new JsonBodyHandler(ECHO, ITEM).handle(post(null, "{\"id\": 5}")))
                    .isInstanceOf(BodyRequiredException.class)
                    .hasMessage("Body required")
                    .extracting(e -> ((RequestRejectedException) e).status())
                    .isEqualTo(400);
        }

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {"text/plain", "application/xml", "application/jsonp", "json"})
        @DisplayName("content types without a json token are 415")
        void notJson(String contentType) {
            assertThatThrownBy(() -> new JsonBodyHandler(ECHO).handle(post(contentType, "{}")))
                    .isInstanceOf(UnsupportedMediaTypeException.class)
                    .hasMessage("Only json content is allowed.")
                    .extracting(e -> ((RequestRejectedException) e).status())
                    .isEqualTo(415);
        }

        @ParameterizedTest(name = "[{0}]")
        @ValueSource(strings = {"", "{", "{\"id\": }", "{} {}", "undefined"})
        @DisplayName("empty, unparseable or trailing content is 422 Invalid JSON")
        void malformed(String body) {
            assertThatThrownBy(() -> new JsonBodyHandler(ECHO, ITEM).handle(post("application/json", body)))
                    .isInstanceOf(MalformedBodyException.class)
                    .hasMessage("Invalid JSON")
                    .extracting(e -> ((RequestRejectedException) e).status())
                    .isEqualTo(422);
        }

        @Test
        @DisplayName("shape rejection is 400 with the filter's reason")
        void shapeRejected() {
            RequestContext ctx = post("application/json", "{\"id\": -1}");

            assertThatThrownBy(() -> new JsonBodyHandler(ECHO, ITEM).handle(ctx))
                    .isInstanceOf(ShapeValidationException.class)
                    .hasMessage("id: expected number not less than 0, found -1");
            assertThat(ctx.attribute(JsonBodyHandler.JSON_BODY, JsonNode.class)).isEmpty();
        }

        @Test
        @DisplayName("an overflowing number outside the bounds is a 400 shape rejection")
        void overflowingNumber() {
            Filter priced = Filters.object().required("price", Filters.number().withMax(100)).build();

            assertThatThrownBy(() -> new JsonBodyHandler(ECHO, priced)
                            .handle(post("application/json", "{\"price\": 1e400}")))
                    .isInstanceOf(ShapeValidationException.class)
                    .hasMessage("price: expected number not greater than 100, found Infinity")
                    .extracting(e -> ((RequestRejectedException) e).status())
                    .isEqualTo(400);
        }

        @Test
        @DisplayName("media type is checked before the body is parsed")
        void mediaTypeBeforeParse() {
            assertThatThrownBy(() -> new JsonBodyHandler(ECHO, ITEM).handle(post("text/plain", "not json")))
                    .isInstanceOf(UnsupportedMediaTypeException.class);
        }

        @Test
        @DisplayName("the wrapped handler is not called on rejection")
        void nextNotCalled() {
            RequestHandler failing = ctx -> {
                throw new AssertionError("must not be called");
            };

            assertThatThrownBy(() -> new JsonBodyHandler(failing, ITEM).handle(post("application/json", "{}")))
                    .isInstanceOf(ShapeValidationException.class)
                    .hasMessage("entry with key 'id' required");
        }
    }

    @Test
    @DisplayName("body() without a preceding JSON handler fails")
    void bodyWithoutHandler() {
        RequestContext ctx = new RequestContext(RequestDescriptor.of("GET", "/"));

        assertThatThrownBy(() -> JsonBodyHandler.body(ctx))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(JsonBodyHandler.JSON_BODY);
    }
}
