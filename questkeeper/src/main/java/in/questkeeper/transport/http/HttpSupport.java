package in.questkeeper.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.questkeeper.domain.common.FieldError;
import in.questkeeper.domain.common.ServiceError;
import in.questkeeper.domain.common.ServiceResult;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.function.Function;

/**
 * Response writing and request plumbing shared by the handlers.
 */
public final class HttpSupport {
    private static final Logger log = LoggerFactory.getLogger(HttpSupport.class);

    static final String JSON_TYPE = "application/json; charset=utf-8";

    private final ObjectMapper mapper;
    private final Function<String, String> tokenValidator;

    public HttpSupport(ObjectMapper mapper, Function<String, String> tokenValidator) {
        this.mapper = mapper;
        this.tokenValidator = tokenValidator;
    }

    ObjectMapper mapper() {
        return mapper;
    }

    /**
     * User id from the bearer token, or null after sending 401.
     */
    String authenticate(HttpServerExchange exchange) {
        String header = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        String userId = null;
        if (header != null && header.startsWith("Bearer ")) {
            userId = tokenValidator.apply(header.substring(7));
        }
        if (userId == null) {
            unauthorized(exchange);
        }
        return userId;
    }

    static String pathParam(HttpServerExchange exchange, String name) {
        return exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY).getParameters().get(name);
    }

    static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.peekFirst();
    }

    static boolean flag(HttpServerExchange exchange, String name) {
        String value = queryParam(exchange, name);
        return value != null && (value.isEmpty() || Boolean.parseBoolean(value));
    }

    <T> void sendResult(HttpServerExchange exchange, ServiceResult<T> result, int successStatus) {
        if (result.failed()) {
            sendError(exchange, result.error());
            return;
        }
        ObjectNode body = mapper.createObjectNode();
        body.put("success", true);
        body.set("data", mapper.valueToTree(result.data()));
        send(exchange, successStatus, JSON_TYPE, body.toString());
    }

    <T> void sendResult(HttpServerExchange exchange, ServiceResult<T> result) {
        sendResult(exchange, result, StatusCodes.OK);
    }

    void sendError(HttpServerExchange exchange, ServiceError error) {
        ObjectNode body = mapper.createObjectNode();
        body.put("success", false);
        ObjectNode err = body.putObject("error");
        err.put("code", error.code());
        err.put("message", error.message());
        ArrayNode details = err.putArray("details");
        for (FieldError fe : error.details()) {
            details.addObject().put("field", fe.field()).put("message", fe.message());
        }
        send(exchange, error.statusCode(), JSON_TYPE, body.toString());
    }

    void badRequest(HttpServerExchange exchange, String message) {
        ObjectNode body = mapper.createObjectNode();
        body.put("success", false);
        body.putObject("error").put("code", "BAD_REQUEST").put("message", message);
        send(exchange, StatusCodes.BAD_REQUEST, JSON_TYPE, body.toString());
    }

    void unauthorized(HttpServerExchange exchange) {
        send(exchange, StatusCodes.UNAUTHORIZED, JSON_TYPE, "{\"success\":false,\"error\":{\"code\":\"UNAUTHORIZED\"}}");
    }

    static void send(HttpServerExchange exchange, int status, String contentType, String body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(body, StandardCharsets.UTF_8);
    }

    /**
     * Read the body, then run the handler. Unparseable JSON becomes a 400.
     */
    void withBody(HttpServerExchange exchange, BodyHandler handler) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                handler.handle(ex, body);
            } catch (JsonProcessingException e) {
                log.warn("Bad request body on {}: {}", ex.getRequestPath(), e.getOriginalMessage());
                badRequest(ex, "Invalid request body: " + e.getOriginalMessage());
            } catch (IllegalArgumentException e) {
                log.warn("Bad request body on {}: {}", ex.getRequestPath(), e.getMessage());
                badRequest(ex, "Invalid request body: " + e.getMessage());
            }
        }, StandardCharsets.UTF_8);
    }

    @FunctionalInterface
    interface BodyHandler {
        void handle(HttpServerExchange exchange, String body) throws JsonProcessingException;
    }
}
