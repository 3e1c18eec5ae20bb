package io.planduck.http.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Turns {@link HttpException} thrown by a handler into a plain text response with its status code.
 * Anything else that escapes the handler becomes a 500.
 */
public abstract class AbstractService implements HttpHandler {

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    protected static final Logger logger = LoggerFactory.getLogger(AbstractService.class);

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            handleInternal(exchange);
        } catch (HttpException e) {
            if (e instanceof InternalErrorException) {
                logger.atError().setCause(e).log("Error");
            }
            sendText(exchange, e.errorCode, e.getMessage());
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Unexpected error handling {} {}", exchange.getRequestMethod(), exchange.getRequestURI());
            sendText(exchange, 500, "Internal server error: " + e.getMessage());
        } finally {
            exchange.close();
        }
    }

    protected abstract void handleInternal(HttpExchange exchange) throws IOException;

    protected static void requireMethod(HttpExchange exchange, String method) {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", method + ", OPTIONS");
            throw new MethodNotAllowedException(exchange.getRequestMethod());
        }
    }

    protected static void sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        var bytes = MAPPER.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        send(exchange, status, bytes);
    }

    protected static void sendText(HttpExchange exchange, int status, String text) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        send(exchange, status, text.getBytes(StandardCharsets.UTF_8));
    }

    private static void send(HttpExchange exchange, int status, byte[] bytes) throws IOException {
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (var os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }
}
