package io.planduck.http.server;

import com.sun.net.httpserver.HttpExchange;
import io.planduck.commons.scheduler.JobScheduler;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * {@code POST /run-query}: the body is the plan text. Waits for the job and answers with a
 * {@link QueryResponse}; a failed job is still a 200.
 */
public class QueryService extends AbstractService {

    private final JobScheduler scheduler;

    public QueryService(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    protected void handleInternal(HttpExchange exchange) throws IOException {
        requireMethod(exchange, "POST");
        var plan = readBody(exchange);
        logger.info("Received query: {}", plan);
        try {
            var handle = scheduler.enqueue(plan);
            var result = handle.await();
            sendJson(exchange, 200, QueryResponse.of(handle, result));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InternalErrorException("Interrupted while waiting for the query", e);
        } catch (IllegalStateException e) {
            throw new InternalErrorException(e.getMessage(), e);
        }
    }

    private static String readBody(HttpExchange exchange) throws IOException {
        byte[] bytes;
        try (var in = exchange.getRequestBody()) {
            bytes = in.readAllBytes();
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new BadRequestException("Request body is not valid UTF-8", e);
        }
    }
}
