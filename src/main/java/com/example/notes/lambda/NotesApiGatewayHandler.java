package com.example.notes.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPResponse;
import com.example.notes.access.DynamoNoteAccess;
import com.example.notes.access.NoteAccess;
import com.example.notes.codec.NoteCodec;
import com.example.notes.config.NotesProperties;
import com.example.notes.handler.CreateNoteHandler;
import com.example.notes.handler.DeleteNoteHandler;
import com.example.notes.handler.ListNotesHandler;
import com.example.notes.handler.NoteHandler;
import com.example.notes.handler.NoteRequest;
import com.example.notes.handler.NoteResponse;
import com.example.notes.handler.UpdateNoteHandler;
import com.example.notes.http.RequestIdFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * AWS Lambda entry point for API Gateway HTTP API (payload 2.0) events. Dispatches on the route
 * key ("METHOD /path") to the same handlers the REST controller uses.
 */
@Slf4j
public class NotesApiGatewayHandler
        implements RequestHandler<APIGatewayV2HTTPEvent, APIGatewayV2HTTPResponse> {

    static final String CREATE_ROUTE = "POST /notes";
    static final String LIST_ROUTE = "GET /notes";
    static final String UPDATE_ROUTE = "PUT /notes/{id}";
    static final String DELETE_ROUTE = "DELETE /notes/{id}";

    static final String ROUTE_NOT_FOUND = "Route not found";
    static final String INTERNAL_ERROR = "Internal server error";

    private final Map<String, NoteHandler> routes;
    private final NoteCodec codec;

    /**
     * Runtime constructor: settings come from the environment and the DynamoDB client is built once
     * per container.
     */
    public NotesApiGatewayHandler() {
        this(NotesProperties.fromEnvironment(System::getenv), DynamoClientHolder.CLIENT);
    }

    NotesApiGatewayHandler(NotesProperties properties, DynamoDbClient dynamo) {
        this(properties,
                new DynamoNoteAccess(
                        DynamoDbEnhancedClient.builder().dynamoDbClient(dynamo).build(),
                        dynamo,
                        properties),
                new NoteCodec(new ObjectMapper(), Clock.systemUTC(), () -> UUID.randomUUID().toString()));
    }

    public NotesApiGatewayHandler(NotesProperties properties, NoteAccess noteAccess, NoteCodec codec) {
        this.codec = codec;
        this.routes = Map.of(
                CREATE_ROUTE, new CreateNoteHandler(properties, noteAccess, codec),
                LIST_ROUTE, new ListNotesHandler(properties, noteAccess, codec),
                UPDATE_ROUTE, new UpdateNoteHandler(properties, noteAccess, codec),
                DELETE_ROUTE, new DeleteNoteHandler(properties, noteAccess, codec));
    }

    @Override
    public APIGatewayV2HTTPResponse handleRequest(APIGatewayV2HTTPEvent event, Context context) {
        String requestId = RequestIdFilter.resolve(requestIdOf(event, context));
        MDC.put(RequestIdFilter.MDC_KEY, requestId);
        try {
            String route = event.getRouteKey();
            NoteHandler handler = route == null ? null : routes.get(route);
            if (handler == null) {
                log.warn("No handler for route {}", route);
                return toResponse(codec.error(404, ROUTE_NOT_FOUND), requestId);
            }
            NoteRequest request = new NoteRequest(event.getPathParameters(), decodeBody(event));
            return toResponse(handler.handle(request), requestId);
        } catch (RuntimeException ex) {
            log.error("Unexpected error handling API Gateway event", ex);
            return toResponse(codec.error(500, INTERNAL_ERROR), requestId);
        } finally {
            MDC.remove(RequestIdFilter.MDC_KEY);
        }
    }

    // The gateway's own request id wins over the Lambda invocation id.
    private static String requestIdOf(APIGatewayV2HTTPEvent event, Context context) {
        if (event.getRequestContext() != null && event.getRequestContext().getRequestId() != null) {
            return event.getRequestContext().getRequestId();
        }
        return context == null ? null : context.getAwsRequestId();
    }

    private static String decodeBody(APIGatewayV2HTTPEvent event) {
        String body = event.getBody();
        if (body == null || !event.getIsBase64Encoded()) {
            return body;
        }
        try {
            return new String(Base64.getDecoder().decode(body), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            // Left as-is; the codec reports it as an unparseable body.
            log.warn("Body flagged as base64 but could not be decoded: {}", ex.getMessage());
            return body;
        }
    }

    private static APIGatewayV2HTTPResponse toResponse(NoteResponse response, String requestId) {
        Map<String, String> headers = new HashMap<>(response.headers());
        headers.put(RequestIdFilter.HEADER, requestId);

        APIGatewayV2HTTPResponse out = new APIGatewayV2HTTPResponse();
        out.setStatusCode(response.statusCode());
        out.setHeaders(headers);
        out.setBody(response.body());
        return out;
    }

    private static final class DynamoClientHolder {
        private static final DynamoDbClient CLIENT = DynamoDbClient.create();
    }
}
