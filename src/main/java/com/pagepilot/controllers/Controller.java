package com.pagepilot.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * An HTTP area of the control surface. Each controller registers its routes with the Javalin app.
 */
public interface Controller {

    void registerRoutes(Javalin app);

    /**
     * Parse the request body as a JSON object. A blank body reads as an empty object.
     *
     * @throws IllegalArgumentException when the body is JSON but not an object
     */
    static JsonNode readObject(Context ctx, ObjectMapper mapper) throws JsonProcessingException {
        String body = ctx.body();
        if (body == null || body.isBlank()) {
            return mapper.createObjectNode();
        }
        JsonNode json = mapper.readTree(body);
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
        return json;
    }

    /**
     * 400 for bad input, 409 for a request that conflicts with the session state, 500 otherwise.
     */
    static int statusFor(Exception e) {
        if (e instanceof IllegalArgumentException || e instanceof JsonProcessingException) {
            return 400;
        }
        if (e instanceof IllegalStateException) {
            return 409;
        }
        return 500;
    }

    /**
     * {@code {ok:false, error}}, falling back to the exception type when there is no message.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        return Map.of("ok", false, "error", m);
    }
}
