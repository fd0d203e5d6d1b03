package com.shellysvn.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON terminal output for the CLI: results on stdout, errors on stderr.
 */
public class JsonOutput {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private JsonOutput() {
        // utility class
    }

    public static void result(Object value) {
        System.out.println(toJson(value));
    }

    public static void error(String message) {
        var body = new LinkedHashMap<String, Object>();
        body.put("error", true);
        body.put("message", message);
        System.err.println(toJson(body));
    }

    public static void error(String message, Map<String, ?> details) {
        var body = new LinkedHashMap<String, Object>();
        body.put("error", true);
        body.put("message", message);
        body.putAll(details);
        System.err.println(toJson(body));
    }

    static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
