package dumb.lolli.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;

import static dumb.lolli.util.Log.error;

/** The shared mapper for formulas, proofs, terms and configuration. */
public class Json {

    /** Nullary formulas and terms ({@code 1}, {@code ⊤}, {@code ()}) serialize as their type tag alone. */
    public static final ObjectMapper the = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    public static String str(Object obj) {
        try {
            return the.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            error("Error serializing " + obj.getClass().getSimpleName() + " to JSON: " + e.getMessage());
            return "{}";
        }
    }

    public static <T> T obj(String json, Class<T> type) throws JsonProcessingException {
        return the.readValue(json, type);
    }

    public static <T> T obj(InputStream in, Class<T> type) throws IOException {
        return the.readValue(in, type);
    }
}
