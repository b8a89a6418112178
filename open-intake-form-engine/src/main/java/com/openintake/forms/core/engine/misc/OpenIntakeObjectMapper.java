package com.openintake.forms.core.engine.misc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;
import java.util.Map;

/**
 * Shared, pre-configured Jackson mapper of the engine.
 */
public final class OpenIntakeObjectMapper {

    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper = new ObjectMapper();

    private OpenIntakeObjectMapper() {
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    private static final class SingletonHolder {
        private static final OpenIntakeObjectMapper INSTANCE = new OpenIntakeObjectMapper();
    }

    public static OpenIntakeObjectMapper getInstance() {
        return SingletonHolder.INSTANCE;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public <T> T convertValue(Object fromValue, Class<T> toValueType) throws IllegalArgumentException {
        return objectMapper.convertValue(fromValue, toValueType);
    }

    public List<Object> readList(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, LIST_TYPE);
    }

    public Map<String, Object> readMap(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, MAP_TYPE);
    }

    public String write(Object value) throws JsonProcessingException {
        return objectMapper.writeValueAsString(value);
    }
}
