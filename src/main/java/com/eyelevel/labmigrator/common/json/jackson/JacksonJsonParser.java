package com.eyelevel.labmigrator.common.json.jackson;


import com.eyelevel.labmigrator.common.json.JsonParser;
import com.eyelevel.labmigrator.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Implementation of the {@link JsonParser} interface backed by the application's {@link ObjectMapper}.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        if (json == null) {
            throw new JsonParsingException("Cannot parse null JSON string into " + valueType.getSimpleName(), null);
        }
        return parseJson(json.getBytes(StandardCharsets.UTF_8), valueType);
    }

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        return parseJson(jsonBytes, valueType);
    }

    @Override
    public JsonNode parseTree(byte[] jsonBytes) {
        try {
            return objectMapper.readTree(jsonBytes);
        } catch (IOException e) {
            log.error("Error parsing JSON byte array into a tree", e);
            throw new JsonParsingException("Error parsing JSON tree", e);
        }
    }

    private <T> T parseJson(byte[] jsonBytes, Class<T> valueType) {
        log.trace("Parsing JSON with Class: {}", valueType.getName());
        try {
            return objectMapper.readValue(jsonBytes, valueType);
        } catch (IOException e) {
            log.error("Error parsing JSON with Class: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON into " + valueType.getSimpleName(), e);
        }
    }
}
