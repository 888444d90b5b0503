package com.eyelevel.labmigrator.common.json.jackson;


import com.eyelevel.labmigrator.common.json.JsonSerializer;
import com.eyelevel.labmigrator.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component("jacksonJsonSerializer")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonSerializer implements JsonSerializer {

    private final ObjectMapper objectMapper;

    @Override
    public <T> String serialize(T object) {
        return serialize(object, false);
    }

    @Override
    public <T> String serialize(T object, boolean prettyPrint) {
        try {
            if (prettyPrint) {
                return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(object);
            }
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            log.error("Error serializing {} to JSON", object == null ? "null" : object.getClass().getName(), e);
            throw new JsonParsingException("Error serializing Java object to JSON", e);
        }
    }
}
