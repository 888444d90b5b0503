package com.eyelevel.labmigrator.common.json;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Defines the contract for parsing JSON data returned by the remote APIs and read from cache files.
 */
public interface JsonParser {

    /**
     * Parses JSON data from a string into a Java object of the specified type.
     *
     * @throws com.eyelevel.labmigrator.exception.json.JsonParsingException if the JSON cannot be parsed.
     */
    <T> T parseObject(String json, Class<T> valueType);

    /**
     * Parses JSON data from a byte array into a Java object of the specified type.
     *
     * @throws com.eyelevel.labmigrator.exception.json.JsonParsingException if the JSON cannot be parsed.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);

    /**
     * Parses JSON data into a generic tree, for payloads whose shape is only known at runtime
     * (SpreadJS sheets, well plate layouts).
     *
     * @throws com.eyelevel.labmigrator.exception.json.JsonParsingException if the JSON cannot be parsed.
     */
    JsonNode parseTree(byte[] jsonBytes);
}
