package com.eyelevel.labmigrator.common.json;

/**
 * Defines the contract for serializing Java objects into JSON data.
 */
public interface JsonSerializer {

    /**
     * Serializes a Java object into its compact JSON representation.
     *
     * @throws com.eyelevel.labmigrator.exception.json.JsonParsingException if serialization fails.
     */
    <T> String serialize(T object);

    /**
     * Serializes a Java object into its JSON representation.
     *
     * @param prettyPrint whether to format the JSON with indentation and line breaks.
     *
     * @throws com.eyelevel.labmigrator.exception.json.JsonParsingException if serialization fails.
     */
    <T> String serialize(T object, boolean prettyPrint);
}
