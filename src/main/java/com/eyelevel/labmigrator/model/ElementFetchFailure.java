package com.eyelevel.labmigrator.model;

/**
 * Marks an element of an entry whose payload could not be downloaded. The element itself is left out of
 * the entry.
 */
public record ElementFetchFailure(String elementId, String elementType, String reason) {
}
