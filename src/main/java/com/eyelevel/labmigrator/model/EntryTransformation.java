package com.eyelevel.labmigrator.model;

import java.util.List;

/**
 * The transformed elements of one entry in display order, plus the elements that could not be transformed.
 */
public record EntryTransformation(Entry entry, List<TransformedUnit> units, List<MigrationFailure> failures) {

    public EntryTransformation {
        units = List.copyOf(units);
        failures = List.copyOf(failures);
    }
}
