package com.eyelevel.labmigrator.model;

public enum FailureSeverity {
    /** Aborted the run before any eLabFTW write. */
    FATAL,
    /** The entry cache could not be written after a fetch; the run went on. */
    CACHE,
    /** One or more elements of an entry could not be fetched. */
    ENTRY,
    /** An element was skipped by the transformer. */
    ELEMENT,
    /** A project group could not be (fully) imported. */
    GROUP,
    /** An upload failed after all retries. */
    ATTACHMENT
}
