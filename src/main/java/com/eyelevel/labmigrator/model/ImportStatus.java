package com.eyelevel.labmigrator.model;

public enum ImportStatus {
    /** Experiment created (or resumed) and body plus metadata patched. */
    IMPORTED,
    /** The import ledger shows the project as already migrated. */
    SKIPPED,
    /** Creation failed, or a patch failed after creation. */
    FAILED
}
