package com.eyelevel.labmigrator.model;

/**
 * Stages of one migration run, in execution order.
 */
public enum MigrationStage {
    FETCH_OR_LOAD,
    CACHE_WRITE,
    GROUP,
    TRANSFORM,
    IMPORT,
    DONE,
    ABORTED
}
