package com.eyelevel.labmigrator.model;

import java.util.List;

/**
 * All entries that share one Labfolder project; imported as one eLabFTW experiment.
 *
 * @param projectId The Labfolder project id, or {@code null} for the ungrouped bucket.
 * @param entries   The entries in fetch order.
 */
public record ProjectGroup(String projectId, List<Entry> entries) {

    public static final String UNGROUPED_KEY = "ungrouped";

    private static final String ESCAPED_KEY_PREFIX = "project:";

    public ProjectGroup {
        entries = List.copyOf(entries);
    }

    public boolean isUngrouped() {
        return projectId == null;
    }

    public String key() {
        return keyFor(projectId);
    }

    /**
     * The group key of a project id: {@link #UNGROUPED_KEY} for {@code null}, the id itself otherwise. Ids that
     * would clash with the reserved key or with an escaped key are prefixed with {@code project:}, so distinct
     * ids always get distinct keys.
     */
    public static String keyFor(String projectId) {
        if (projectId == null) {
            return UNGROUPED_KEY;
        }
        if (projectId.equals(UNGROUPED_KEY) || projectId.startsWith(ESCAPED_KEY_PREFIX)) {
            return ESCAPED_KEY_PREFIX + projectId;
        }
        return projectId;
    }

    /**
     * The experiment title: the project title of the first entry that has one.
     */
    public String title() {
        return entries.stream()
                .map(Entry::getProjectTitle)
                .filter(t -> t != null && !t.isBlank())
                .findFirst()
                .orElse(isUngrouped() ? "Labfolder entries without project" : "Labfolder project " + projectId);
    }

    /**
     * The union of entry tags, in first-seen order.
     */
    public List<String> tags() {
        return entries.stream()
                .filter(e -> e.getTags() != null)
                .flatMap(e -> e.getTags().stream())
                .filter(t -> t != null && !t.isBlank())
                .distinct()
                .toList();
    }

    public Entry firstEntry() {
        return entries.isEmpty() ? null : entries.get(0);
    }
}
