package com.eyelevel.labmigrator.service.group;

import com.eyelevel.labmigrator.model.Entry;
import com.eyelevel.labmigrator.model.ProjectGroup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions entries by Labfolder project. Groups come out in the order their first entry was seen and keep
 * entry order; entries without a project share the {@link ProjectGroup#UNGROUPED_KEY} group. Groups are keyed by
 * {@link ProjectGroup#keyFor(String)}, so a project that is really called "ungrouped" stays separate.
 */
@Slf4j
@Component
public class ProjectGrouper {

    public LinkedHashMap<String, ProjectGroup> group(List<Entry> entries) {
        // null stands for "no project"
        Map<String, List<Entry>> byProject = new LinkedHashMap<>();
        for (Entry entry : entries) {
            byProject.computeIfAbsent(normalize(entry.getProjectId()), projectId -> new ArrayList<>()).add(entry);
        }

        LinkedHashMap<String, ProjectGroup> groups = new LinkedHashMap<>();
        byProject.forEach((projectId, groupEntries) -> groups.put(
                ProjectGroup.keyFor(projectId), new ProjectGroup(projectId, groupEntries)));
        log.info("Grouped {} entries into {} project group(s).", entries.size(), groups.size());
        return groups;
    }

    private static String normalize(String projectId) {
        return projectId == null || projectId.isBlank() ? null : projectId.strip();
    }
}
