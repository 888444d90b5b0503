package com.eyelevel.labmigrator.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Aggregated outcome of one migration run. Written concurrently by group imports, hence the atomic
 * counters and concurrent collections.
 */
public class RunReport {

    @Getter
    @Setter
    private volatile MigrationStage stage = MigrationStage.FETCH_OR_LOAD;

    @Getter
    @Setter
    private volatile boolean loadedFromCache;

    @Getter
    @Setter
    private volatile int entriesFetched;

    @Getter
    @Setter
    private volatile int groupsTotal;

    private final AtomicInteger groupsImported = new AtomicInteger();
    private final AtomicInteger groupsSkipped = new AtomicInteger();
    private final AtomicInteger attachmentsUploaded = new AtomicInteger();
    private final List<MigrationFailure> failures = new CopyOnWriteArrayList<>();
    private final Map<String, String> experimentsByProject = new ConcurrentHashMap<>();

    public void recordFailure(MigrationFailure failure) {
        failures.add(failure);
    }

    public void recordFailures(List<MigrationFailure> newFailures) {
        failures.addAll(newFailures);
    }

    /**
     * Folds one group's outcome into the totals.
     */
    public void recordGroupResult(GroupImportResult result) {
        switch (result.status()) {
            case IMPORTED -> groupsImported.incrementAndGet();
            case SKIPPED -> groupsSkipped.incrementAndGet();
            case FAILED -> {
                // counted through its GROUP failure
            }
        }
        attachmentsUploaded.addAndGet(result.uploads().size());
        failures.addAll(result.failures());
        if (result.experimentId() != null) {
            experimentsByProject.put(ProjectGroup.keyFor(result.projectId()), result.experimentId());
        }
    }

    public int getGroupsImported() {
        return groupsImported.get();
    }

    public int getGroupsSkipped() {
        return groupsSkipped.get();
    }

    public int getAttachmentsUploaded() {
        return attachmentsUploaded.get();
    }

    public List<MigrationFailure> getFailures() {
        return Collections.unmodifiableList(new ArrayList<>(failures));
    }

    public List<MigrationFailure> getFailures(FailureSeverity severity) {
        return failures.stream().filter(f -> f.severity() == severity).toList();
    }

    public Map<String, String> getExperimentsByProject() {
        return Map.copyOf(experimentsByProject);
    }

    public boolean isCompleted() {
        return stage == MigrationStage.DONE;
    }

    public Map<FailureSeverity, Integer> failureCounts() {
        Map<FailureSeverity, Integer> counts = new EnumMap<>(FailureSeverity.class);
        failures.forEach(f -> counts.merge(f.severity(), 1, Integer::sum));
        return counts;
    }

    public String summary() {
        return "stage=%s, entries_fetched=%d%s, groups_total=%d, groups_imported=%d, groups_skipped=%d, attachments_uploaded=%d, failures=%d %s"
                .formatted(stage, entriesFetched, loadedFromCache ? " (from cache)" : "", groupsTotal,
                           getGroupsImported(), getGroupsSkipped(), getAttachmentsUploaded(), failures.size(),
                           failureCounts());
    }
}
