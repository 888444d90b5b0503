package com.eyelevel.labmigrator.service.coordinator;

import com.eyelevel.labmigrator.config.MigrationConfig;
import com.eyelevel.labmigrator.exception.CacheUnavailableException;
import com.eyelevel.labmigrator.exception.ExportException;
import com.eyelevel.labmigrator.exception.MigrationAbortedException;
import com.eyelevel.labmigrator.model.ElementFetchFailure;
import com.eyelevel.labmigrator.model.Entry;
import com.eyelevel.labmigrator.model.EntryTransformation;
import com.eyelevel.labmigrator.model.GroupImportResult;
import com.eyelevel.labmigrator.model.ImportStatus;
import com.eyelevel.labmigrator.model.MigrationFailure;
import com.eyelevel.labmigrator.model.MigrationStage;
import com.eyelevel.labmigrator.model.ProjectGroup;
import com.eyelevel.labmigrator.model.RunReport;
import com.eyelevel.labmigrator.service.cache.EntryCacheStore;
import com.eyelevel.labmigrator.service.cache.factory.EntryCacheStoreFactory;
import com.eyelevel.labmigrator.service.export.XhtmlExportStore;
import com.eyelevel.labmigrator.service.fetch.LabfolderFetcherService;
import com.eyelevel.labmigrator.service.group.ProjectGrouper;
import com.eyelevel.labmigrator.service.importer.ExperimentImportService;
import com.eyelevel.labmigrator.service.transform.ElementTransformerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Runs one migration: fetch (or load the cache), write the cache, group by project, transform, import.
 *
 * <p>Anything that fails before the import stage aborts the run with {@link MigrationAbortedException} and no
 * eLabFTW writes. From the import stage on, failures are collected in the {@link RunReport} and the run
 * finishes. Groups are imported on the {@code importTaskExecutor}, whose pool size bounds concurrent groups.
 */
@Slf4j
@Service
public class MigrationCoordinator {

    private final LabfolderFetcherService fetcherService;
    private final EntryCacheStoreFactory cacheStoreFactory;
    private final ProjectGrouper projectGrouper;
    private final ElementTransformerService transformerService;
    private final ExperimentImportService importService;
    private final AsyncTaskExecutor importTaskExecutor;
    private final XhtmlExportStore xhtmlExportStore;
    private final MigrationConfig migrationConfig;

    public MigrationCoordinator(LabfolderFetcherService fetcherService,
                                EntryCacheStoreFactory cacheStoreFactory,
                                ProjectGrouper projectGrouper,
                                ElementTransformerService transformerService,
                                ExperimentImportService importService,
                                @Qualifier("importTaskExecutor") AsyncTaskExecutor importTaskExecutor,
                                XhtmlExportStore xhtmlExportStore,
                                MigrationConfig migrationConfig) {
        this.fetcherService = fetcherService;
        this.cacheStoreFactory = cacheStoreFactory;
        this.projectGrouper = projectGrouper;
        this.transformerService = transformerService;
        this.importService = importService;
        this.importTaskExecutor = importTaskExecutor;
        this.xhtmlExportStore = xhtmlExportStore;
        this.migrationConfig = migrationConfig;
    }

    /**
     * @return The report of a run that reached {@link MigrationStage#DONE}.
     * @throws MigrationAbortedException if the run stopped before importing; carries the report.
     */
    public RunReport run() {
        RunReport report = new RunReport();
        Map<String, ProjectGroup> groups;
        Map<String, List<EntryTransformation>> transformations;
        try {
            report.setStage(MigrationStage.FETCH_OR_LOAD);
            List<Entry> entries = fetchOrLoad(report);
            report.setEntriesFetched(entries.size());
            recordFetchFailures(entries, report);

            if (!report.isLoadedFromCache()) {
                report.setStage(MigrationStage.CACHE_WRITE);
                writeCache(entries, report);
            }

            report.setStage(MigrationStage.GROUP);
            groups = restrictToXhtmlExport(projectGrouper.group(entries));
            report.setGroupsTotal(groups.size());

            report.setStage(MigrationStage.TRANSFORM);
            transformations = transform(groups, report);
        } catch (RuntimeException e) {
            throw abort(report, e);
        }

        report.setStage(MigrationStage.IMPORT);
        importGroups(groups, transformations, report);

        report.setStage(MigrationStage.DONE);
        logReport(report);
        return report;
    }

    private List<Entry> fetchOrLoad(RunReport report) {
        MigrationConfig.Cache cache = migrationConfig.getCache();
        if (cache.isUseCache()) {
            if (cache.getPath() == null) {
                throw new CacheUnavailableException("Reading from cache was requested but no cache path is set");
            }
            List<Entry> cached = storeFor(cache.getPath()).load(cache.getPath());
            report.setLoadedFromCache(true);
            return filterByAuthors(cached);
        }
        return fetcherService.fetchEntries(migrationConfig.getAuthors());
    }

    /**
     * The cache holds whatever the fetching run selected; the current author filter is applied again.
     */
    private List<Entry> filterByAuthors(List<Entry> entries) {
        List<String> filters = migrationConfig.getAuthors().stream()
                .filter(Objects::nonNull)
                .filter(a -> !a.isBlank())
                .toList();
        if (filters.isEmpty()) {
            return entries;
        }
        return entries.stream()
                .filter(e -> e.getAuthor() != null && filters.stream().anyMatch(e.getAuthor()::matches))
                .toList();
    }

    private void writeCache(List<Entry> entries, RunReport report) {
        Path path = migrationConfig.getCache().getPath();
        if (path == null) {
            log.debug("No cache path configured; not caching entries.");
            return;
        }
        try {
            storeFor(path).save(path, entries);
        } catch (CacheUnavailableException e) {
            log.warn("Writing the entry cache failed, continuing without it: {}", e.getMessage());
            report.recordFailure(MigrationFailure.cache(e.getMessage()));
        }
    }

    private EntryCacheStore storeFor(Path path) {
        return cacheStoreFactory.getStore(migrationConfig.getCache().getFormat(), path)
                .orElseThrow(() -> new CacheUnavailableException("No cache store for " + path));
    }

    private static void recordFetchFailures(List<Entry> entries, RunReport report) {
        for (Entry entry : entries) {
            for (ElementFetchFailure failure : entry.getFetchFailures()) {
                report.recordFailure(MigrationFailure.entry(entry.getProjectId(), entry.getId(), failure.elementId(),
                                                            "Fetching " + failure.elementType() + " element failed: "
                                                            + failure.reason()));
            }
        }
    }

    /**
     * Picks the XHTML export for this run and, with {@code only-projects-from-xhtml}, drops the groups it does
     * not contain. Entries without a project are never in an export and are dropped too.
     *
     * @throws ExportException if the run is restricted to the export but none is available.
     */
    private Map<String, ProjectGroup> restrictToXhtmlExport(Map<String, ProjectGroup> groups) {
        if (!xhtmlExportStore.isEnabled()) {
            return groups;
        }
        List<String> projectIds = groups.values().stream()
                .filter(group -> !group.isUngrouped())
                .map(ProjectGroup::projectId)
                .toList();
        Optional<Path> root = xhtmlExportStore.prepare(projectIds);
        if (!migrationConfig.getExport().getXhtml().isOnlyProjectsFromXhtml()) {
            return groups;
        }
        if (root.isEmpty()) {
            throw new ExportException("Only projects from the XHTML export were requested but no export is available");
        }

        Map<String, ProjectGroup> kept = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();
        groups.forEach((key, group) -> {
            if (!group.isUngrouped() && xhtmlExportStore.containsProject(root.get(), group.projectId())) {
                kept.put(key, group);
            } else {
                skipped.add(key);
            }
        });
        log.info("Restricting to projects in the XHTML export {}: keeping {}, skipping {}.", root.get(),
                 kept.size(), skipped.size());
        if (!skipped.isEmpty()) {
            log.info("Not in the XHTML export: {}", String.join(", ", skipped));
        }
        return kept;
    }

    private Map<String, List<EntryTransformation>> transform(Map<String, ProjectGroup> groups, RunReport report) {
        Map<String, List<EntryTransformation>> byGroup = new LinkedHashMap<>();
        groups.forEach((key, group) -> {
            List<EntryTransformation> transformed = new ArrayList<>();
            for (Entry entry : group.entries()) {
                EntryTransformation transformation = transformerService.transformEntry(entry);
                report.recordFailures(transformation.failures());
                transformed.add(transformation);
            }
            byGroup.put(key, transformed);
        });
        return byGroup;
    }

    private void importGroups(Map<String, ProjectGroup> groups, Map<String, List<EntryTransformation>> transformations,
                              RunReport report) {
        Map<String, Future<GroupImportResult>> futures = new LinkedHashMap<>();
        groups.forEach((key, group) -> futures.put(
                key, importTaskExecutor.submit(() -> importService.importGroup(group, transformations.get(key)))));

        for (Map.Entry<String, Future<GroupImportResult>> future : futures.entrySet()) {
            ProjectGroup group = groups.get(future.getKey());
            GroupImportResult result;
            try {
                result = future.getValue().get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result = failed(group, "Interrupted while importing");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.error("Project {}: import failed unexpectedly.", group.key(), cause);
                result = failed(group, "Import failed: " + cause.getMessage());
            }
            report.recordGroupResult(result);
        }
    }

    private static GroupImportResult failed(ProjectGroup group, String message) {
        return new GroupImportResult(group.projectId(), null, ImportStatus.FAILED, null, List.of(),
                                     List.of(MigrationFailure.group(group.projectId(), null, message)));
    }

    private static MigrationAbortedException abort(RunReport report, RuntimeException cause) {
        MigrationStage failedStage = report.getStage();
        report.recordFailure(MigrationFailure.fatal(failedStage + ": " + cause.getMessage()));
        report.setStage(MigrationStage.ABORTED);
        log.error("Migration aborted during {}: {}", failedStage, cause.getMessage(), cause);
        logReport(report);
        return new MigrationAbortedException("Migration aborted during " + failedStage + ": " + cause.getMessage(),
                                             report, cause);
    }

    private static void logReport(RunReport report) {
        log.info("Migration report: {}", report.summary());
        report.getFailures().forEach(failure -> log.warn("  {}", failure));
    }
}
